/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.support;

import org.springframework.web.util.HtmlUtils;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tag lookups on bank XML responses, which come without a schema. Only leaf elements holding
 * text are matched; the first occurrence wins.
 */
public final class XmlTags {
    private XmlTags() {}

    public static Optional<String> find(String xml, String tag) {
        if (xml == null || xml.isEmpty()) return Optional.empty();
        Pattern pattern = Pattern.compile(
                "<" + Pattern.quote(tag) + "(?:\\s[^>]*)?>([^<]*)</" + Pattern.quote(tag) + "\\s*>",
                Pattern.CASE_INSENSITIVE);
        Matcher m = pattern.matcher(xml);
        if (!m.find()) return Optional.empty();
        return Optional.of(HtmlUtils.htmlUnescape(m.group(1).trim()));
    }

    /**
     * Value of the first {@code tag}, or empty string when absent.
     */
    public static String extract(String xml, String tag) {
        return find(xml, tag).orElse("");
    }

    public static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value, "UTF-8");
    }
}

/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.support;

import org.springframework.web.util.HtmlUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Minimal HTML page that posts hidden fields to a bank's 3D Secure gate as soon as it loads.
 * Field order is preserved; every attribute value is HTML-escaped.
 */
public final class AutoSubmitForm {
    private final String action;
    private final Map<String, String> fields = new LinkedHashMap<>();

    private AutoSubmitForm(String action) {
        this.action = action;
    }

    public static AutoSubmitForm postTo(String action) {
        return new AutoSubmitForm(action);
    }

    public AutoSubmitForm field(String name, String value) {
        fields.put(name, value == null ? "" : value);
        return this;
    }

    public Map<String, String> fields() {
        return Map.copyOf(fields);
    }

    public String render() {
        StringBuilder html = new StringBuilder(512 + fields.size() * 64);
        html.append("<!DOCTYPE html>\n")
                .append("<html>\n")
                .append("<head>\n")
                .append("<meta charset=\"UTF-8\">\n")
                .append("<title>3D Secure Payment</title>\n")
                .append("</head>\n")
                .append("<body onload=\"document.forms[0].submit()\">\n")
                .append("<form method=\"post\" action=\"").append(escape(action)).append("\">\n");
        fields.forEach((name, value) -> html
                .append("<input type=\"hidden\" name=\"").append(escape(name))
                .append("\" value=\"").append(escape(value)).append("\">\n"));
        html.append("<noscript><button type=\"submit\">Continue to 3D Secure</button></noscript>\n")
                .append("</form>\n")
                .append("</body>\n")
                .append("</html>\n");
        return html.toString();
    }

    private static String escape(String value) {
        return HtmlUtils.htmlEscape(value, "UTF-8");
    }
}

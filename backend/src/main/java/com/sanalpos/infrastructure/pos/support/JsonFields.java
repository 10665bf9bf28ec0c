/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Key lookups on bank JSON responses. Keys are matched exactly first, then ignoring case.
 */
public final class JsonFields {
    private JsonFields() {}

    /**
     * Parses a response body; anything that is not a JSON object yields a missing node so that
     * every lookup comes back empty.
     */
    public static JsonNode parse(ObjectMapper mapper, String body) {
        if (body == null || body.isBlank()) return MissingNode.getInstance();
        try {
            JsonNode node = mapper.readTree(body);
            return node != null && node.isObject() ? node : MissingNode.getInstance();
        } catch (JsonProcessingException e) {
            return MissingNode.getInstance();
        }
    }

    public static String text(JsonNode node, String key) {
        if (node == null || !node.isObject()) return "";
        JsonNode value = node.get(key);
        if (value == null) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getKey().equalsIgnoreCase(key)) {
                    value = field.getValue();
                    break;
                }
            }
        }
        if (value == null || value.isNull() || value.isContainerNode()) return "";
        return value.asText("");
    }
}

/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fields posted back by a bank after 3D Secure authentication. Banks are inconsistent about key
 * casing ({@code mdStatus} vs {@code mdstatus}), so lookups ignore case.
 */
public final class CallbackData {
    private final Map<String, String> fields;

    private CallbackData(Map<String, String> fields) {
        this.fields = fields;
    }

    public static CallbackData of(Map<String, String> raw) {
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (raw != null) {
            raw.forEach((k, v) -> {
                if (k != null) copy.put(k, v);
            });
        }
        return new CallbackData(Collections.unmodifiableMap(copy));
    }

    public String get(String name) {
        return fields.get(name);
    }

    public boolean has(String name) {
        String value = fields.get(name);
        return value != null && !value.isBlank();
    }

    public Map<String, String> asMap() {
        return fields;
    }

    @Override
    public String toString() {
        return "CallbackData" + fields.keySet();
    }
}

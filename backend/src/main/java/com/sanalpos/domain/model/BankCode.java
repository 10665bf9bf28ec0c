/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.domain.model;

import java.util.Locale;
import java.util.Optional;

public enum BankCode {
    AKBANK,
    ISBANK,
    GARANTI;

    /**
     * Lenient lookup used for path segments and configuration keys ("garanti", "Isbank", "İŞBANK").
     */
    public static Optional<BankCode> find(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String normalized = value.trim()
                .replace('İ', 'I')
                .replace('ı', 'i')
                .replace('Ş', 'S')
                .replace('ş', 's')
                .toUpperCase(Locale.ROOT);
        for (BankCode code : values()) {
            if (code.name().equals(normalized)) return Optional.of(code);
        }
        return Optional.empty();
    }
}

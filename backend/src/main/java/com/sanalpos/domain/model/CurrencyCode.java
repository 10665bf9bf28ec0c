/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * ISO 4217 currencies accepted by the supported banks, with the numeric code they expect on the wire.
 */
public enum CurrencyCode {
    TRY("949"),
    USD("840"),
    EUR("978"),
    GBP("826");

    private final String numericCode;

    CurrencyCode(String numericCode) {
        this.numericCode = numericCode;
    }

    public String numericCode() {
        return numericCode;
    }

    public static Optional<CurrencyCode> find(String isoCode) {
        if (isoCode == null || isoCode.isBlank()) return Optional.empty();
        String normalized = isoCode.trim().toUpperCase(Locale.ROOT);
        for (CurrencyCode code : values()) {
            if (code.name().equals(normalized)) return Optional.of(code);
        }
        return Optional.empty();
    }
}

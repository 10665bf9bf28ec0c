/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos;

import com.sanalpos.domain.model.BankCode;

/**
 * Credentials and endpoints of one bank terminal. Built once at startup and never mutated;
 * new credentials mean a new adapter.
 *
 * <p>{@code storeKey} is only ever used as hash/HMAC input and must never be sent to the bank or
 * logged. {@code callbackBaseUrl} is the application's own public URL, used to derive 3D Secure
 * success/fail URLs when a request does not carry them.
 */
public record BankAdapterConfig(
        BankCode bank,
        String merchantId,
        String terminalId,
        String username,
        String password,
        String storeKey,
        String apiUrl,
        String secure3dUrl,
        boolean testMode,
        String callbackBaseUrl
) {
    public BankAdapterConfig {
        if (bank == null) {
            throw new IllegalArgumentException("bank is required");
        }
        apiUrl = stripTrailingSlash(apiUrl);
        secure3dUrl = stripTrailingSlash(secure3dUrl);
        callbackBaseUrl = stripTrailingSlash(callbackBaseUrl);
    }

    /**
     * Returns the value or fails with a configuration error naming the missing setting.
     */
    public String require(String name, String value) {
        if (value == null || value.isBlank()) {
            throw VirtualPosException.configuration(bank, bank + " virtual POS is not configured: missing " + name);
        }
        return value;
    }

    @Override
    public String toString() {
        return "BankAdapterConfig[bank=" + bank
                + ", merchantId=" + merchantId
                + ", terminalId=" + terminalId
                + ", username=" + username
                + ", apiUrl=" + apiUrl
                + ", secure3dUrl=" + secure3dUrl
                + ", testMode=" + testMode + "]";
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) return null;
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}

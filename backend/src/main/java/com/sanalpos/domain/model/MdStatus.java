/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.domain.model;

/**
 * 3D Secure authentication outcome reported by the bank in the redirect callback.
 */
public enum MdStatus {
    FAILED("0"),
    AUTHENTICATED("1"),
    CARD_NOT_ENROLLED("2"),
    ISSUER_NOT_ENROLLED("3"),
    ATTEMPTED("4"),
    UNABLE_TO_VERIFY("5"),
    THREE_D_ERROR("6"),
    SYSTEM_ERROR("7"),
    UNKNOWN_CARD("8"),
    UNKNOWN(null);

    private final String code;

    MdStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isFullyAuthenticated() {
        return this == AUTHENTICATED;
    }

    public static MdStatus of(String code) {
        if (code == null) return UNKNOWN;
        String trimmed = code.trim();
        for (MdStatus status : values()) {
            if (status.code != null && status.code.equals(trimmed)) return status;
        }
        return UNKNOWN;
    }
}

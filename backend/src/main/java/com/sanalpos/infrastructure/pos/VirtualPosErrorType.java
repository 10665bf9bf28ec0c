/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos;

public enum VirtualPosErrorType {
    VALIDATION,
    CONFIGURATION,
    BANK_NOT_CONFIGURED,
    TIMEOUT,
    CONNECTION,
    HTTP_ERROR,
    UNKNOWN
}

/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.api;

public record ApiErrorResponse(
        String error,
        String code,
        String message,
        String requestId
) {}

/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos;

public record CancelResponse(
        boolean success,
        String transactionId,
        String errorCode,
        String errorMessage,
        String rawResponse
) {
    public static CancelResponse approved(String transactionId, String rawResponse) {
        return new CancelResponse(true, transactionId, null, null, rawResponse);
    }

    public static CancelResponse declined(String errorCode, String errorMessage, String rawResponse) {
        return new CancelResponse(false, null, errorCode, errorMessage, rawResponse);
    }
}

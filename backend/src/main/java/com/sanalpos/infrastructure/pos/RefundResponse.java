/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos;

import java.math.BigDecimal;

public record RefundResponse(
        boolean success,
        String transactionId,
        String refundId,
        BigDecimal amount,
        String errorCode,
        String errorMessage,
        String rawResponse
) {
    public static RefundResponse approved(String transactionId, String refundId, BigDecimal amount, String rawResponse) {
        return new RefundResponse(true, transactionId, refundId, amount, null, null, rawResponse);
    }

    public static RefundResponse declined(String errorCode, String errorMessage, String rawResponse) {
        return new RefundResponse(false, null, null, null, errorCode, errorMessage, rawResponse);
    }
}

/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos;

/**
 * Normalized payment outcome. Bank identifiers are set only on approval, error fields only on
 * decline, and {@code htmlContent} only for a 3D Secure form. {@code rawResponse} is kept for
 * audit and must not be parsed by callers.
 */
public record PaymentResponse(
        boolean success,
        String transactionId,
        String referenceNumber,
        String authCode,
        String provisionNumber,
        String errorCode,
        String errorMessage,
        String htmlContent,
        String rawResponse
) {
    public static PaymentResponse approved(String transactionId, String referenceNumber, String authCode,
                                           String provisionNumber, String rawResponse) {
        return new PaymentResponse(true, transactionId, referenceNumber, authCode, provisionNumber,
                null, null, null, rawResponse);
    }

    public static PaymentResponse declined(String errorCode, String errorMessage, String rawResponse) {
        return new PaymentResponse(false, null, null, null, null, errorCode, errorMessage, null, rawResponse);
    }

    public static PaymentResponse threeDSecureForm(String htmlContent) {
        return new PaymentResponse(true, null, null, null, null, null, null, htmlContent, null);
    }
}

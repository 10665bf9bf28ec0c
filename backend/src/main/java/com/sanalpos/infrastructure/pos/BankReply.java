/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos;

import java.math.BigDecimal;

/**
 * A bank response reduced to the fields every adapter needs. Approval requires the bank's
 * success code to be present and equal to the expected value; an absent code is a failure.
 */
public record BankReply(
        boolean approved,
        String code,
        String message,
        String transactionId,
        String referenceNumber,
        String authCode,
        String provisionNumber
) {
    public static final String MISSING_RESPONSE_CODE = "NO_RESPONSE_CODE";

    public static BankReply of(String code, String successCode, String message, String transactionId,
                               String referenceNumber, String authCode, String provisionNumber) {
        if (code == null || code.isBlank()) {
            String reason = (message == null || message.isBlank())
                    ? "Bank response did not contain a response code"
                    : message;
            return new BankReply(false, MISSING_RESPONSE_CODE, reason, null, null, null, null);
        }
        boolean approved = code.trim().equals(successCode);
        return new BankReply(approved, code.trim(), emptyToNull(message), emptyToNull(transactionId),
                emptyToNull(referenceNumber), emptyToNull(authCode), emptyToNull(provisionNumber));
    }

    public PaymentResponse toPaymentResponse(String raw) {
        if (approved) {
            return PaymentResponse.approved(transactionId, referenceNumber, authCode, provisionNumber, raw);
        }
        return PaymentResponse.declined(code, message, raw);
    }

    public RefundResponse toRefundResponse(String originalTransactionId, BigDecimal amount, String raw) {
        if (approved) {
            String refundId = transactionId != null ? transactionId : referenceNumber;
            return RefundResponse.approved(originalTransactionId, refundId, amount, raw);
        }
        return RefundResponse.declined(code, message, raw);
    }

    public CancelResponse toCancelResponse(String originalTransactionId, String raw) {
        if (approved) {
            return CancelResponse.approved(transactionId != null ? transactionId : originalTransactionId, raw);
        }
        return CancelResponse.declined(code, message, raw);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}

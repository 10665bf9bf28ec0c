/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.signature;

import java.math.BigDecimal;

/**
 * Per-call values a signature engine may draw from. Each engine picks its own subset and order;
 * unused fields stay {@code null}. Derived for one call and discarded.
 *
 * <p>{@code echoedAmount} is the amount exactly as a bank sent it back in a callback. When present
 * it is hashed verbatim instead of re-formatting {@code amount}.
 */
public record SignatureInput(
        String merchantId,
        String terminalId,
        String orderId,
        BigDecimal amount,
        String echoedAmount,
        String currencyCode,
        String cardNumber,
        String successUrl,
        String failUrl,
        String transactionType,
        String installment,
        String transactionStatus,
        String mdStatus,
        String responseCode
) {
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "SignatureInput[orderId=" + orderId + ", terminalId=" + terminalId + "]";
    }

    public static final class Builder {
        private String merchantId;
        private String terminalId;
        private String orderId;
        private BigDecimal amount;
        private String echoedAmount;
        private String currencyCode;
        private String cardNumber;
        private String successUrl;
        private String failUrl;
        private String transactionType;
        private String installment;
        private String transactionStatus;
        private String mdStatus;
        private String responseCode;

        private Builder() {}

        public Builder merchantId(String merchantId) {
            this.merchantId = merchantId;
            return this;
        }

        public Builder terminalId(String terminalId) {
            this.terminalId = terminalId;
            return this;
        }

        public Builder orderId(String orderId) {
            this.orderId = orderId;
            return this;
        }

        public Builder amount(BigDecimal amount) {
            this.amount = amount;
            return this;
        }

        public Builder echoedAmount(String echoedAmount) {
            this.echoedAmount = echoedAmount;
            return this;
        }

        public Builder currencyCode(String currencyCode) {
            this.currencyCode = currencyCode;
            return this;
        }

        public Builder cardNumber(String cardNumber) {
            this.cardNumber = cardNumber;
            return this;
        }

        public Builder successUrl(String successUrl) {
            this.successUrl = successUrl;
            return this;
        }

        public Builder failUrl(String failUrl) {
            this.failUrl = failUrl;
            return this;
        }

        public Builder transactionType(String transactionType) {
            this.transactionType = transactionType;
            return this;
        }

        public Builder installment(String installment) {
            this.installment = installment;
            return this;
        }

        public Builder transactionStatus(String transactionStatus) {
            this.transactionStatus = transactionStatus;
            return this;
        }

        public Builder mdStatus(String mdStatus) {
            this.mdStatus = mdStatus;
            return this;
        }

        public Builder responseCode(String responseCode) {
            this.responseCode = responseCode;
            return this;
        }

        public SignatureInput build() {
            return new SignatureInput(merchantId, terminalId, orderId, amount, echoedAmount, currencyCode,
                    cardNumber, successUrl, failUrl, transactionType, installment, transactionStatus,
                    mdStatus, responseCode);
        }
    }
}

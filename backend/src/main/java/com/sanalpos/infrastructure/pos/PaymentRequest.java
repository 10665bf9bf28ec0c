/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos;

import com.sanalpos.infrastructure.crypto.Cards;

import java.math.BigDecimal;

/**
 * One payment attempt. Card fields live only for the duration of the call; {@link #toString()}
 * masks the card number and never prints the CVV.
 */
public record PaymentRequest(
        String orderId,
        BigDecimal amount,
        String currency,
        int installmentCount,
        String cardNumber,
        String cardHolderName,
        String cardExpireMonth,
        String cardExpireYear,
        String cardCvv,
        String customerName,
        String customerEmail,
        String customerPhone,
        String customerAddress,
        String customerCity,
        String customerCountry,
        String customerIpAddress,
        String successUrl,
        String failUrl,
        String callbackUrl
) {
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Card expiry year as the two digits banks expect on the wire.
     */
    public String expireYearTwoDigits() {
        if (cardExpireYear == null) return null;
        String year = cardExpireYear.trim();
        return year.length() == 4 ? year.substring(2) : year;
    }

    /**
     * Card expiry month zero-padded to two digits.
     */
    public String expireMonthTwoDigits() {
        if (cardExpireMonth == null) return null;
        String month = cardExpireMonth.trim();
        return month.length() == 1 ? "0" + month : month;
    }

    @Override
    public String toString() {
        return "PaymentRequest[orderId=" + orderId
                + ", amount=" + amount
                + ", currency=" + currency
                + ", installmentCount=" + installmentCount
                + ", card=" + (cardNumber == null ? null : Cards.mask(cardNumber))
                + ", cvv=***"
                + ", customerEmail=" + customerEmail + "]";
    }

    public static final class Builder {
        private String orderId;
        private BigDecimal amount;
        private String currency = "TRY";
        private int installmentCount = 1;
        private String cardNumber;
        private String cardHolderName;
        private String cardExpireMonth;
        private String cardExpireYear;
        private String cardCvv;
        private String customerName;
        private String customerEmail;
        private String customerPhone;
        private String customerAddress;
        private String customerCity;
        private String customerCountry;
        private String customerIpAddress;
        private String successUrl;
        private String failUrl;
        private String callbackUrl;

        private Builder() {}

        public Builder orderId(String orderId) {
            this.orderId = orderId;
            return this;
        }

        public Builder amount(BigDecimal amount) {
            this.amount = amount;
            return this;
        }

        public Builder amount(String amount) {
            this.amount = new BigDecimal(amount);
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder installmentCount(int installmentCount) {
            this.installmentCount = installmentCount;
            return this;
        }

        public Builder card(String number, String holderName, String expireMonth, String expireYear, String cvv) {
            this.cardNumber = number;
            this.cardHolderName = holderName;
            this.cardExpireMonth = expireMonth;
            this.cardExpireYear = expireYear;
            this.cardCvv = cvv;
            return this;
        }

        public Builder customer(String name, String email, String phone) {
            this.customerName = name;
            this.customerEmail = email;
            this.customerPhone = phone;
            return this;
        }

        public Builder address(String address, String city, String country) {
            this.customerAddress = address;
            this.customerCity = city;
            this.customerCountry = country;
            return this;
        }

        public Builder customerIpAddress(String customerIpAddress) {
            this.customerIpAddress = customerIpAddress;
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

        public Builder callbackUrl(String callbackUrl) {
            this.callbackUrl = callbackUrl;
            return this;
        }

        public PaymentRequest build() {
            return new PaymentRequest(
                    orderId,
                    amount,
                    currency,
                    installmentCount,
                    cardNumber,
                    cardHolderName,
                    cardExpireMonth,
                    cardExpireYear,
                    cardCvv,
                    customerName,
                    customerEmail,
                    customerPhone,
                    customerAddress,
                    customerCity,
                    customerCountry,
                    customerIpAddress,
                    successUrl,
                    failUrl,
                    callbackUrl
            );
        }
    }
}

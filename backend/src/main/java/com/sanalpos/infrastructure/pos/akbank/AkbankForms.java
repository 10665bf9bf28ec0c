/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.akbank;

import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/**
 * URL-encoded field sets posted to Akbank's {@code /fim/api}. Empty values are left out.
 */
final class AkbankForms {
    static final String TYPE_AUTH = "Auth";
    static final String TYPE_CREDIT = "Credit";
    static final String TYPE_VOID = "Void";

    private AkbankForms() {}

    static MultiValueMap<String, String> sale(String clientId, String orderId, String amount, String currency,
                                              String installment, String cardNumber, String expireMonth,
                                              String expireYear, String cvv, String email, String hash) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        put(form, "clientId", clientId);
        put(form, "oid", orderId);
        put(form, "islemtipi", TYPE_AUTH);
        put(form, "amount", amount);
        put(form, "currency", currency);
        put(form, "taksit", installment);
        put(form, "pan", cardNumber);
        put(form, "Ecom_Payment_Card_ExpDate_Month", expireMonth);
        put(form, "Ecom_Payment_Card_ExpDate_Year", expireYear);
        put(form, "cv2", cvv);
        put(form, "email", email);
        put(form, "hash", hash);
        return form;
    }

    static MultiValueMap<String, String> refund(String clientId, String orderId, String transactionId,
                                                String amount, String currency, String hash) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        put(form, "clientId", clientId);
        put(form, "oid", orderId);
        put(form, "islemtipi", TYPE_CREDIT);
        put(form, "transId", transactionId);
        put(form, "amount", amount);
        put(form, "currency", currency);
        put(form, "hash", hash);
        return form;
    }

    static MultiValueMap<String, String> cancel(String clientId, String orderId, String transactionId, String hash) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        put(form, "clientId", clientId);
        put(form, "oid", orderId);
        put(form, "islemtipi", TYPE_VOID);
        put(form, "transId", transactionId);
        put(form, "hash", hash);
        return form;
    }

    private static void put(MultiValueMap<String, String> form, String name, String value) {
        if (value != null && !value.isEmpty()) {
            form.add(name, value);
        }
    }
}

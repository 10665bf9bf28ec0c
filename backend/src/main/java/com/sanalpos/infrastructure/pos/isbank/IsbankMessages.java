/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.isbank;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON bodies for İşbank's {@code /vpos} endpoints, as ordered maps serialized by the WebClient
 * codecs. Null and empty values are left out.
 */
final class IsbankMessages {
    static final String TYPE_SALE = "SALE";
    static final String TYPE_REFUND = "REFUND";
    static final String TYPE_CANCEL = "CANCEL";

    private IsbankMessages() {}

    record Card(String number, String holderName, String expiryMonth, String expiryYear, String cvv) {}

    record Customer(String name, String email, String phone, String ipAddress) {}

    static Map<String, Object> payment(String merchantId, String terminalId, String orderId, String amount,
                                       String currency, int installment, Card card, Customer customer,
                                       String hash) {
        Map<String, Object> body = header(merchantId, terminalId, orderId, TYPE_SALE);
        put(body, "amount", amount);
        put(body, "currency", currency);
        body.put("installment", installment);

        Map<String, Object> cardJson = new LinkedHashMap<>();
        put(cardJson, "number", card.number());
        put(cardJson, "holderName", card.holderName());
        put(cardJson, "expiryMonth", card.expiryMonth());
        put(cardJson, "expiryYear", card.expiryYear());
        put(cardJson, "cvv", card.cvv());
        body.put("card", cardJson);

        Map<String, Object> customerJson = new LinkedHashMap<>();
        put(customerJson, "name", customer.name());
        put(customerJson, "email", customer.email());
        put(customerJson, "phone", customer.phone());
        put(customerJson, "ipAddress", customer.ipAddress());
        if (!customerJson.isEmpty()) {
            body.put("customer", customerJson);
        }

        put(body, "hash", hash);
        return body;
    }

    static Map<String, Object> refund(String merchantId, String terminalId, String orderId,
                                      String originalTransactionId, String amount, String currency,
                                      String reason, String hash) {
        Map<String, Object> body = header(merchantId, terminalId, orderId, TYPE_REFUND);
        put(body, "originalTransactionId", originalTransactionId);
        put(body, "amount", amount);
        put(body, "currency", currency);
        put(body, "reason", reason);
        put(body, "hash", hash);
        return body;
    }

    static Map<String, Object> cancel(String merchantId, String terminalId, String orderId,
                                      String originalTransactionId, String authCode, String hash) {
        Map<String, Object> body = header(merchantId, terminalId, orderId, TYPE_CANCEL);
        put(body, "originalTransactionId", originalTransactionId);
        put(body, "authCode", authCode);
        put(body, "hash", hash);
        return body;
    }

    private static Map<String, Object> header(String merchantId, String terminalId, String orderId, String type) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("merchantId", merchantId);
        body.put("terminalId", terminalId);
        body.put("orderId", orderId);
        body.put("transactionType", type);
        return body;
    }

    private static void put(Map<String, Object> body, String name, String value) {
        if (value != null && !value.isEmpty()) {
            body.put(name, value);
        }
    }
}

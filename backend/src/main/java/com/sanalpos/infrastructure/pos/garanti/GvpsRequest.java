/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.garanti;

import static com.sanalpos.infrastructure.pos.support.XmlTags.escape;

/**
 * Garanti's {@code GVPSRequest} envelope. Optional sections and elements left {@code null} are
 * omitted from the rendered XML.
 */
record GvpsRequest(
        String mode,
        String version,
        Terminal terminal,
        Customer customer,
        Card card,
        Order order,
        Transaction transaction
) {
    record Terminal(String provUserId, String hashData, String userId, String id, String merchantId) {}

    record Customer(String ipAddress, String emailAddress) {}

    record Card(String number, String expireDate, String cvv2) {}

    /** {@code groupId} is rendered even when empty, as the sale request carries an empty GroupID. */
    record Order(String orderId, String groupId) {}

    record Transaction(
            String type,
            String installmentCnt,
            String amount,
            String currencyCode,
            String cardHolderName,
            String motoInd,
            String originalRetrefNum
    ) {}

    String toXml() {
        StringBuilder xml = new StringBuilder(1024);
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        xml.append("<GVPSRequest>\n");
        element(xml, 1, "Mode", mode);
        element(xml, 1, "Version", version);

        open(xml, 1, "Terminal");
        element(xml, 2, "ProvUserID", terminal.provUserId());
        element(xml, 2, "HashData", terminal.hashData());
        element(xml, 2, "UserID", terminal.userId());
        element(xml, 2, "ID", terminal.id());
        element(xml, 2, "MerchantID", terminal.merchantId());
        close(xml, 1, "Terminal");

        if (customer != null) {
            open(xml, 1, "Customer");
            element(xml, 2, "IPAddress", customer.ipAddress());
            element(xml, 2, "EmailAddress", customer.emailAddress());
            close(xml, 1, "Customer");
        }

        if (card != null) {
            open(xml, 1, "Card");
            element(xml, 2, "Number", card.number());
            element(xml, 2, "ExpireDate", card.expireDate());
            element(xml, 2, "CVV2", card.cvv2());
            close(xml, 1, "Card");
        }

        open(xml, 1, "Order");
        element(xml, 2, "OrderID", order.orderId());
        if (order.groupId() != null) {
            indent(xml, 2).append("<GroupID>").append(escape(order.groupId())).append("</GroupID>\n");
        }
        close(xml, 1, "Order");

        open(xml, 1, "Transaction");
        element(xml, 2, "Type", transaction.type());
        element(xml, 2, "InstallmentCnt", transaction.installmentCnt());
        element(xml, 2, "Amount", transaction.amount());
        element(xml, 2, "CurrencyCode", transaction.currencyCode());
        element(xml, 2, "CardHolderName", transaction.cardHolderName());
        element(xml, 2, "MotoInd", transaction.motoInd());
        element(xml, 2, "OriginalRetrefNum", transaction.originalRetrefNum());
        close(xml, 1, "Transaction");

        xml.append("</GVPSRequest>");
        return xml.toString();
    }

    private static void element(StringBuilder xml, int depth, String name, String value) {
        if (value == null || value.isEmpty()) return;
        indent(xml, depth).append('<').append(name).append('>')
                .append(escape(value))
                .append("</").append(name).append(">\n");
    }

    private static void open(StringBuilder xml, int depth, String name) {
        indent(xml, depth).append('<').append(name).append(">\n");
    }

    private static void close(StringBuilder xml, int depth, String name) {
        indent(xml, depth).append("</").append(name).append(">\n");
    }

    private static StringBuilder indent(StringBuilder xml, int depth) {
        for (int i = 0; i < depth; i++) xml.append("  ");
        return xml;
    }
}

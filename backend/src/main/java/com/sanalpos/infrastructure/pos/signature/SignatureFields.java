/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.signature;

import com.sanalpos.domain.model.BankCode;
import com.sanalpos.domain.model.OperationType;
import com.sanalpos.infrastructure.pos.VirtualPosException;

/**
 * Formatting helpers shared by the signature engines.
 */
public final class SignatureFields {
    private SignatureFields() {}

    public static String require(BankCode bank, OperationType operation, String name, String value) {
        if (value == null || value.isEmpty()) {
            throw VirtualPosException.configuration(bank,
                    "Missing signature field " + name + " for " + bank + " " + operation);
        }
        return value;
    }

    /**
     * Pads on the right up to {@code width}. Longer values are kept whole, never truncated.
     */
    public static String padRight(String value, int width, char pad) {
        String v = value == null ? "" : value;
        if (v.length() >= width) return v;
        StringBuilder sb = new StringBuilder(width).append(v);
        while (sb.length() < width) sb.append(pad);
        return sb.toString();
    }

    /**
     * Pads on the left up to {@code width}. Longer values are kept whole, never truncated.
     */
    public static String padLeft(String value, int width, char pad) {
        String v = value == null ? "" : value;
        if (v.length() >= width) return v;
        StringBuilder sb = new StringBuilder(width);
        while (sb.length() < width - v.length()) sb.append(pad);
        return sb.append(v).toString();
    }

    /**
     * The amount as it enters the hash: the bank's echoed string when present, otherwise the
     * formatted amount, otherwise empty when the operation allows it (void, full refund).
     */
    public static String amount(BankCode bank, OperationType operation, SignatureInput input,
                                AmountFormat format, boolean required) {
        if (input.echoedAmount() != null) return input.echoedAmount();
        if (input.amount() != null) return format.format(input.amount());
        if (required) {
            throw VirtualPosException.configuration(bank,
                    "Missing signature field amount for " + bank + " " + operation);
        }
        return "";
    }

    public static String nvl(String value) {
        return value == null ? "" : value;
    }
}

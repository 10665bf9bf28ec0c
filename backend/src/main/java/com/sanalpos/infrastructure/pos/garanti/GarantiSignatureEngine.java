/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.garanti;

import com.sanalpos.domain.model.BankCode;
import com.sanalpos.domain.model.OperationType;
import com.sanalpos.infrastructure.crypto.Cards;
import com.sanalpos.infrastructure.crypto.Hashes;
import com.sanalpos.infrastructure.pos.BankAdapterConfig;
import com.sanalpos.infrastructure.pos.signature.AmountFormat;
import com.sanalpos.infrastructure.pos.signature.SignatureEngine;
import com.sanalpos.infrastructure.pos.signature.SignatureInput;

import java.util.Locale;

import static com.sanalpos.infrastructure.pos.signature.SignatureFields.amount;
import static com.sanalpos.infrastructure.pos.signature.SignatureFields.nvl;
import static com.sanalpos.infrastructure.pos.signature.SignatureFields.padLeft;
import static com.sanalpos.infrastructure.pos.signature.SignatureFields.padRight;
import static com.sanalpos.infrastructure.pos.signature.SignatureFields.require;

/**
 * Garanti hashes positionally: order id, terminal id and amount are right-padded with zeros to
 * 20, 9 and 12 characters, concatenated without separators, SHA-1'd and upper-cased.
 *
 * <ul>
 *   <li>sale: orderId terminalId cardBin amount provPassword</li>
 *   <li>refund, void: orderId terminalId amount provPassword</li>
 *   <li>3D: terminalId orderId amount successUrl failUrl txnType installment storeKey</li>
 *   <li>callback: orderId terminalId amount txnStatus mdStatus storeKey</li>
 * </ul>
 */
public class GarantiSignatureEngine implements SignatureEngine {
    static final int ORDER_ID_WIDTH = 20;
    static final int TERMINAL_ID_WIDTH = 9;
    static final int AMOUNT_WIDTH = 12;
    private static final char PAD = '0';
    private static final BankCode BANK = BankCode.GARANTI;

    private final BankAdapterConfig config;

    public GarantiSignatureEngine(BankAdapterConfig config) {
        this.config = config;
    }

    @Override
    public AmountFormat amountFormat() {
        return AmountFormat.MINOR_UNITS;
    }

    @Override
    public String computeSignature(OperationType operation, SignatureInput input) {
        String orderId = padRight(require(BANK, operation, "orderId", input.orderId()), ORDER_ID_WIDTH, PAD);
        String terminalId = padRight(require(BANK, operation, "terminalId", input.terminalId()), TERMINAL_ID_WIDTH, PAD);

        String data = switch (operation) {
            case SALE -> orderId
                    + terminalId
                    + cardBin(input)
                    + padRight(amount(BANK, operation, input, amountFormat(), true), AMOUNT_WIDTH, PAD)
                    + provisionPassword(operation);
            case REFUND, VOID -> orderId
                    + terminalId
                    + padRight(amount(BANK, operation, input, amountFormat(), false), AMOUNT_WIDTH, PAD)
                    + provisionPassword(operation);
            case THREE_D_SECURE -> terminalId
                    + orderId
                    + padRight(amount(BANK, operation, input, amountFormat(), true), AMOUNT_WIDTH, PAD)
                    + require(BANK, operation, "successUrl", input.successUrl())
                    + require(BANK, operation, "failUrl", input.failUrl())
                    + require(BANK, operation, "transactionType", input.transactionType())
                    + padLeft(nvl(input.installment()), 2, PAD)
                    + storeKey(operation);
            case CALLBACK -> orderId
                    + terminalId
                    + padRight(amount(BANK, operation, input, amountFormat(), true), AMOUNT_WIDTH, PAD)
                    + require(BANK, operation, "transactionStatus", input.transactionStatus())
                    + require(BANK, operation, "mdStatus", input.mdStatus())
                    + storeKey(operation);
        };
        return Hashes.sha1Hex(data).toUpperCase(Locale.ROOT);
    }

    private String cardBin(SignatureInput input) {
        String digits = Cards.digitsOnly(require(BANK, OperationType.SALE, "cardNumber", input.cardNumber()));
        return digits.length() > 6 ? digits.substring(0, 6) : digits;
    }

    private String provisionPassword(OperationType operation) {
        return require(BANK, operation, "password", config.password());
    }

    private String storeKey(OperationType operation) {
        return require(BANK, operation, "storeKey", config.storeKey());
    }
}

/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.isbank;

import com.sanalpos.domain.model.BankCode;
import com.sanalpos.domain.model.OperationType;
import com.sanalpos.infrastructure.crypto.Hashes;
import com.sanalpos.infrastructure.pos.BankAdapterConfig;
import com.sanalpos.infrastructure.pos.signature.AmountFormat;
import com.sanalpos.infrastructure.pos.signature.SignatureEngine;
import com.sanalpos.infrastructure.pos.signature.SignatureInput;

import static com.sanalpos.infrastructure.pos.signature.SignatureFields.amount;
import static com.sanalpos.infrastructure.pos.signature.SignatureFields.nvl;
import static com.sanalpos.infrastructure.pos.signature.SignatureFields.require;

/**
 * İşbank signs a {@code |}-delimited field list with HMAC-SHA256 keyed by the store key and
 * base64-encodes the MAC. Amounts are in minor units.
 *
 * <ul>
 *   <li>sale, refund, void: merchantId|terminalId|orderId|transactionType|amount|currency</li>
 *   <li>3D: the sale fields followed by successUrl|failUrl|installment</li>
 *   <li>callback: orderId|terminalId|amount|mdStatus|responseCode</li>
 * </ul>
 */
public class IsbankSignatureEngine implements SignatureEngine {
    static final String DELIMITER = "|";
    private static final BankCode BANK = BankCode.ISBANK;

    private final BankAdapterConfig config;

    public IsbankSignatureEngine(BankAdapterConfig config) {
        this.config = config;
    }

    @Override
    public AmountFormat amountFormat() {
        return AmountFormat.MINOR_UNITS;
    }

    @Override
    public String computeSignature(OperationType operation, SignatureInput input) {
        String storeKey = require(BANK, operation, "storeKey", config.storeKey());
        String orderId = require(BANK, operation, "orderId", input.orderId());
        String terminalId = require(BANK, operation, "terminalId", input.terminalId());

        String data = switch (operation) {
            case SALE -> String.join(DELIMITER,
                    require(BANK, operation, "merchantId", input.merchantId()),
                    terminalId,
                    orderId,
                    require(BANK, operation, "transactionType", input.transactionType()),
                    amount(BANK, operation, input, amountFormat(), true),
                    require(BANK, operation, "currencyCode", input.currencyCode()));
            case REFUND, VOID -> String.join(DELIMITER,
                    require(BANK, operation, "merchantId", input.merchantId()),
                    terminalId,
                    orderId,
                    require(BANK, operation, "transactionType", input.transactionType()),
                    amount(BANK, operation, input, amountFormat(), false),
                    nvl(input.currencyCode()));
            case THREE_D_SECURE -> String.join(DELIMITER,
                    require(BANK, operation, "merchantId", input.merchantId()),
                    terminalId,
                    orderId,
                    require(BANK, operation, "transactionType", input.transactionType()),
                    amount(BANK, operation, input, amountFormat(), true),
                    require(BANK, operation, "currencyCode", input.currencyCode()),
                    require(BANK, operation, "successUrl", input.successUrl()),
                    require(BANK, operation, "failUrl", input.failUrl()),
                    require(BANK, operation, "installment", input.installment()));
            case CALLBACK -> String.join(DELIMITER,
                    orderId,
                    terminalId,
                    amount(BANK, operation, input, amountFormat(), true),
                    require(BANK, operation, "mdStatus", input.mdStatus()),
                    require(BANK, operation, "responseCode", input.responseCode()));
        };
        return Hashes.hmacSha256Base64(storeKey, data);
    }

    /**
     * Base64 is case-significant, so the comparison is exact.
     */
    @Override
    public boolean matches(String expected, String supplied) {
        return Hashes.signaturesMatch(expected, supplied, false);
    }
}

/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.akbank;

import com.sanalpos.domain.model.BankCode;
import com.sanalpos.domain.model.OperationType;
import com.sanalpos.infrastructure.crypto.Hashes;
import com.sanalpos.infrastructure.pos.BankAdapterConfig;
import com.sanalpos.infrastructure.pos.signature.AmountFormat;
import com.sanalpos.infrastructure.pos.signature.SignatureEngine;
import com.sanalpos.infrastructure.pos.signature.SignatureInput;

import static com.sanalpos.infrastructure.pos.signature.SignatureFields.amount;
import static com.sanalpos.infrastructure.pos.signature.SignatureFields.require;

/**
 * Akbank concatenates client id, order id and the decimal amount, appends the store key and
 * takes the lowercase SHA-256 hex digest. The 3D variant also binds the redirect URLs; the
 * callback variant binds the bank's return code and mdStatus.
 */
public class AkbankSignatureEngine implements SignatureEngine {
    private static final BankCode BANK = BankCode.AKBANK;

    private final BankAdapterConfig config;

    public AkbankSignatureEngine(BankAdapterConfig config) {
        this.config = config;
    }

    @Override
    public AmountFormat amountFormat() {
        return AmountFormat.DECIMAL;
    }

    @Override
    public String computeSignature(OperationType operation, SignatureInput input) {
        String clientId = require(BANK, operation, "merchantId", input.merchantId());
        String orderId = require(BANK, operation, "orderId", input.orderId());
        String storeKey = require(BANK, operation, "storeKey", config.storeKey());

        String data = switch (operation) {
            case SALE -> clientId + orderId + amount(BANK, operation, input, amountFormat(), true) + storeKey;
            case REFUND, VOID -> clientId + orderId + amount(BANK, operation, input, amountFormat(), false) + storeKey;
            case THREE_D_SECURE -> clientId
                    + orderId
                    + amount(BANK, operation, input, amountFormat(), true)
                    + require(BANK, operation, "successUrl", input.successUrl())
                    + require(BANK, operation, "failUrl", input.failUrl())
                    + storeKey;
            case CALLBACK -> clientId
                    + orderId
                    + amount(BANK, operation, input, amountFormat(), true)
                    + require(BANK, operation, "responseCode", input.responseCode())
                    + require(BANK, operation, "mdStatus", input.mdStatus())
                    + storeKey;
        };
        return Hashes.sha256Hex(data);
    }
}

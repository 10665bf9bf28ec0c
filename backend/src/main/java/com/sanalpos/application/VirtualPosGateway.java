/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.application;

import com.sanalpos.domain.model.BankCode;
import com.sanalpos.infrastructure.pos.CallbackData;
import com.sanalpos.infrastructure.pos.CancelRequest;
import com.sanalpos.infrastructure.pos.CancelResponse;
import com.sanalpos.infrastructure.pos.PaymentRequest;
import com.sanalpos.infrastructure.pos.PaymentResponse;
import com.sanalpos.infrastructure.pos.RefundRequest;
import com.sanalpos.infrastructure.pos.RefundResponse;
import com.sanalpos.infrastructure.pos.VirtualPosErrorType;
import com.sanalpos.infrastructure.pos.VirtualPosException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;

/**
 * Entry point for the checkout workflow. Routes each call to the adapter of the named bank and
 * returns the bank's result unchanged; it keeps no payment state of its own.
 *
 * <p>A payment and its later refund or cancel must name the same bank.
 */
@Service
public class VirtualPosGateway {
    private static final Logger log = LoggerFactory.getLogger(VirtualPosGateway.class);

    private final VirtualPosRegistry registry;

    public VirtualPosGateway(VirtualPosRegistry registry) {
        this.registry = registry;
    }

    public PaymentResponse payment(BankCode bank, PaymentRequest request) {
        return registry.getRequired(bank).payment(request);
    }

    public PaymentResponse payment3D(BankCode bank, PaymentRequest request) {
        return registry.getRequired(bank).payment3D(request);
    }

    public RefundResponse refund(BankCode bank, RefundRequest request) {
        return registry.getRequired(bank).refund(request);
    }

    public CancelResponse cancel(BankCode bank, CancelRequest request) {
        return registry.getRequired(bank).cancel(request);
    }

    /**
     * Verifies a 3D Secure redirect. An unconfigured bank is a configuration error, not a
     * failed verification.
     */
    public boolean verifyCallback(BankCode bank, Map<String, String> fields) {
        return verifyCallback(bank, CallbackData.of(fields));
    }

    public boolean verifyCallback(BankCode bank, CallbackData data) {
        return registry.getRequired(bank).verifyCallback(data);
    }

    /**
     * Resolves a bank name from a URL or config key. Unknown names fail as an unconfigured bank.
     */
    public BankCode resolveBank(String name) {
        return BankCode.find(name).orElseThrow(() -> {
            log.warn("Unknown bank requested name={}", name);
            return new VirtualPosException(null, VirtualPosErrorType.BANK_NOT_CONFIGURED, "Unknown bank: " + name);
        });
    }

    public Set<BankCode> configuredBanks() {
        return registry.registeredBanks();
    }

    public boolean isConfigured(BankCode bank) {
        return registry.find(bank).isPresent();
    }
}

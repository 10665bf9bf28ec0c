/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.application;

import com.sanalpos.domain.model.BankCode;
import com.sanalpos.infrastructure.pos.VirtualPosAdapter;
import com.sanalpos.infrastructure.pos.VirtualPosErrorType;
import com.sanalpos.infrastructure.pos.VirtualPosException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the adapter configured for a bank. Built once from the adapters created at startup;
 * a bank without credentials simply has no entry.
 */
public class VirtualPosRegistry {

    private final EnumMap<BankCode, VirtualPosAdapter> adaptersByBank;

    public VirtualPosRegistry(List<? extends VirtualPosAdapter> adapters) {
        this.adaptersByBank = buildRegistry(adapters == null ? List.of() : adapters);
    }

    public VirtualPosAdapter getRequired(BankCode bank) {
        if (bank == null) {
            throw new VirtualPosException(null, VirtualPosErrorType.BANK_NOT_CONFIGURED, "Bank is required");
        }
        VirtualPosAdapter adapter = adaptersByBank.get(bank);
        if (adapter == null) {
            throw new VirtualPosException(bank, VirtualPosErrorType.BANK_NOT_CONFIGURED,
                    bank + " virtual POS is not configured");
        }
        return adapter;
    }

    public Optional<VirtualPosAdapter> find(BankCode bank) {
        return bank == null ? Optional.empty() : Optional.ofNullable(adaptersByBank.get(bank));
    }

    public Set<BankCode> registeredBanks() {
        return Collections.unmodifiableSet(adaptersByBank.keySet());
    }

    private static EnumMap<BankCode, VirtualPosAdapter> buildRegistry(List<? extends VirtualPosAdapter> adapters) {
        EnumMap<BankCode, VirtualPosAdapter> registry = new EnumMap<>(BankCode.class);
        for (VirtualPosAdapter adapter : adapters) {
            if (adapter == null) {
                throw new IllegalStateException("Virtual POS adapter list contains null");
            }

            BankCode bank = adapter.bank();
            if (bank == null) {
                throw new IllegalStateException(
                        "Adapter " + adapter.getClass().getName() + " returned bank=null"
                );
            }

            VirtualPosAdapter existing = registry.putIfAbsent(bank, adapter);
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate adapter for bank=" + bank
                                + ". Existing=" + existing.getClass().getName()
                                + ", new=" + adapter.getClass().getName()
                );
            }
        }
        return registry;
    }
}

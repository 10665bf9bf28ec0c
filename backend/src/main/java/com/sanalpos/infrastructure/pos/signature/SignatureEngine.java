/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.signature;

import com.sanalpos.domain.model.OperationType;
import com.sanalpos.infrastructure.crypto.Hashes;

/**
 * Produces the exact signature a bank expects for an operation. Implementations are bound to one
 * bank's shared secret at construction and hold no other state. They format and hash only;
 * business validation happens before they are called.
 */
public interface SignatureEngine {
    AmountFormat amountFormat();

    /**
     * @throws com.sanalpos.infrastructure.pos.VirtualPosException of type CONFIGURATION when a
     *         field the bank hashes is missing
     */
    String computeSignature(OperationType operation, SignatureInput input);

    /**
     * Compares a recomputed signature with the one a bank supplied. Hex signatures ignore case.
     */
    default boolean matches(String expected, String supplied) {
        return Hashes.signaturesMatch(expected, supplied, true);
    }
}

/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos;

import com.sanalpos.domain.model.BankCode;

public interface VirtualPosAdapter {
    BankCode bank();

    PaymentResponse payment(PaymentRequest request);

    /**
     * Builds the auto-submitting 3D Secure form. No network call happens here; the charge is
     * settled only after {@link #verifyCallback(CallbackData)} accepts the bank's redirect.
     */
    PaymentResponse payment3D(PaymentRequest request);

    RefundResponse refund(RefundRequest request);

    CancelResponse cancel(CancelRequest request);

    /**
     * True only when the callback signature matches and the bank reports full 3D authentication
     * and an approved transaction. Never throws.
     */
    boolean verifyCallback(CallbackData data);
}

/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos;

import java.math.BigDecimal;

/**
 * Refund of a captured payment. A {@code null} amount requests a full refund.
 */
public record RefundRequest(
        String transactionId,
        String orderId,
        BigDecimal amount,
        String currency,
        String reason
) {
    public boolean isFullRefund() {
        return amount == null;
    }
}

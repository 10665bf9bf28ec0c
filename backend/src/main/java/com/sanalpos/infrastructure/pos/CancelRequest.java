/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos;

public record CancelRequest(
        String transactionId,
        String orderId,
        String authCode
) {}

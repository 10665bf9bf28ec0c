/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.domain.model;

public enum OperationType {
    SALE,
    REFUND,
    VOID,
    THREE_D_SECURE,
    CALLBACK
}

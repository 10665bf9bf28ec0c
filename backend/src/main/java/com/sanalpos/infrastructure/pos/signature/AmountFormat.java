/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.signature;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * How a bank expects amounts on the wire and in its hash input.
 */
public enum AmountFormat {
    /** Two fixed decimal places: {@code 10.5 -> "10.50"}. */
    DECIMAL {
        @Override
        public String format(BigDecimal amount) {
            return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
        }
    },
    /** Integer minor units, remainder dropped: {@code 10.50 -> "1050"}. */
    MINOR_UNITS {
        @Override
        public String format(BigDecimal amount) {
            return amount.movePointRight(2).setScale(0, RoundingMode.DOWN).toPlainString();
        }
    };

    public abstract String format(BigDecimal amount);
}

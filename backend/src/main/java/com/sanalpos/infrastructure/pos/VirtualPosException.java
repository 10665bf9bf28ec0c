/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos;

import com.sanalpos.domain.model.BankCode;

/**
 * Raised for local validation and configuration failures and for transport failures talking to a
 * bank. A bank that answers with a decline does not raise this; it produces a failed response.
 */
public class VirtualPosException extends RuntimeException {
    private final BankCode bank;
    private final VirtualPosErrorType type;
    private final String safeMessage;
    private final Integer httpStatus;

    public VirtualPosException(BankCode bank, VirtualPosErrorType type, String safeMessage, Integer httpStatus, Throwable cause) {
        super(safeMessage, cause);
        this.bank = bank;
        this.type = type;
        this.safeMessage = safeMessage;
        this.httpStatus = httpStatus;
    }

    public VirtualPosException(BankCode bank, VirtualPosErrorType type, String safeMessage, Throwable cause) {
        this(bank, type, safeMessage, null, cause);
    }

    public VirtualPosException(BankCode bank, VirtualPosErrorType type, String safeMessage) {
        this(bank, type, safeMessage, null, null);
    }

    public static VirtualPosException validation(BankCode bank, String reason) {
        return new VirtualPosException(bank, VirtualPosErrorType.VALIDATION, reason);
    }

    public static VirtualPosException configuration(BankCode bank, String reason) {
        return new VirtualPosException(bank, VirtualPosErrorType.CONFIGURATION, reason);
    }

    public BankCode getBank() {
        return bank;
    }

    public VirtualPosErrorType getType() {
        return type;
    }

    public String getSafeMessage() {
        return safeMessage;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }

    /**
     * True when the request may have reached the bank and the charge may or may not exist.
     * Callers must reconcile instead of retrying with the same order id.
     */
    public boolean isOutcomeIndeterminate() {
        return switch (type) {
            case TIMEOUT, CONNECTION, UNKNOWN -> true;
            case HTTP_ERROR -> httpStatus == null || httpStatus >= 500;
            default -> false;
        };
    }

    public boolean isConfigurationError() {
        return type == VirtualPosErrorType.CONFIGURATION || type == VirtualPosErrorType.BANK_NOT_CONFIGURED;
    }
}

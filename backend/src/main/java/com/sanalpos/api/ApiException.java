/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.api;

import org.springframework.http.HttpStatus;

/**
 * An error raised by a controller with the HTTP status it should produce.
 */
public class ApiException extends RuntimeException {
    private final HttpStatus status;

    public ApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}

/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.api;

import com.sanalpos.config.RequestIdFilter;
import com.sanalpos.infrastructure.pos.VirtualPosErrorType;
import com.sanalpos.infrastructure.pos.VirtualPosException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex) {
        return respond(ex.getStatus(), ex.getStatus().name(), ex.getMessage());
    }

    /**
     * Indeterminate outcomes become 504 so callers reconcile with the bank instead of treating
     * the payment as failed.
     */
    @ExceptionHandler(VirtualPosException.class)
    public ResponseEntity<ApiErrorResponse> handleVirtualPos(VirtualPosException ex) {
        HttpStatus status = statusFor(ex);
        String code = ex.getType() == null ? VirtualPosErrorType.UNKNOWN.name() : ex.getType().name();
        if (status.is5xxServerError()) {
            log.error("Virtual POS error requestId={} bank={} type={} message={}",
                    currentRequestId(), ex.getBank(), code, ex.getSafeMessage(), ex);
        } else {
            log.warn("Virtual POS error requestId={} bank={} type={} message={}",
                    currentRequestId(), ex.getBank(), code, ex.getSafeMessage());
        }
        return respond(status, code, ex.getSafeMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleAny(Exception ex) {
        log.error("Unhandled exception requestId={}", currentRequestId(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Unexpected error");
    }

    static HttpStatus statusFor(VirtualPosException ex) {
        if (ex.isOutcomeIndeterminate()) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        if (ex.getType() == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (ex.getType()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case BANK_NOT_CONFIGURED -> HttpStatus.NOT_FOUND;
            case HTTP_ERROR -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String code, String message) {
        ApiErrorResponse body = new ApiErrorResponse(
                status.name(),
                code,
                message,
                currentRequestId()
        );
        return ResponseEntity.status(status).body(body);
    }

    private String currentRequestId() {
        String rid = MDC.get(RequestIdFilter.MDC_KEY);
        return (rid == null || rid.isBlank()) ? "" : rid;
    }
}

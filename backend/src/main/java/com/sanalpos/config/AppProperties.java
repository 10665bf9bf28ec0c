/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.config;

import com.sanalpos.domain.model.BankCode;
import com.sanalpos.infrastructure.pos.BankAdapterConfig;
import com.sanalpos.infrastructure.pos.BankEndpoints;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        Pos pos
) {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(45);

    public record Pos(String callbackBaseUrl, Http http, Banks banks) {}

    public record Http(Duration connectTimeout, Duration responseTimeout) {
        public Duration connectTimeoutOrDefault() {
            return connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
        }

        public Duration responseTimeoutOrDefault() {
            return responseTimeout == null ? DEFAULT_RESPONSE_TIMEOUT : responseTimeout;
        }
    }

    public record Banks(Bank akbank, Bank isbank, Bank garanti) {
        public Bank get(BankCode code) {
            return switch (code) {
                case AKBANK -> akbank;
                case ISBANK -> isbank;
                case GARANTI -> garanti;
            };
        }
    }

    /**
     * One bank terminal. Leaving {@code merchant-id} empty disables the bank. URLs fall back to
     * the bank's test or live endpoints according to {@code test-mode}, which defaults to true.
     */
    public record Bank(
            String merchantId,
            String terminalId,
            String username,
            String password,
            String storeKey,
            Boolean testMode,
            String apiUrl,
            String secure3dUrl
    ) {
        public boolean isConfigured() {
            return merchantId != null && !merchantId.isBlank();
        }

        public boolean testModeOrDefault() {
            return testMode == null || testMode;
        }

        public BankAdapterConfig toAdapterConfig(BankCode code, BankEndpoints defaults, String callbackBaseUrl) {
            boolean test = testModeOrDefault();
            return new BankAdapterConfig(
                    code,
                    trim(merchantId),
                    trim(terminalId),
                    trim(username),
                    password,
                    storeKey,
                    isBlank(apiUrl) ? defaults.apiUrl(test) : apiUrl,
                    isBlank(secure3dUrl) ? defaults.secure3dUrl(test) : secure3dUrl,
                    test,
                    callbackBaseUrl
            );
        }

        @Override
        public String toString() {
            return "Bank[merchantId=" + merchantId + ", terminalId=" + terminalId + ", testMode=" + testMode + "]";
        }

        private static String trim(String value) {
            return value == null ? null : value.trim();
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }
    }
}

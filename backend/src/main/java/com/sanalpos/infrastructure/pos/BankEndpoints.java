/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos;

/**
 * Default test and live URLs published by a bank. Explicit configuration overrides them.
 */
public record BankEndpoints(
        String testApiUrl,
        String test3dUrl,
        String liveApiUrl,
        String live3dUrl
) {
    public String apiUrl(boolean testMode) {
        return testMode ? testApiUrl : liveApiUrl;
    }

    public String secure3dUrl(boolean testMode) {
        return testMode ? test3dUrl : live3dUrl;
    }
}

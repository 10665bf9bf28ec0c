/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sanalpos.application.VirtualPosRegistry;
import com.sanalpos.domain.model.BankCode;
import com.sanalpos.infrastructure.pos.BankAdapterConfig;
import com.sanalpos.infrastructure.pos.BankEndpoints;
import com.sanalpos.infrastructure.pos.VirtualPosAdapter;
import com.sanalpos.infrastructure.pos.akbank.AkbankPosAdapter;
import com.sanalpos.infrastructure.pos.garanti.GarantiPosAdapter;
import com.sanalpos.infrastructure.pos.isbank.IsbankPosAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates one adapter per bank that has credentials under {@code app.pos.banks}. Missing required
 * credentials for an enabled bank fail startup.
 */
@Configuration
public class VirtualPosConfig {
    private static final Logger log = LoggerFactory.getLogger(VirtualPosConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public VirtualPosRegistry virtualPosRegistry(AppProperties properties, WebClient virtualPosWebClient,
                                                 ObjectMapper objectMapper, Clock clock) {
        AppProperties.Pos pos = properties.pos();
        if (pos == null || pos.banks() == null) {
            log.warn("No virtual POS banks configured under app.pos.banks");
            return new VirtualPosRegistry(List.of());
        }

        Duration timeout = WebClientConfig.httpSettings(properties).responseTimeoutOrDefault();
        List<VirtualPosAdapter> adapters = new ArrayList<>();
        for (BankCode code : BankCode.values()) {
            AppProperties.Bank bank = pos.banks().get(code);
            if (bank == null || !bank.isConfigured()) {
                log.info("Virtual POS bank={} not configured", code);
                continue;
            }
            BankAdapterConfig config = bank.toAdapterConfig(code, endpoints(code), pos.callbackBaseUrl());
            adapters.add(switch (code) {
                case AKBANK -> new AkbankPosAdapter(config, virtualPosWebClient, objectMapper, timeout, clock);
                case ISBANK -> new IsbankPosAdapter(config, virtualPosWebClient, objectMapper, timeout, clock);
                case GARANTI -> new GarantiPosAdapter(config, virtualPosWebClient, timeout, clock);
            });
            log.info("Virtual POS bank={} configured testMode={} apiUrl={}", code, config.testMode(), config.apiUrl());
        }
        return new VirtualPosRegistry(adapters);
    }

    private static BankEndpoints endpoints(BankCode code) {
        return switch (code) {
            case AKBANK -> AkbankPosAdapter.ENDPOINTS;
            case ISBANK -> IsbankPosAdapter.ENDPOINTS;
            case GARANTI -> GarantiPosAdapter.ENDPOINTS;
        };
    }
}

/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SanalPosApplication {
    public static void main(String[] args) {
        SpringApplication.run(SanalPosApplication.class, args);
    }
}

/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BankCodeTest {

    @Test
    void findIsLenientAboutCaseAndTurkishLetters() {
        assertEquals(Optional.of(BankCode.GARANTI), BankCode.find("garanti"));
        assertEquals(Optional.of(BankCode.ISBANK), BankCode.find("İşbank"));
        assertEquals(Optional.of(BankCode.ISBANK), BankCode.find(" ISBANK "));
        assertEquals(Optional.of(BankCode.AKBANK), BankCode.find("Akbank"));
    }

    @Test
    void unknownNamesAreEmpty() {
        assertTrue(BankCode.find("yapikredi").isEmpty());
        assertTrue(BankCode.find("").isEmpty());
        assertTrue(BankCode.find(null).isEmpty());
    }

    @Test
    void onlyMdStatusOneIsFullAuthentication() {
        assertTrue(MdStatus.of("1").isFullyAuthenticated());
        for (String code : new String[]{"0", "2", "3", "4", "5", "6", "7", "8", "9", "", null}) {
            assertFalse(MdStatus.of(code).isFullyAuthenticated(), String.valueOf(code));
        }
        assertEquals(MdStatus.UNKNOWN, MdStatus.of("42"));
    }

    @Test
    void currenciesMapToIsoNumericCodes() {
        assertEquals("949", CurrencyCode.find("try").orElseThrow().numericCode());
        assertEquals("840", CurrencyCode.find("USD").orElseThrow().numericCode());
        assertEquals("978", CurrencyCode.find("EUR").orElseThrow().numericCode());
        assertEquals("826", CurrencyCode.find("GBP").orElseThrow().numericCode());
        assertTrue(CurrencyCode.find("JPY").isEmpty());
    }
}

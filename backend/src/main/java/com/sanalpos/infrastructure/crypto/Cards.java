/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.crypto;

import java.time.DateTimeException;
import java.time.YearMonth;

public final class Cards {
    private static final String MASK = "******";

    private Cards() {}

    public static String digitsOnly(String cardNumber) {
        return cardNumber == null ? "" : cardNumber.replaceAll("\\D", "");
    }

    /**
     * Luhn checksum over the digits of {@code cardNumber}; separators are ignored.
     * Only 13 to 19 digit numbers are accepted.
     */
    public static boolean isValidCardNumber(String cardNumber) {
        String digits = digitsOnly(cardNumber);
        if (digits.length() < 13 || digits.length() > 19) return false;

        int sum = 0;
        boolean doubled = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int digit = digits.charAt(i) - '0';
            if (doubled) {
                digit *= 2;
                if (digit > 9) digit -= 9;
            }
            sum += digit;
            doubled = !doubled;
        }
        return sum % 10 == 0;
    }

    /**
     * A card is valid through the last day of its expiry month. Two-digit years are read as 20YY.
     */
    public static boolean isExpiryValid(String month, String year, YearMonth current) {
        YearMonth expiry = parseExpiry(month, year);
        return expiry != null && !expiry.isBefore(current);
    }

    public static YearMonth parseExpiry(String month, String year) {
        if (month == null || year == null) return null;
        String m = month.trim();
        String y = year.trim();
        if (!m.matches("\\d{1,2}") || !(y.matches("\\d{2}") || y.matches("\\d{4}"))) return null;
        int fullYear = y.length() == 2 ? 2000 + Integer.parseInt(y) : Integer.parseInt(y);
        try {
            return YearMonth.of(fullYear, Integer.parseInt(m));
        } catch (DateTimeException e) {
            return null;
        }
    }

    /**
     * Keeps the first six and last four digits. Numbers too short to mask safely are fully hidden.
     */
    public static String mask(String cardNumber) {
        String digits = digitsOnly(cardNumber);
        if (digits.length() < 10) return "****";
        return digits.substring(0, 6) + MASK + digits.substring(digits.length() - 4);
    }
}

/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Locale;

/**
 * Digest and HMAC primitives used by the bank signature engines. Input strings are always
 * encoded as UTF-8; hex output is lowercase unless the caller upper-cases it.
 */
public final class Hashes {
    private static final String HMAC_SHA256 = "HmacSHA256";

    private Hashes() {}

    public static String sha1Hex(String input) {
        return toHex(digest("SHA-1", input));
    }

    public static String sha256Hex(String input) {
        return toHex(digest("SHA-256", input));
    }

    public static String md5Hex(String input) {
        return toHex(digest("MD5", input));
    }

    public static String sha1Base64(String input) {
        return Base64.getEncoder().encodeToString(digest("SHA-1", input));
    }

    public static String hmacSha256Hex(String key, String input) {
        return toHex(hmac(HMAC_SHA256, key, input));
    }

    public static String hmacSha256Base64(String key, String input) {
        return Base64.getEncoder().encodeToString(hmac(HMAC_SHA256, key, input));
    }

    /**
     * Constant-time signature comparison. Hex digests are compared ignoring ASCII case since
     * some banks upper-case their output; base64 signatures must be compared exactly.
     */
    public static boolean signaturesMatch(String expected, String supplied, boolean ignoreCase) {
        if (expected == null || supplied == null) return false;
        String a = expected.trim();
        String b = supplied.trim();
        if (ignoreCase) {
            a = a.toUpperCase(Locale.ROOT);
            b = b.toUpperCase(Locale.ROOT);
        }
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] digest(String algorithm, String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            return digest.digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(algorithm + " unavailable", e);
        }
    }

    private static byte[] hmac(String algorithm, String key, String input) {
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), algorithm));
            return mac.doFinal(input.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(algorithm + " unavailable", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }
}

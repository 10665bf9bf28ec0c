/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.crypto;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HashesTest {

    @Test
    void digestsMatchKnownVectors() {
        assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d", Hashes.sha1Hex("abc"));
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", Hashes.sha256Hex("abc"));
        assertEquals("900150983cd24fb0d6963f7d28e17f72", Hashes.md5Hex("abc"));
        assertEquals("qZk+NkcGgWq6PiVxeFDCbJzQ2J0=", Hashes.sha1Base64("abc"));
    }

    @Test
    void hmacMatchesKnownVector() {
        String message = "The quick brown fox jumps over the lazy dog";
        assertEquals("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8",
                Hashes.hmacSha256Hex("key", message));
        assertEquals("97yD9DBThCSxMpjmqm+xQ+9NWaFJRhdZl0edvC0aPNg=", Hashes.hmacSha256Base64("key", message));
    }

    @Test
    void hexSignaturesCompareIgnoringCase() {
        assertTrue(Hashes.signaturesMatch("abcdef0123", "ABCDEF0123", true));
        assertTrue(Hashes.signaturesMatch("abcdef0123", " abcdef0123 ", true));
        assertFalse(Hashes.signaturesMatch("abcdef0123", "abcdef0124", true));
    }

    @Test
    void base64SignaturesCompareExactly() {
        assertTrue(Hashes.signaturesMatch("97yD9DBThCSx", "97yD9DBThCSx", false));
        assertFalse(Hashes.signaturesMatch("97yD9DBThCSx", "97YD9DBTHCSX", false));
    }

    @Test
    void missingSignatureNeverMatches() {
        assertFalse(Hashes.signaturesMatch("abc", null, true));
        assertFalse(Hashes.signaturesMatch(null, "abc", true));
    }
}

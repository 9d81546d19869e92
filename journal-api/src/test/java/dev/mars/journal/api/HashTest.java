package dev.mars.journal.api;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
@DisplayName("Hash Tests")
class HashTest {

    private static final String VALID = "9f86d081884c7d659a2feaa0c55ad015a3bf4f1b2b0b822cd15d6c15b0f00a08";

    @Test
    @DisplayName("Should round-trip a valid hex string through toString")
    void testRoundTrip() {
        assertEquals(VALID, Hash.of(VALID).toString());
    }

    @Test
    void testSha256MatchesKnownDigest() {
        // SHA-256("test")
        assertEquals(Hash.of(VALID), Hash.sha256("test"));
    }

    @Test
    void testRejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> Hash.of(null));
        assertThrows(IllegalArgumentException.class, () -> Hash.of(""));
        assertThrows(IllegalArgumentException.class, () -> Hash.of(VALID.substring(1)));
        assertThrows(IllegalArgumentException.class, () -> Hash.of(VALID + "0"));
        assertThrows(IllegalArgumentException.class, () -> Hash.of(VALID.toUpperCase()));
        assertThrows(IllegalArgumentException.class, () -> Hash.of("g" + VALID.substring(1)));
        assertThrows(IllegalArgumentException.class, () -> Hash.of(" " + VALID.substring(1)));
    }

    @Test
    void testZeroHash() {
        assertEquals("0".repeat(64), Hash.ZERO.toString());
        assertTrue(Hash.ZERO.isZero());
        assertTrue(Hash.of("0".repeat(64)).isZero());
        assertFalse(Hash.of(VALID).isZero());
    }

    @Test
    void testEqualityAndOrdering() {
        Hash a = Hash.of("a".repeat(64));
        Hash b = Hash.of("b".repeat(64));

        assertEquals(a, Hash.of("a".repeat(64)));
        assertEquals(a.hashCode(), Hash.of("a".repeat(64)).hashCode());
        assertNotEquals(a, b);
        assertTrue(a.compareTo(b) < 0);
        assertTrue(Hash.ZERO.compareTo(a) < 0);

        List<Hash> hashes = new ArrayList<>(List.of(b, Hash.ZERO, a));
        Collections.sort(hashes);
        assertEquals(List.of(Hash.ZERO, a, b), hashes);
    }

    @Test
    void testSha256OfBytesAndStringAgree() {
        assertEquals(Hash.sha256("journal"), Hash.sha256("journal".getBytes(java.nio.charset.StandardCharsets.UTF_8)));
        assertNotEquals(Hash.sha256("journal"), Hash.sha256("Journal"));
    }
}

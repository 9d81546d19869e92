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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A SHA-256 content digest rendered as 64 lowercase hexadecimal characters.
 *
 * Hashes identify both committed events and the ref values that point at them.
 * Construction validates the input and never truncates or pads it. Ordering is
 * the lexicographic order of the hex string.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class Hash implements Comparable<Hash> {

    /** Number of hex characters in a hash. */
    public static final int LENGTH = 64;

    /** Sentinel version of an aggregate that has no committed event. */
    public static final Hash ZERO = new Hash("0".repeat(LENGTH));

    private static final HexFormat HEX = HexFormat.of();

    private final String value;

    private Hash(String value) {
        this.value = value;
    }

    /**
     * Parses a hash from its hex form.
     *
     * @param value 64 characters, each in {@code [0-9a-f]}
     * @return the hash
     * @throws IllegalArgumentException if the value is null, has the wrong length or contains other characters
     */
    @JsonCreator
    public static Hash of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Hash value cannot be null");
        }
        if (value.length() != LENGTH) {
            throw new IllegalArgumentException(
                "Hash must be " + LENGTH + " hex characters but was " + value.length() + ": '" + value + "'");
        }
        for (int i = 0; i < LENGTH; i++) {
            char c = value.charAt(i);
            boolean hexDigit = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f');
            if (!hexDigit) {
                throw new IllegalArgumentException(
                    "Hash contains non lowercase-hex character '" + c + "' at index " + i);
            }
        }
        return new Hash(value);
    }

    /**
     * Computes the SHA-256 hash of the UTF-8 bytes of a string.
     */
    public static Hash sha256(String data) {
        Objects.requireNonNull(data, "Data cannot be null");
        return sha256(data.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Computes the SHA-256 hash of raw bytes.
     */
    public static Hash sha256(byte[] data) {
        Objects.requireNonNull(data, "Data cannot be null");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return new Hash(HEX.formatHex(digest.digest(data)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public boolean isZero() {
        return ZERO.value.equals(value);
    }

    @Override
    public int compareTo(Hash other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Hash)) return false;
        return value.equals(((Hash) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}

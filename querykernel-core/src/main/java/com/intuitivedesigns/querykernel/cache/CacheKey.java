/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Opaque, fixed-size identifier of a cached query result.
 *
 * <p>A key is the SHA-256 digest of (query text, endpoint id, format id). Each
 * component is length-prefixed before hashing, so moving characters from one
 * component to its neighbour always produces a different key.</p>
 *
 * @param value 64 lowercase hex characters
 */
public record CacheKey(String value) {

    private static final String ALGORITHM = "SHA-256";
    private static final int HEX_LENGTH = 64;
    private static final HexFormat HEX = HexFormat.of();

    public CacheKey {
        Objects.requireNonNull(value, "value");
        if (value.length() != HEX_LENGTH) {
            throw new IllegalArgumentException("CacheKey must be " + HEX_LENGTH + " hex chars, got " + value.length());
        }
    }

    /**
     * Pure and deterministic: equal inputs always give equal keys.
     */
    public static CacheKey derive(String queryText, String endpointId, String formatId) {
        Objects.requireNonNull(queryText, "queryText");
        Objects.requireNonNull(endpointId, "endpointId");
        Objects.requireNonNull(formatId, "formatId");

        MessageDigest digest = newDigest();
        update(digest, queryText);
        update(digest, endpointId);
        update(digest, formatId);
        return new CacheKey(HEX.formatHex(digest.digest()));
    }

    private static void update(MessageDigest digest, String component) {
        byte[] bytes = component.getBytes(StandardCharsets.UTF_8);
        digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        digest.update(bytes);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every JDK is required to ship SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}

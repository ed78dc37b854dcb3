package com.fintech.resolution.audit;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Short one-way digests for identifiers that must not appear in logs.
 */
public final class Hashing {

    private static final int SHORT_HEX_LENGTH = 12;

    private Hashing() {
    }

    /**
     * First 12 hex characters of the SHA-256 of {@code value}.
     */
    public static String shortSha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, SHORT_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package com.example.securevote.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Cryptographic utilities.
 *
 * IMPORTANT:
 * - Every token (identity, ballot, receipt) is drawn from SecureRandom and never derived from any
 *   other value.
 * - Tokens are stored only as SHA-256 hashes; comparisons of stored hashes go through
 *   {@link #constantTimeEquals(String, String)}.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    private static final SecureRandom RNG = new SecureRandom();

    public static final int TOKEN_BYTES = 32;

    /**
     * All-zero SHA-256 value used as the genesis predecessor of every audit chain.
     */
    public static final String ZERO_HASH = "0".repeat(64);

    public static byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        RNG.nextBytes(bytes);
        return bytes;
    }

    /**
     * 256 bits of fresh randomness, URL-safe base64 without padding (43 characters).
     */
    public static String newToken() {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes(TOKEN_BYTES));
    }

    public static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String sha256Hex(String input) {
        return toHex(sha256(input.getBytes(StandardCharsets.UTF_8)));
    }

    public static String sha256Hex(byte[] input) {
        return toHex(sha256(input));
    }

    /**
     * Compares two hex digests without short-circuiting on the first differing character.
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.US_ASCII), b.getBytes(StandardCharsets.US_ASCII));
    }

    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) sb.append(String.format("%02x", b));
        return sb.toString();
    }
}

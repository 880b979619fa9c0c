package com.graphsync.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content fingerprints used by change detection.
 */
public final class Checksums {

    private Checksums() {
        // Utility class
    }

    /**
     * Lowercase hex MD5 of the compact JSON form of {@code value}.
     */
    public static String md5OfJson(Object value) {
        return md5(JsonSupport.toJson(value));
    }

    public static String md5(String input) {
        return digest("MD5", input);
    }

    private static String digest(String algorithm, String input) {
        try {
            MessageDigest md = MessageDigest.getInstance(algorithm);
            byte[] hash = md.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships MD5
            throw new IllegalStateException(algorithm + " is not available", e);
        }
    }
}

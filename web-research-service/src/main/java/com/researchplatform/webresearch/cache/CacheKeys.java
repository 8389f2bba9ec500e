package com.researchplatform.webresearch.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Hex digests used for cache keys (SHA-256) and content ETags (MD5). */
final class CacheKeys {

    private CacheKeys() {}

    static String sha256(String input) {
        return digest("SHA-256", input);
    }

    static String md5(String input) {
        return digest("MD5", input);
    }

    private static String digest(String algorithm, String input) {
        try {
            MessageDigest md = MessageDigest.getInstance(algorithm);
            return HexFormat.of().formatHex(md.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // both algorithms are mandatory on every Java platform
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}

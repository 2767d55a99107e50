package com.harvest.jobcrawler.crawl.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashUtils {
    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        return digestHex("SHA-256", value);
    }

    /**
     * Short MD5 fingerprint used to scope throttle cooldowns to a single proxy.
     */
    public static String md5Prefix(String value, int length) {
        String hex = digestHex("MD5", value);
        return hex.substring(0, Math.min(hex.length(), Math.max(1, length)));
    }

    private static String digestHex(String algorithm, String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " algorithm not available", e);
        }
    }
}

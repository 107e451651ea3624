package com.github.rudygunawan.tiercache.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic cache keys derived from content.
 *
 * <p>Callers that cache the result of an expensive computation key it by the inputs, for example
 * {@code CacheKeys.prefixed("embedding:", model, text)}. The same inputs always produce the same
 * key, across processes and restarts.
 */
public final class CacheKeys {
    private static final String ALGORITHM = "SHA-256";

    private CacheKeys() {
    }

    /**
     * Returns the lowercase hex SHA-256 digest of the UTF-8 bytes of {@code parts}, fed in order
     * without separators. Null parts are skipped.
     *
     * @param parts the key material
     * @return a 64 character hex string
     */
    public static String hash(String... parts) {
        MessageDigest digest = newDigest();
        if (parts != null) {
            for (String part : parts) {
                if (part != null) {
                    digest.update(part.getBytes(StandardCharsets.UTF_8));
                }
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Returns {@code prefix} followed by {@link #hash(String...)} of {@code parts}.
     */
    public static String prefixed(String prefix, String... parts) {
        if (prefix == null) {
            throw new NullPointerException("prefix cannot be null");
        }
        return prefix + hash(parts);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every Java platform is required to support SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}

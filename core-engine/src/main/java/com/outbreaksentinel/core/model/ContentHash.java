package com.outbreaksentinel.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helper for content-addressed identifiers.
 *
 * @since 1.0.0
 */
public final class ContentHash {

    private ContentHash() {
        // utility class — not instantiable
    }

    /**
     * Hash the given parts, separated by a unit separator so that
     * {@code ("ab", "c")} and {@code ("a", "bc")} never collide.
     *
     * @param parts values to hash; {@code null} parts hash as empty
     * @return lowercase hex digest
     */
    public static String sha256(String... parts) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (String part : parts) {
                digest.update((part == null ? "" : part).getBytes(StandardCharsets.UTF_8));
                digest.update((byte) 0x1f);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            // every JDK is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

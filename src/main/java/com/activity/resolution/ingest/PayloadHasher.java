package com.activity.resolution.ingest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.StringJoiner;

/**
 * SHA-256 over the normalized fields of a source row, {@code |}-joined, as lower-case hex.
 */
public final class PayloadHasher {

    private PayloadHasher() {
    }

    public static String hash(Object... fields) {
        StringJoiner joined = new StringJoiner("|");
        for (Object field : fields) {
            joined.add(String.valueOf(field));
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(joined.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

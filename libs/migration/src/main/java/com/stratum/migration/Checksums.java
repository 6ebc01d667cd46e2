package com.stratum.migration;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Content checksums recorded in the ledger: SHA-256 over the exact script bytes, lowercase hex. */
public final class Checksums {

    public static final String ALGORITHM = "SHA-256";

    private static final HexFormat HEX = HexFormat.of();

    private Checksums() {
        // utility class
    }

    public static String sha256(byte[] content) {
        try {
            return HEX.formatHex(MessageDigest.getInstance(ALGORITHM).digest(content));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256.
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}

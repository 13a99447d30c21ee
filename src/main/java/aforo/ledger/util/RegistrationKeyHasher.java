package aforo.ledger.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic digest of provider registration keys, used to remember consumed keys
 * without storing them.
 */
public final class RegistrationKeyHasher {

    private static final String ALGORITHM = "SHA-256";

    private RegistrationKeyHasher() {}

    /**
     * Lowercase hex SHA-256 of {@code key}.
     */
    public static String digest(byte[] key) {
        if (key == null) {
            throw new IllegalArgumentException("key is required");
        }
        try {
            MessageDigest messageDigest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(messageDigest.digest(key));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}

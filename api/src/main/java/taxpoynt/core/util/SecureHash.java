package taxpoynt.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Hashing and random-identifier helpers for sensitive values.
 *
 * <p>Raw tokens and passwords never appear in cache keys or logs; their
 * SHA-256 digests do.
 */
public final class SecureHash {

    private static final int MAX_HEX_CHARS = 64;
    private static final SecureRandom RANDOM = new SecureRandom();

    private SecureHash() {}

    /**
     * Return a truncated SHA-256 hex digest of the input string.
     *
     * @param input    the string to hash
     * @param hexChars number of hex characters to return (1-64)
     * @return truncated hex digest
     * @throws IllegalArgumentException if hexChars is out of range
     */
    public static String truncatedSha256(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        return HexFormat.of().formatHex(sha256(input)).substring(0, hexChars);
    }

    /**
     * Constant-time comparison of the SHA-256 digests of two strings.
     */
    public static boolean digestEquals(String candidate, byte[] expectedDigest) {
        return MessageDigest.isEqual(sha256(candidate), expectedDigest);
    }

    public static byte[] sha256(String input) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is required on every JDK", e);
        }
    }

    /**
     * URL-safe Base64 (no padding) of {@code byteCount} random bytes.
     */
    public static String randomUrlToken(int byteCount) {
        final var bytes = new byte[byteCount];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Lowercase hex of random bytes, truncated to {@code hexChars}.
     */
    public static String randomHex(int hexChars) {
        final var bytes = new byte[(hexChars + 1) / 2];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes).substring(0, hexChars);
    }
}

package com.chartgate.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Generates API key secrets and computes/compares their salted hashes.
 * <p>
 * Raw secrets are {@value #SECRET_PREFIX} followed by 32 random bytes in URL-safe Base64. Storage
 * keeps the first {@value #LOOKUP_PREFIX_LENGTH} characters in clear (for display and to narrow
 * candidates) plus {@code SHA-256(salt || secret)}. Comparisons go through
 * {@link MessageDigest#isEqual}, whose running time does not depend on where digests differ.
 */
public final class SecretHasher {

    /** Marker at the start of every generated secret. */
    public static final String SECRET_PREFIX = "cg_";

    /** Clear-text characters of a secret kept in storage. */
    public static final int LOOKUP_PREFIX_LENGTH = 8;

    private static final int SECRET_BYTES = 32;
    private static final int SALT_BYTES = 16;
    private static final int FINGERPRINT_HEX_CHARS = 16;
    private static final HexFormat HEX = HexFormat.of();

    private final SecureRandom random;

    public SecretHasher() {
        this(new SecureRandom());
    }

    public SecretHasher(SecureRandom random) {
        this.random = random;
    }

    /** A fresh raw secret. */
    public String newSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        random.nextBytes(bytes);
        return SECRET_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /** A fresh hex-encoded salt. */
    public String newSalt() {
        byte[] bytes = new byte[SALT_BYTES];
        random.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }

    /** Hex-encoded {@code SHA-256(salt || secret)}. */
    public String hash(String salt, String secret) {
        return HEX.formatHex(digest(salt, secret));
    }

    /**
     * Whether {@code presentedSecret} hashes to {@code expectedHash} under {@code salt}.
     * Malformed stored hashes compare as unequal.
     */
    public boolean matches(String salt, String presentedSecret, String expectedHash) {
        byte[] expected;
        try {
            expected = HEX.parseHex(expectedHash);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(digest(salt, presentedSecret), expected);
    }

    /**
     * The clear-text lookup prefix of a secret; shorter secrets are returned whole.
     */
    public static String lookupPrefix(String secret) {
        return secret.length() <= LOOKUP_PREFIX_LENGTH
                ? secret
                : secret.substring(0, LOOKUP_PREFIX_LENGTH);
    }

    /**
     * Unsalted, truncated SHA-256 of a credential. Used as a stable in-memory identity for
     * callers that have no tenant, so raw credentials never become map keys or log fields.
     */
    public static String fingerprint(String credential) {
        byte[] digest = sha256().digest(credential.getBytes(StandardCharsets.UTF_8));
        return HEX.formatHex(digest).substring(0, FINGERPRINT_HEX_CHARS);
    }

    /** Unsalted SHA-256 of a value; fixed length so comparisons leak nothing about length. */
    static byte[] sha256(String value) {
        return sha256().digest(value.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] digest(String salt, String secret) {
        MessageDigest md = sha256();
        md.update(salt.getBytes(StandardCharsets.UTF_8));
        md.update(secret.getBytes(StandardCharsets.UTF_8));
        return md.digest();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package com.hashhunt.digest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Supported hash algorithms.
 *
 * Resolved once from its name at configuration time; workers then call
 * the {@link DigestFunction} directly, with no per-candidate name dispatch.
 */
public enum HashAlgorithm implements DigestFunctionFactory {

    MD5("MD5", 32),
    SHA1("SHA-1", 40),
    SHA256("SHA-256", 64);

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final String jcaName;
    private final int hexLength;

    HashAlgorithm(String jcaName, int hexLength) {
        this.jcaName = jcaName;
        this.hexLength = hexLength;
    }

    /**
     * Parses an algorithm name. Case-insensitive, the dash is optional
     * ("SHA-256", "sha256", "md5").
     *
     * @param name algorithm name
     * @return matching algorithm
     * @throws UnsupportedAlgorithmException for anything else
     */
    public static HashAlgorithm fromName(String name) {
        if (name == null) {
            throw new UnsupportedAlgorithmException(null);
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace("-", "");
        switch (normalized) {
            case "MD5":
                return MD5;
            case "SHA1":
                return SHA1;
            case "SHA256":
                return SHA256;
            default:
                throw new UnsupportedAlgorithmException(name);
        }
    }

    /**
     * @return the name used by the JCA and written to output files (e.g. "SHA-1")
     */
    public String getDisplayName() {
        return jcaName;
    }

    /**
     * @return number of hex characters in a digest of this algorithm
     */
    public int getHexLength() {
        return hexLength;
    }

    /**
     * Creates a digest function backed by its own {@link MessageDigest}.
     */
    @Override
    public DigestFunction newInstance() {
        MessageDigest md = newMessageDigest();
        return candidate -> {
            md.reset();
            return toHex(md.digest(candidate.getBytes(StandardCharsets.UTF_8)));
        };
    }

    /**
     * One-off digest, convenient outside the hot loop.
     */
    public String digest(String candidate) {
        return newInstance().digest(candidate);
    }

    /**
     * @return a new MessageDigest for this algorithm
     */
    public MessageDigest newMessageDigest() {
        try {
            return MessageDigest.getInstance(jcaName);
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship MD5, SHA-1 and SHA-256
            throw new IllegalStateException(jcaName + " not available in this JRE", e);
        }
    }

    /**
     * Converts bytes to a lower-case hex string (2 chars per byte).
     */
    public static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xff;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    @Override
    public String toString() {
        return jcaName;
    }
}

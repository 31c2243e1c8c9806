package de.bsommerfeld.checksum.hash;

import java.util.Locale;

/**
 * The fixed set of supported checksum algorithms.
 */
public enum ChecksumType {

    MD5("MD5", 16),
    SHA1("SHA-1", 20),
    SHA256("SHA-256", 32),
    SHA512("SHA-512", 64);

    private final String algorithm;
    private final int digestLength;

    ChecksumType(String algorithm, int digestLength) {
        this.algorithm = algorithm;
        this.digestLength = digestLength;
    }

    /** JCA algorithm name passed to {@link java.security.MessageDigest#getInstance(String)}. */
    public String algorithm() {
        return algorithm;
    }

    /** Digest size in bytes. */
    public int digestLength() {
        return digestLength;
    }

    /** Length of the hex-encoded digest, two characters per byte. */
    public int hexLength() {
        return digestLength * 2;
    }

    /**
     * Resolves a user-supplied name: either the constant name ({@code md5},
     * {@code sha256}) or the algorithm name ({@code SHA-256}), ignoring case
     * and surrounding whitespace.
     *
     * @throws InvalidChecksumKindException if the name is blank or unknown
     */
    public static ChecksumType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidChecksumKindException("Checksum type must not be empty");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (ChecksumType type : values()) {
            if (type.name().equals(normalized) || type.algorithm().equals(normalized)) {
                return type;
            }
        }
        throw new InvalidChecksumKindException("Unsupported checksum type: " + name);
    }
}

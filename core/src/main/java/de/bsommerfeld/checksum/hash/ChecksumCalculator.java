package de.bsommerfeld.checksum.hash;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes hex-encoded file checksums. Uses streaming I/O to handle arbitrarily
 * large files without loading them entirely into memory.
 *
 * <p>Read failures never escape: a file that cannot be opened or read yields
 * {@link #NO_CHECKSUM}. Only a missing {@link ChecksumType} is reported to the
 * caller, as an {@link InvalidChecksumKindException}.
 */
public final class ChecksumCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(ChecksumCalculator.class);

    /** Returned when a file could not be read. Never a valid checksum. */
    public static final String NO_CHECKSUM = "";

    private static final int BUFFER_SIZE = 8192;
    private static final HexFormat HEX = HexFormat.of();

    private ChecksumCalculator() {}

    /**
     * Computes the lowercase hex checksum of the given file.
     *
     * @return the checksum, or {@link #NO_CHECKSUM} if the file cannot be read
     * @throws InvalidChecksumKindException if {@code type} is {@code null}
     */
    public static String checksum(Path file, ChecksumType type) {
        MessageDigest digest = newDigest(type);
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
            return HEX.formatHex(digest.digest());
        } catch (IOException e) {
            LOG.debug("Could not checksum {}: {}", file, e.toString());
            return NO_CHECKSUM;
        } finally {
            digest.reset();
        }
    }

    /**
     * Computes the lowercase hex checksum of a raw byte array.
     *
     * @throws InvalidChecksumKindException if {@code type} is {@code null}
     */
    public static String checksum(byte[] data, ChecksumType type) {
        MessageDigest digest = newDigest(type);
        try {
            return HEX.formatHex(digest.digest(data));
        } finally {
            digest.reset();
        }
    }

    /**
     * Whether {@code checksum} has the length and lowercase hex alphabet
     * produced by {@code type}. {@link #NO_CHECKSUM} is never well formed.
     */
    public static boolean isWellFormed(String checksum, ChecksumType type) {
        if (checksum == null || type == null || checksum.length() != type.hexLength()) {
            return false;
        }
        for (int i = 0; i < checksum.length(); i++) {
            char c = checksum.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }

    private static MessageDigest newDigest(ChecksumType type) {
        if (type == null) {
            throw new InvalidChecksumKindException("Checksum type must not be null");
        }
        try {
            return MessageDigest.getInstance(type.algorithm());
        } catch (NoSuchAlgorithmException e) {
            // All four are mandated by the JVM spec, unreachable
            throw new AssertionError(type.algorithm() + " not available", e);
        }
    }
}

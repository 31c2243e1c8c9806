package de.bsommerfeld.checksum.hash;

/**
 * Thrown when a checksum kind is missing or names an algorithm outside
 * {@link ChecksumType}.
 */
public class InvalidChecksumKindException extends IllegalArgumentException {

    public InvalidChecksumKindException(String message) {
        super(message);
    }
}

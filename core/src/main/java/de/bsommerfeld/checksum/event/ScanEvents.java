package de.bsommerfeld.checksum.event;

import java.nio.file.Path;

/**
 * Events posted by {@link de.bsommerfeld.checksum.scan.ChecksumScanner} while a
 * scan runs.
 */
public class ScanEvents {

    public record FileChecksummedEvent(Path path, String checksum) {
    }

    /**
     * Fired when a listed file could not be read, e.g. because it was deleted
     * or locked between listing and hashing.
     */
    public record ChecksumFailedEvent(Path path) {
    }

    public record ScanCompletedEvent(Path basePath, int total, int failed) {
    }
}

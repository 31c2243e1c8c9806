package de.bsommerfeld.checksum.model;

import de.bsommerfeld.checksum.hash.ChecksumCalculator;

import java.nio.file.Path;

/**
 * A scanned file and its checksum.
 *
 * @param path     file path as produced by the walker
 * @param checksum lowercase hex checksum, or {@link ChecksumCalculator#NO_CHECKSUM}
 *                 if the file could not be read
 */
public record FileChecksum(Path path, String checksum) {

    public boolean isComputed() {
        return !ChecksumCalculator.NO_CHECKSUM.equals(checksum);
    }

    /**
     * Path relative to {@code base} with forward slashes, as stored in a
     * manifest independent of the OS.
     */
    public String normalizedPath(Path base) {
        Path relative = path.startsWith(base) ? base.relativize(path) : path;
        return relative.toString().replace('\\', '/');
    }
}

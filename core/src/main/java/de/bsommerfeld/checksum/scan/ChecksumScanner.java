package de.bsommerfeld.checksum.scan;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.checksum.config.ScannerConfig;
import de.bsommerfeld.checksum.event.ScanEventBus;
import de.bsommerfeld.checksum.hash.ChecksumCalculator;
import de.bsommerfeld.checksum.hash.ChecksumType;
import de.bsommerfeld.checksum.hash.InvalidChecksumKindException;
import de.bsommerfeld.checksum.model.FileChecksum;
import de.bsommerfeld.checksum.model.ScanRequest;
import de.bsommerfeld.checksum.walk.DirectoryWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Feeds the files found by {@link DirectoryWalker} through
 * {@link ChecksumCalculator}, one file at a time, and returns the
 * {@code (path, checksum)} pairs a manifest is built from or compared against.
 *
 * <p>
 * Files that could not be read stay in the result with
 * {@link ChecksumCalculator#NO_CHECKSUM} so the caller can report them.
 */
@Singleton
public class ChecksumScanner {

    private static final Logger LOG = LoggerFactory.getLogger(ChecksumScanner.class);

    private final DirectoryWalker walker;
    private final ScanEventBus eventBus;
    private final ScannerConfig config;

    @Inject
    public ChecksumScanner(DirectoryWalker walker, ScanEventBus eventBus, ScannerConfig config) {
        this.walker = walker;
        this.eventBus = eventBus;
        this.config = config;
    }

    /** Scans with the request and checksum type of the configuration. */
    public List<FileChecksum> scan() {
        return scan(config.toScanRequest(), config.getChecksumType());
    }

    /** Scans with the configured request, using {@code type} instead of the configured one. */
    public List<FileChecksum> scan(ChecksumType type) {
        return scan(config.toScanRequest(), type);
    }

    /**
     * @throws InvalidChecksumKindException if {@code type} is {@code null}
     */
    public List<FileChecksum> scan(ScanRequest request, ChecksumType type) {
        if (type == null) {
            throw new InvalidChecksumKindException("Checksum type must not be null");
        }

        List<Path> files = walker.list(request);
        LOG.debug("Found {} files under {}", files.size(), request.basePath());

        List<FileChecksum> results = new ArrayList<>(files.size());
        int failed = 0;
        for (Path file : files) {
            FileChecksum result = new FileChecksum(file, ChecksumCalculator.checksum(file, type));
            if (result.isComputed()) {
                eventBus.fileChecksummed(file, result.checksum());
            } else {
                failed++;
                eventBus.checksumFailed(file);
            }
            results.add(result);
        }

        LOG.info("Checksummed {} files under {} with {} ({} unreadable)",
                results.size(), request.basePath(), type, failed);
        eventBus.scanCompleted(request.basePath(), results.size(), failed);
        return results;
    }
}

package de.bsommerfeld.checksum.scan;

import de.bsommerfeld.checksum.config.ScannerConfig;
import de.bsommerfeld.checksum.event.ScanEventBus;
import de.bsommerfeld.checksum.hash.ChecksumCalculator;
import de.bsommerfeld.checksum.hash.ChecksumType;
import de.bsommerfeld.checksum.model.FileChecksum;
import de.bsommerfeld.checksum.model.ScanRequest;
import de.bsommerfeld.checksum.walk.DirectoryWalker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end scans over real directories: walker and calculator together.
 */
class ChecksumScanIntegrationTest {

    @TempDir
    Path tempDir;

    private Path data;
    private ChecksumScanner scanner;

    @BeforeEach
    void setUp() throws IOException {
        data = Files.createDirectories(tempDir.resolve("data"));
        Files.writeString(data.resolve("a.csv"), "1,2,3");
        Files.writeString(data.resolve("b.csv"), "4,5,6");
        Files.writeString(data.resolve("c.bak"), "backup");
        Files.createDirectories(data.resolve("archive"));
        Files.writeString(data.resolve("archive").resolve("d.csv"), "7,8,9");

        scanner = new ChecksumScanner(new DirectoryWalker(), new ScanEventBus(), new ScannerConfig());
    }

    @Test
    void scan_shouldChecksumMatchingCsvFilesInTopLevel() {
        var request = new ScanRequest(data, "", "*.csv", false);

        List<FileChecksum> result = scanner.scan(request, ChecksumType.SHA256);

        Set<String> paths = result.stream().map(r -> r.normalizedPath(data)).collect(Collectors.toSet());
        assertEquals(Set.of("a.csv", "b.csv"), paths);
        for (FileChecksum entry : result) {
            assertEquals(64, entry.checksum().length());
            assertTrue(ChecksumCalculator.isWellFormed(entry.checksum(), ChecksumType.SHA256));
        }
    }

    @Test
    void scan_shouldDescendAndExcludeWhenRequested() {
        var request = new ScanRequest(data, "*.bak", "*", true);

        Map<String, String> byPath = scanner.scan(request, ChecksumType.MD5).stream()
                .collect(Collectors.toMap(r -> r.normalizedPath(data), FileChecksum::checksum));

        assertEquals(Set.of("a.csv", "b.csv", "archive/d.csv"), byPath.keySet());
        assertEquals(ChecksumCalculator.checksum("7,8,9".getBytes(), ChecksumType.MD5), byPath.get("archive/d.csv"));
    }

    @Test
    void scan_shouldBeDeterministic() {
        var request = ScanRequest.of(data);

        Map<Path, String> first = toMap(scanner.scan(request, ChecksumType.SHA512));
        Map<Path, String> second = toMap(scanner.scan(request, ChecksumType.SHA512));

        assertEquals(first, second);
    }

    @Test
    void scan_shouldReturnEmptyForMissingBase() {
        assertTrue(scanner.scan(ScanRequest.of(tempDir.resolve("nope")), ChecksumType.SHA1).isEmpty());
    }

    private static Map<Path, String> toMap(List<FileChecksum> entries) {
        return entries.stream().collect(Collectors.toMap(FileChecksum::path, FileChecksum::checksum));
    }
}

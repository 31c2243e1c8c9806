package de.bsommerfeld.checksum.config;

import de.bsommerfeld.checksum.hash.ChecksumType;
import de.bsommerfeld.checksum.model.ScanRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScannerConfigTest {

    private static final List<String> KEYS = List.of(
            ScannerConfig.BASE_PATH, ScannerConfig.TYPE, ScannerConfig.MATCH,
            ScannerConfig.EXCLUDE, ScannerConfig.RECURSE);

    @AfterEach
    void clearProperties() {
        KEYS.forEach(System::clearProperty);
    }

    @Test
    void defaults_shouldMatchCommandLineDefaults() {
        var config = new ScannerConfig();

        assertEquals(Path.of("."), config.getBasePath());
        assertEquals(ChecksumType.MD5, config.getChecksumType());
        assertEquals("*", config.getMatchGlob());
        assertEquals("", config.getExcludeGlob());
        assertTrue(config.isRecurse());
    }

    @Test
    void load_shouldResolveFromSystemProperties() {
        System.setProperty(ScannerConfig.BASE_PATH, "/data");
        System.setProperty(ScannerConfig.TYPE, "sha256");
        System.setProperty(ScannerConfig.MATCH, "*.csv");
        System.setProperty(ScannerConfig.EXCLUDE, "*.bak");
        System.setProperty(ScannerConfig.RECURSE, "false");

        var config = ScannerConfig.load();

        assertEquals(Path.of("/data"), config.getBasePath());
        assertEquals(ChecksumType.SHA256, config.getChecksumType());
        assertEquals("*.csv", config.getMatchGlob());
        assertEquals("*.bak", config.getExcludeGlob());
        assertFalse(config.isRecurse());
    }

    @Test
    void load_shouldDefaultForUnknownChecksumType() {
        System.setProperty(ScannerConfig.TYPE, "crc32");
        assertEquals(ChecksumType.MD5, ScannerConfig.load().getChecksumType());
    }

    @Test
    void load_shouldDefaultForInvalidRecurseFlag() {
        System.setProperty(ScannerConfig.RECURSE, "sometimes");
        assertTrue(ScannerConfig.load().isRecurse());
    }

    @Test
    void load_shouldAcceptRecurseFlagCaseInsensitive() {
        System.setProperty(ScannerConfig.RECURSE, "FALSE");
        assertFalse(ScannerConfig.load().isRecurse());
    }

    @Test
    void load_shouldTreatEmptyPropertyAsUnset() {
        System.setProperty(ScannerConfig.MATCH, "");
        System.setProperty(ScannerConfig.TYPE, "");

        var config = ScannerConfig.load();
        assertEquals("*", config.getMatchGlob());
        assertEquals(ChecksumType.MD5, config.getChecksumType());
    }

    @Test
    void load_shouldKeepExplicitlyEmptyExclude() {
        System.setProperty(ScannerConfig.EXCLUDE, "");
        assertEquals("", ScannerConfig.load().getExcludeGlob());
    }

    @Test
    void toScanRequest_shouldCarryAllSettings() {
        var config = new ScannerConfig();
        config.setBasePath(Path.of("data"));
        config.setMatchGlob("*.csv");
        config.setExcludeGlob("old");
        config.setRecurse(false);

        assertEquals(new ScanRequest(Path.of("data"), "old", "*.csv", false), config.toScanRequest());
    }
}

package de.bsommerfeld.checksum.config;

import com.google.common.base.Strings;
import de.bsommerfeld.checksum.hash.ChecksumType;
import de.bsommerfeld.checksum.hash.InvalidChecksumKindException;
import de.bsommerfeld.checksum.model.ScanRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Scan settings of the command-line layer that drives the scanner. Each setting
 * is taken from a {@code checksum.*} system property when present, otherwise
 * from the built-in default. Invalid values are logged and replaced by the
 * default. The walker and calculator never read this class.
 */
public class ScannerConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ScannerConfig.class);

    static final String BASE_PATH = "checksum.base-path";
    static final String TYPE = "checksum.type";
    static final String MATCH = "checksum.match";
    static final String EXCLUDE = "checksum.exclude";
    static final String RECURSE = "checksum.recurse";

    private Path basePath = Path.of(".");
    private ChecksumType checksumType = ChecksumType.MD5;
    private String matchGlob = ScanRequest.MATCH_ALL;
    private String excludeGlob = "";
    private boolean recurse = true;

    /** Builds a config from the {@code checksum.*} system properties. */
    public static ScannerConfig load() {
        ScannerConfig config = new ScannerConfig();

        String basePath = lookup(BASE_PATH);
        if (basePath != null) {
            try {
                config.setBasePath(Path.of(basePath));
            } catch (InvalidPathException e) {
                LOG.warn("Invalid base path '{}'. Defaulting to '{}'.", basePath, config.getBasePath());
            }
        }

        String type = lookup(TYPE);
        if (type != null) {
            try {
                config.setChecksumType(ChecksumType.fromName(type));
            } catch (InvalidChecksumKindException e) {
                LOG.warn("Unknown checksum type '{}'. Defaulting to {}.", type, config.getChecksumType());
            }
        }

        String match = lookup(MATCH);
        if (match != null) {
            config.setMatchGlob(match);
        }

        // An explicitly empty exclude is meaningful, so only null falls through
        String exclude = System.getProperty(EXCLUDE);
        if (exclude != null) {
            config.setExcludeGlob(exclude);
        }

        String recurse = lookup(RECURSE);
        if (recurse != null) {
            if (recurse.equalsIgnoreCase("true") || recurse.equalsIgnoreCase("false")) {
                config.setRecurse(Boolean.parseBoolean(recurse));
            } else {
                LOG.warn("Invalid recurse flag '{}'. Defaulting to {}.", recurse, config.isRecurse());
            }
        }

        return config;
    }

    /** Returns the system property {@code key}; empty values count as unset. */
    static String lookup(String key) {
        return Strings.emptyToNull(System.getProperty(key));
    }

    public ScanRequest toScanRequest() {
        return new ScanRequest(basePath, excludeGlob, matchGlob, recurse);
    }

    public Path getBasePath() {
        return basePath;
    }

    public void setBasePath(Path basePath) {
        this.basePath = basePath;
    }

    public ChecksumType getChecksumType() {
        return checksumType;
    }

    public void setChecksumType(ChecksumType checksumType) {
        this.checksumType = checksumType;
    }

    public String getMatchGlob() {
        return matchGlob;
    }

    public void setMatchGlob(String matchGlob) {
        this.matchGlob = matchGlob;
    }

    public String getExcludeGlob() {
        return excludeGlob;
    }

    public void setExcludeGlob(String excludeGlob) {
        this.excludeGlob = excludeGlob;
    }

    public boolean isRecurse() {
        return recurse;
    }

    public void setRecurse(boolean recurse) {
        this.recurse = recurse;
    }
}

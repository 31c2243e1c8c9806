package de.bsommerfeld.checksum.model;

import com.google.common.base.Strings;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Parameters of a single directory scan.
 *
 * @param basePath    directory to scan; need not exist
 * @param excludeGlob glob removing any path that contains a match, empty for none
 * @param matchGlob   glob a file name must match, {@code "*"} for all
 * @param recurse     whether subdirectories are scanned as well
 */
public record ScanRequest(Path basePath, String excludeGlob, String matchGlob, boolean recurse) {

    public static final String MATCH_ALL = "*";

    public ScanRequest {
        Objects.requireNonNull(basePath, "basePath");
        excludeGlob = Strings.nullToEmpty(excludeGlob);
        matchGlob = Strings.isNullOrEmpty(matchGlob) ? MATCH_ALL : matchGlob;
    }

    /** Recursive scan of every file under {@code basePath}. */
    public static ScanRequest of(Path basePath) {
        return new ScanRequest(basePath, "", MATCH_ALL, true);
    }

    public ScanRequest withExclude(String glob) {
        return new ScanRequest(basePath, glob, matchGlob, recurse);
    }

    public ScanRequest withMatch(String glob) {
        return new ScanRequest(basePath, excludeGlob, glob, recurse);
    }

    public ScanRequest withRecurse(boolean recurse) {
        return new ScanRequest(basePath, excludeGlob, matchGlob, recurse);
    }
}

package de.bsommerfeld.checksum.walk;

import com.google.common.base.Strings;
import com.google.inject.Singleton;
import de.bsommerfeld.checksum.model.ScanRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists files under a directory tree, filtered by a match glob and an exclude
 * glob.
 *
 * <p>
 * The walk is best effort. Missing directories produce no files, and
 * directories that cannot be read because of missing permissions are skipped
 * without failing the scan. Any other I/O failure is rethrown as an
 * {@link UncheckedIOException}.
 *
 * <h3>Filtering</h3>
 * The match glob is applied to the file name of each entry and must match it
 * completely. The exclude glob is applied to the full path string and removes
 * an entry if it matches <em>anywhere</em> in it, so {@code *.log} also drops
 * {@code a.log.gz} and {@code tmp} drops everything below a {@code tmp}
 * directory.
 *
 * <h3>Permission failures</h3>
 * Each directory level owns its failures. If the subdirectories of a level
 * cannot be enumerated, everything that level would still have contributed is
 * dropped, while the files of the level itself and the results of its parent
 * and siblings are kept.
 *
 * <p>
 * Symbolic links to directories are not followed. No ordering is guaranteed.
 */
@Singleton
public class DirectoryWalker {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryWalker.class);

    static final DirectoryStream.Filter<Path> REGULAR_FILES = Files::isRegularFile;
    static final DirectoryStream.Filter<Path> SUBDIRECTORIES = path -> Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS);

    private final DirectoryReader reader;

    public DirectoryWalker() {
        this(DirectoryWalker::readDirectory);
    }

    DirectoryWalker(DirectoryReader reader) {
        this.reader = reader;
    }

    /**
     * Lists the regular files directly inside {@code dir}.
     *
     * @param dir         directory to list; may not exist
     * @param excludeGlob glob removing matching paths, {@code null} or empty for none
     * @param matchGlob   glob the file name must match, {@code null} or empty for all
     * @return matching files, empty if {@code dir} is missing or unreadable
     */
    public List<Path> listDirectory(Path dir, String excludeGlob, String matchGlob) {
        return filesIn(dir, excludePattern(excludeGlob), matchPattern(matchGlob)).files();
    }

    /**
     * Lists the files of {@code basePath} and, if {@code recurse} is set, of all
     * directories below it.
     */
    public List<Path> listRecursive(Path basePath, String excludeGlob, String matchGlob, boolean recurse) {
        WalkResult result = walk(basePath, excludePattern(excludeGlob), matchPattern(matchGlob), recurse);
        if (result.isPartial()) {
            LOG.debug("Skipped {} inaccessible directories under {}", result.skipped().size(), basePath);
        }
        return result.files();
    }

    public List<Path> list(ScanRequest request) {
        return listRecursive(request.basePath(), request.excludeGlob(), request.matchGlob(), request.recurse());
    }

    WalkResult walk(Path dir, GlobPattern exclude, GlobPattern match, boolean recurse) {
        WalkResult own = filesIn(dir, exclude, match);
        // A partial level result means dir itself is unreadable
        if (!recurse || own.isPartial() || !Files.isDirectory(dir)) {
            return own;
        }

        List<Path> files = new ArrayList<>(own.files());
        List<Path> skipped = new ArrayList<>();
        try {
            for (Path subDir : reader.read(dir, SUBDIRECTORIES)) {
                WalkResult sub = walk(subDir, exclude, match, true);
                files.addAll(sub.files());
                skipped.addAll(sub.skipped());
            }
        } catch (AccessDeniedException e) {
            LOG.debug("Cannot enumerate subdirectories of {}: {}", dir, e.getMessage());
            skipped.add(dir);
        } catch (NoSuchFileException e) {
            LOG.debug("Directory vanished during scan: {}", dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list subdirectories of " + dir, e);
        }
        return new WalkResult(files, skipped);
    }

    private WalkResult filesIn(Path dir, GlobPattern exclude, GlobPattern match) {
        if (!Files.isDirectory(dir)) {
            return WalkResult.EMPTY;
        }

        List<Path> entries;
        try {
            entries = reader.read(dir, REGULAR_FILES);
        } catch (AccessDeniedException e) {
            LOG.debug("Cannot list {}: {}", dir, e.getMessage());
            return WalkResult.partial(List.of(), List.of(dir));
        } catch (NoSuchFileException e) {
            LOG.debug("Directory vanished during scan: {}", dir);
            return WalkResult.EMPTY;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }

        List<Path> files = new ArrayList<>();
        for (Path entry : entries) {
            if (!match.matchesFully(entry.getFileName().toString())) {
                continue;
            }
            if (exclude != null && exclude.find(entry.toString())) {
                continue;
            }
            files.add(entry);
        }
        return WalkResult.ok(files);
    }

    private static List<Path> readDirectory(Path dir, DirectoryStream.Filter<Path> filter) throws IOException {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, filter)) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        } catch (DirectoryIteratorException e) {
            throw e.getCause();
        }
        return entries;
    }

    private static GlobPattern excludePattern(String excludeGlob) {
        return Strings.isNullOrEmpty(excludeGlob) ? null : GlobPattern.compile(excludeGlob);
    }

    private static GlobPattern matchPattern(String matchGlob) {
        return GlobPattern.compile(Strings.isNullOrEmpty(matchGlob) ? ScanRequest.MATCH_ALL : matchGlob);
    }
}

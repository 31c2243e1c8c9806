package de.bsommerfeld.checksum.walk;

import com.google.common.collect.ImmutableList;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of walking one directory level: the files found and the directories
 * that could not be read. A non-empty {@code skipped} list marks the result as
 * partial.
 */
record WalkResult(List<Path> files, List<Path> skipped) {

    static final WalkResult EMPTY = new WalkResult(List.of(), List.of());

    WalkResult {
        files = ImmutableList.copyOf(files);
        skipped = ImmutableList.copyOf(skipped);
    }

    static WalkResult ok(List<Path> files) {
        return new WalkResult(files, List.of());
    }

    static WalkResult partial(List<Path> files, List<Path> skipped) {
        return new WalkResult(files, skipped);
    }

    boolean isPartial() {
        return !skipped.isEmpty();
    }
}

/**
 * File discovery for checksum scans.
 *
 * <h2>Contract</h2>
 * Walking is read-only and best effort: a missing base directory yields no
 * files, and unreadable directories are skipped rather than failing the scan.
 * Only unexpected I/O failures reach the caller.
 *
 * <h2>Class responsibilities</h2>
 *
 * <pre>
 * DirectoryWalker  — lists files per level, recurses, applies match/exclude globs
 * GlobPattern      — wildcard to regex translation (* and ?), substring or full match
 * WalkResult       — per-level files plus the directories that had to be skipped
 * DirectoryReader  — listing hook the walker reads each directory through
 * </pre>
 */
package de.bsommerfeld.checksum.walk;

package de.bsommerfeld.checksum.walk;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the entries of one directory that pass a filter. The whole listing is
 * returned at once, so a failure surfaces before any entry is processed.
 */
@FunctionalInterface
interface DirectoryReader {

    List<Path> read(Path dir, DirectoryStream.Filter<Path> filter) throws IOException;
}

package de.bsommerfeld.wbm.archive;

import java.nio.file.Path;

/**
 * A stored entry as found on disk.
 *
 * @param digest digest encoded by the entry's location
 * @param path   the gzip file holding the content
 */
public record ArchiveEntry(String digest, Path path) {
}

package de.bsommerfeld.wbm.archive;

import java.nio.file.Path;

/**
 * Ingestion decision for a candidate input file, returned by
 * {@link ArchiveStore#checkFileLocation(Path)} when the content is not stored
 * yet.
 */
public sealed interface FileLocation permits FileLocation.Available, FileLocation.Mismatch {

    /**
     * The content is new and may be compressed into {@code target}.
     */
    record Available(String digest, Path target) implements FileLocation {
    }

    /**
     * The input's file name claims {@code expected} but its bytes hash to
     * {@code actual}. The input is corrupt and must not be ingested.
     */
    record Mismatch(String expected, String actual) implements FileLocation {
    }
}

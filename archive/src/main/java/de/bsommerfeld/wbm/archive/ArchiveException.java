package de.bsommerfeld.wbm.archive;

import java.io.EOFException;
import java.io.IOException;
import java.util.zip.ZipException;

/**
 * Thrown when an archive entry or an input file cannot be read, inflated or
 * decoded, or when the store directory does not have the expected layout.
 * A digest that disagrees with its entry is not an error and is never
 * reported through this exception.
 */
public class ArchiveException extends Exception {

    public enum Kind {
        /** The file or stream could not be read or written. */
        IO,
        /** The bytes are not valid gzip framing. */
        DECOMPRESSION,
        /** The inflated bytes are not valid UTF-8 text. */
        DECODE,
        /** The store directory contains something other than shards and entries. */
        LAYOUT
    }

    private final Kind kind;

    public ArchiveException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ArchiveException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Wraps a failure raised while reading through a {@code GZIPInputStream}.
     * Bad headers, bad trailers and truncated streams count as
     * {@link Kind#DECOMPRESSION}; everything else is {@link Kind#IO}.
     */
    public static ArchiveException whileInflating(String message, IOException cause) {
        Kind kind = cause instanceof ZipException || cause instanceof EOFException
                ? Kind.DECOMPRESSION
                : Kind.IO;
        return new ArchiveException(kind, message, cause);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + kind + "]: " + getMessage();
    }
}

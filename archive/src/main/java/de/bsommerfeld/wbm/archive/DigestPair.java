package de.bsommerfeld.wbm.archive;

import java.nio.file.Path;

/**
 * Outcome of re-hashing one stored entry.
 *
 * @param expected digest implied by the entry's path
 * @param actual   digest of the entry's inflated content
 * @param path     the entry that was hashed
 */
public record DigestPair(String expected, String actual, Path path) {

    /** {@code false} means the content silently changed on disk. */
    public boolean isValid() {
        return expected.equals(actual);
    }
}

package de.bsommerfeld.wbm.archive.digest;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import de.bsommerfeld.wbm.archive.ArchiveException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * Content digests for archive entries. A digest is the lower-case hex SHA-1 of
 * the <em>uncompressed</em> content, which is how the Wayback Machine itself
 * identifies captures. Uses streaming I/O to handle arbitrarily large files
 * without loading them into memory.
 */
public final class Digests {

    public static final String ALGORITHM = "SHA-1";

    /** Hex characters in a digest. */
    public static final int LENGTH = 40;

    private static final int BUFFER_SIZE = 8192;

    private static final CharMatcher HEX = CharMatcher.inRange('0', '9')
            .or(CharMatcher.inRange('a', 'f'))
            .or(CharMatcher.inRange('A', 'F'));

    private Digests() {
    }

    /**
     * Reads {@code in} to the end and returns the digest of its bytes. The
     * stream is not closed.
     *
     * @throws ArchiveException of kind {@code IO} if the stream cannot be read
     */
    public static String computeDigest(InputStream in) throws ArchiveException {
        MessageDigest digest = newDigest();
        try {
            update(digest, in);
        } catch (IOException e) {
            throw new ArchiveException(ArchiveException.Kind.IO, "Failed to read content stream", e);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Inflates {@code in} as gzip and returns the digest of the inflated bytes.
     *
     * @throws ArchiveException of kind {@code DECOMPRESSION} if the stream is
     *                          not valid gzip, {@code IO} if it cannot be read
     */
    public static String computeDigestGz(InputStream in) throws ArchiveException {
        MessageDigest digest = newDigest();
        try {
            update(digest, new GZIPInputStream(in, BUFFER_SIZE));
        } catch (IOException e) {
            throw ArchiveException.whileInflating("Failed to inflate content stream", e);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /** File variant of {@link #computeDigest(InputStream)}. */
    public static String computeDigest(Path file) throws ArchiveException {
        try (InputStream in = Files.newInputStream(file)) {
            return computeDigest(in);
        } catch (ArchiveException e) {
            throw new ArchiveException(e.kind(), "Failed to read " + file, e.getCause());
        } catch (IOException e) {
            throw new ArchiveException(ArchiveException.Kind.IO, "Failed to read " + file, e);
        }
    }

    /** File variant of {@link #computeDigestGz(InputStream)}. */
    public static String computeDigestGz(Path file) throws ArchiveException {
        try (InputStream in = Files.newInputStream(file)) {
            return computeDigestGz(in);
        } catch (ArchiveException e) {
            throw new ArchiveException(e.kind(), "Failed to inflate " + file, e.getCause());
        } catch (IOException e) {
            throw new ArchiveException(ArchiveException.Kind.IO, "Failed to read " + file, e);
        }
    }

    /**
     * Whether {@code text} is a well-formed digest. Either case is accepted.
     */
    public static boolean isValid(String text) {
        return text != null && text.length() == LENGTH && HEX.matchesAllOf(text);
    }

    /**
     * Whether {@code text} could begin a digest, i.e. it is at most
     * {@link #LENGTH} hex characters. The empty string qualifies.
     */
    public static boolean isValidPrefix(String text) {
        return text != null && text.length() <= LENGTH && HEX.matchesAllOf(text);
    }

    /**
     * Returns the canonical (lower-case) form of {@code text}.
     *
     * @throws IllegalArgumentException if {@code text} is not a digest
     */
    public static String normalize(String text) {
        Preconditions.checkArgument(isValid(text), "Not a %s-character hex digest: %s", LENGTH, text);
        return text.toLowerCase(Locale.ROOT);
    }

    private static void update(MessageDigest digest, InputStream in) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = in.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
        }
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every Java platform ships SHA-1
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }
}

package de.bsommerfeld.wbm.archive;

import com.google.common.base.Preconditions;
import de.bsommerfeld.wbm.archive.digest.Digests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Directory-backed, content-addressed store of gzip-compressed captures.
 *
 * <h3>Layout</h3>
 * An entry with digest {@code d} lives at
 * {@code <root>/<d[0..2]>/<d[2..]>.gz}. The two-character shard keeps every
 * directory at no more than 256 subdirectories, and the content of each file,
 * once inflated, must hash to the digest spelled by its path.
 *
 * <h3>No index</h3>
 * The filesystem is the only source of truth. Every call derives paths from
 * digests or walks the tree again; nothing is cached between calls, and the
 * store holds no lock. An entry that disappears between a listing and a read
 * shows up as "not found" or as a broken item, never as a crash.
 */
public final class ArchiveStore {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveStore.class);

    static final int SHARD_WIDTH = 2;
    static final String EXTENSION = ".gz";
    static final String TEMP_PREFIX = ".ingest-";

    private final Path root;

    private ArchiveStore(Path root) {
        this.root = root;
    }

    /**
     * Creates the shard directories under {@code root}. Calling this on an
     * already initialized root is a no-op.
     *
     * @throws ArchiveException of kind {@code LAYOUT} if {@code root} is a
     *                          regular file or contains anything but shard
     *                          directories, {@code IO} if directories cannot
     *                          be created
     */
    public static ArchiveStore create(Path root) throws ArchiveException {
        Preconditions.checkNotNull(root, "root");
        if (Files.exists(root) && !Files.isDirectory(root)) {
            throw new ArchiveException(ArchiveException.Kind.LAYOUT, "Store root is not a directory: " + root);
        }

        try {
            if (Files.isDirectory(root)) {
                try (DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
                    for (Path entry : entries) {
                        if (!isShardDirectory(entry)) {
                            throw new ArchiveException(ArchiveException.Kind.LAYOUT,
                                    "Store root contains unexpected entry: " + entry);
                        }
                    }
                }
            }
            for (String shard : shardNames()) {
                Files.createDirectories(root.resolve(shard));
            }
        } catch (IOException e) {
            throw new ArchiveException(ArchiveException.Kind.IO, "Failed to create store at " + root, e);
        }

        LOG.info("Initialized archive store at {}", root.toAbsolutePath());
        return new ArchiveStore(root);
    }

    /**
     * Binds to an existing root. Nothing is validated here; see
     * {@link #computeDigests(String, int)} for the integrity audit.
     */
    public static ArchiveStore open(Path root) {
        return new ArchiveStore(Preconditions.checkNotNull(root, "root"));
    }

    public Path root() {
        return root;
    }

    /**
     * The location an entry with {@code digest} occupies, whether or not it
     * exists.
     *
     * @throws IllegalArgumentException if {@code digest} is malformed
     */
    public Path pathFor(String digest) {
        String normalized = Digests.normalize(digest);
        return root.resolve(normalized.substring(0, SHARD_WIDTH))
                .resolve(normalized.substring(SHARD_WIDTH) + EXTENSION);
    }

    /**
     * Returns the inflated text of the entry for {@code digest}, or empty when
     * the store has no such entry.
     *
     * @throws ArchiveException if the entry exists but cannot be read, is not
     *                          valid gzip or is not UTF-8 text
     */
    public Optional<String> extract(String digest) throws ArchiveException {
        Path path = pathFor(digest);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }

        byte[] content;
        try (InputStream raw = Files.newInputStream(path);
                InputStream in = new GZIPInputStream(raw)) {
            content = in.readAllBytes();
        } catch (NoSuchFileException e) {
            LOG.debug("Entry {} vanished before it could be read", digest);
            return Optional.empty();
        } catch (IOException e) {
            throw ArchiveException.whileInflating("Failed to inflate " + path, e);
        }

        try {
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString());
        } catch (CharacterCodingException e) {
            throw new ArchiveException(ArchiveException.Kind.DECODE, "Entry is not UTF-8 text: " + path, e);
        }
    }

    /**
     * Lazily lists every entry whose digest starts with {@code prefix}. The
     * walk opens one shard directory at a time, so huge stores are never
     * listed up front. Unreadable directories and stray files become
     * {@link Outcome.Failure} items.
     *
     * <p>
     * The returned stream is single-use and must be closed to release the
     * directory handle of a partially walked shard.
     *
     * @param prefix digest prefix, case-insensitive; empty or {@code null}
     *               matches everything
     */
    public Stream<Outcome<ArchiveEntry>> pathsForPrefix(String prefix) {
        ShardWalker walker = new ShardWalker(root, normalizePrefix(prefix));
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(walker, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(walker::close);
    }

    /**
     * Re-hashes every entry matching {@code prefix} on {@code parallelism}
     * worker threads. Results arrive in completion order, one per entry. A
     * {@link Outcome.Failure} is a broken entry; a success whose
     * {@link DigestPair#isValid()} is {@code false} is a corrupt one.
     *
     * <p>
     * The returned stream owns a pool of {@code parallelism} threads and must
     * be closed, ideally with try-with-resources. Only a fully consumed
     * stream releases the pool on its own. Closing cancels the remaining
     * work; the store is only read, so stopping early never leaves anything
     * behind.
     */
    public Stream<Outcome<DigestPair>> computeDigests(String prefix, int parallelism) {
        Preconditions.checkArgument(parallelism >= 1, "parallelism must be at least 1, was %s", parallelism);
        DigestVerifier verifier = new DigestVerifier(new ShardWalker(root, normalizePrefix(prefix)), parallelism);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(verifier, Spliterator.NONNULL), false)
                .onClose(verifier::close);
    }

    /**
     * Decides where the raw (uncompressed) file at {@code input} belongs.
     * Nothing is written.
     *
     * @return empty when the content is already stored;
     *         {@link FileLocation.Mismatch} when the input's name spells a
     *         digest its bytes do not match; otherwise
     *         {@link FileLocation.Available} with the target path
     * @throws ArchiveException if the input cannot be read
     */
    public Optional<FileLocation> checkFileLocation(Path input) throws ArchiveException {
        String actual = Digests.computeDigest(input);
        Path target = pathFor(actual);

        if (Files.exists(target)) {
            return Optional.empty();
        }

        Optional<String> expected = expectedDigest(input);
        if (expected.isPresent() && !expected.get().equals(actual)) {
            return Optional.of(new FileLocation.Mismatch(expected.get(), actual));
        }
        return Optional.of(new FileLocation.Available(actual, target));
    }

    /**
     * Ingests {@code input}: runs {@link #checkFileLocation(Path)} and, when
     * the slot is free, compresses the input into it. The entry becomes
     * visible atomically once fully written.
     *
     * @return the decision that was acted on
     */
    public Optional<FileLocation> addFile(Path input) throws ArchiveException {
        Optional<FileLocation> decision = checkFileLocation(input);
        if (decision.isPresent() && decision.get() instanceof FileLocation.Available available) {
            copyCompressed(input, available.target());
            LOG.debug("Stored {} as {}", input, available.digest());
        }
        return decision;
    }

    private static void copyCompressed(Path input, Path target) throws ArchiveException {
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), TEMP_PREFIX, ".tmp");
            try (InputStream in = Files.newInputStream(input);
                    OutputStream out = new GZIPOutputStream(Files.newOutputStream(temp))) {
                in.transferTo(out);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new ArchiveException(ArchiveException.Kind.IO, "Failed to copy " + input + " to " + target, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary file {}", temp, e);
        }
    }

    /**
     * Digest claimed by a file name such as {@code <digest>.html}: everything
     * before the first dot, if that is a well-formed digest.
     */
    static Optional<String> expectedDigest(Path input) {
        Path fileName = input.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.indexOf('.');
        String stem = dot >= 0 ? name.substring(0, dot) : name;
        return Digests.isValid(stem) ? Optional.of(Digests.normalize(stem)) : Optional.empty();
    }

    static boolean isShardDirectory(Path path) {
        String name = path.getFileName().toString();
        return name.length() == SHARD_WIDTH
                && name.equals(name.toLowerCase(Locale.ROOT))
                && Digests.isValidPrefix(name)
                && Files.isDirectory(path);
    }

    /** All 256 shard names, {@code 00} to {@code ff}. */
    static List<String> shardNames() {
        List<String> names = new ArrayList<>(256);
        for (int i = 0; i < 256; i++) {
            names.add(String.format("%02x", i));
        }
        return names;
    }

    private static String normalizePrefix(String prefix) {
        return prefix == null ? "" : prefix.toLowerCase(Locale.ROOT);
    }
}

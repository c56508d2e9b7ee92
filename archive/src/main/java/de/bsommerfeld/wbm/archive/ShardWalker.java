package de.bsommerfeld.wbm.archive;

import com.google.common.collect.AbstractIterator;
import de.bsommerfeld.wbm.archive.digest.Digests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Walks the shard tree one directory at a time and yields the entries whose
 * digest starts with a prefix. Shards that cannot hold a match are never
 * opened. Not thread-safe; a walker is consumed by a single reader.
 */
final class ShardWalker extends AbstractIterator<Outcome<ArchiveEntry>> implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ShardWalker.class);

    private final Path root;
    private final String prefix;

    private Deque<Path> pendingShards;
    private Path currentShard;
    private DirectoryStream<Path> currentStream;
    private Iterator<Path> currentEntries;
    private boolean closed;

    ShardWalker(Path root, String prefix) {
        this.root = root;
        this.prefix = prefix;
    }

    @Override
    protected Outcome<ArchiveEntry> computeNext() {
        if (closed) {
            return endOfData();
        }
        if (pendingShards == null) {
            Outcome<ArchiveEntry> failure = listShards();
            if (failure != null) {
                return failure;
            }
        }

        while (true) {
            if (currentEntries == null) {
                Path shard = pendingShards.poll();
                if (shard == null) {
                    return endOfData();
                }
                Outcome<ArchiveEntry> failure = openShard(shard);
                if (failure != null) {
                    return failure;
                }
            }

            Path file;
            try {
                if (!currentEntries.hasNext()) {
                    closeCurrent();
                    continue;
                }
                file = currentEntries.next();
            } catch (DirectoryIteratorException e) {
                Path shard = currentShard;
                closeCurrent();
                return Outcome.failure(new ArchiveException(ArchiveException.Kind.IO,
                        "Failed to read shard " + shard, e.getCause()));
            }

            Outcome<ArchiveEntry> item = toEntry(file);
            if (item != null) {
                return item;
            }
        }
    }

    /**
     * Maps one directory entry to an item, or {@code null} when it does not
     * match the prefix and should be skipped.
     */
    private Outcome<ArchiveEntry> toEntry(Path file) {
        String name = file.getFileName().toString();
        if (name.startsWith(".")) {
            LOG.debug("Skipping hidden file {}", file);
            return null;
        }

        // entries are always written lower-case; anything else was placed by hand
        String digest = currentShard.getFileName() + stripExtension(name);
        if (!name.endsWith(ArchiveStore.EXTENSION) || !Digests.isValid(digest)
                || !digest.equals(digest.toLowerCase(Locale.ROOT)) || !Files.isRegularFile(file)) {
            return Outcome.failure(new ArchiveException(ArchiveException.Kind.LAYOUT,
                    "Not an archive entry: " + file));
        }
        if (!digest.startsWith(prefix)) {
            return null;
        }
        return Outcome.success(new ArchiveEntry(digest, file));
    }

    /**
     * Lists the root once and queues the shard directories compatible with the
     * prefix, in name order. Returns a failure item if the root is unreadable.
     */
    private Outcome<ArchiveEntry> listShards() {
        pendingShards = new ArrayDeque<>();
        List<Path> shards = new ArrayList<>();
        List<Path> stray = new ArrayList<>();

        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
            for (Path entry : entries) {
                if (ArchiveStore.isShardDirectory(entry)) {
                    String shard = entry.getFileName().toString();
                    if (shard.startsWith(prefix) || prefix.startsWith(shard)) {
                        shards.add(entry);
                    }
                } else if (!entry.getFileName().toString().startsWith(".")) {
                    stray.add(entry);
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            return Outcome.failure(new ArchiveException(ArchiveException.Kind.IO,
                    "Failed to list store root " + root, e));
        }

        Collections.sort(shards);
        pendingShards.addAll(shards);
        if (!stray.isEmpty()) {
            LOG.warn("Ignoring {} non-shard entries in {}", stray.size(), root);
        }
        return null;
    }

    private Outcome<ArchiveEntry> openShard(Path shard) {
        try {
            currentStream = Files.newDirectoryStream(shard);
            currentEntries = currentStream.iterator();
            currentShard = shard;
            return null;
        } catch (IOException e) {
            closeCurrent();
            return Outcome.failure(new ArchiveException(ArchiveException.Kind.IO,
                    "Failed to open shard " + shard, e));
        }
    }

    private static String stripExtension(String name) {
        return name.endsWith(ArchiveStore.EXTENSION)
                ? name.substring(0, name.length() - ArchiveStore.EXTENSION.length())
                : name;
    }

    private void closeCurrent() {
        if (currentStream != null) {
            try {
                currentStream.close();
            } catch (IOException e) {
                LOG.debug("Failed to close shard stream {}", currentShard, e);
            }
        }
        currentStream = null;
        currentEntries = null;
        currentShard = null;
    }

    @Override
    public void close() {
        closed = true;
        closeCurrent();
    }
}

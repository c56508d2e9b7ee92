package de.bsommerfeld.wbm.archive;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.bsommerfeld.wbm.archive.digest.Digests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Re-hashes the entries produced by a {@link ShardWalker} on a fixed pool of
 * worker threads and hands the results back in completion order.
 *
 * <h3>Threading model</h3>
 * The consumer thread drives everything: each {@link #hasNext()} tops up the
 * pool from the walker until {@code 2 * parallelism} tasks are in flight, so
 * the listing is pulled lazily and never buffered in full. Workers share
 * nothing but the completion queue. Workers are daemon threads, so an
 * abandoned verifier cannot keep the JVM alive; {@link #close()} interrupts
 * them right away.
 */
final class DigestVerifier implements Iterator<Outcome<DigestPair>>, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DigestVerifier.class);

    private final ShardWalker walker;
    private final ExecutorService pool;
    private final CompletionService<Outcome<DigestPair>> completion;
    private final int window;

    private final Deque<Outcome<DigestPair>> ready = new ArrayDeque<>();
    private int inFlight;
    private boolean closed;

    DigestVerifier(ShardWalker walker, int parallelism) {
        this.walker = walker;
        this.window = parallelism * 2;
        this.pool = Executors.newFixedThreadPool(parallelism, new ThreadFactoryBuilder()
                .setNameFormat("digest-worker-%d")
                .setDaemon(true)
                .build());
        this.completion = new ExecutorCompletionService<>(pool);
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }
        fill();
        boolean more = !ready.isEmpty() || inFlight > 0;
        if (!more) {
            close();
        }
        return more;
    }

    @Override
    public Outcome<DigestPair> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        if (!ready.isEmpty()) {
            return ready.poll();
        }

        try {
            Future<Outcome<DigestPair>> done = completion.take();
            inFlight--;
            return done.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new IllegalStateException("Interrupted while waiting for digest results", e);
        } catch (ExecutionException e) {
            return Outcome.failure(new ArchiveException(ArchiveException.Kind.IO,
                    "Digest worker failed", e.getCause()));
        }
    }

    /**
     * Pulls entries from the walker until the window is full. A listing
     * failure stops the refill so it is reported before more work is queued.
     */
    private void fill() {
        while (inFlight < window && ready.isEmpty() && walker.hasNext()) {
            Outcome<ArchiveEntry> item = walker.next();
            if (item.isFailure()) {
                ready.add(Outcome.failure(item.errorOrNull()));
                return;
            }
            ArchiveEntry entry = ((Outcome.Success<ArchiveEntry>) item).value();
            completion.submit(() -> verify(entry));
            inFlight++;
        }
    }

    static Outcome<DigestPair> verify(ArchiveEntry entry) {
        try {
            String actual = Digests.computeDigestGz(entry.path());
            return Outcome.success(new DigestPair(entry.digest(), actual, entry.path()));
        } catch (ArchiveException e) {
            return Outcome.failure(e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        walker.close();
        pool.shutdownNow();
        if (inFlight > 0) {
            LOG.debug("Digest verification stopped with {} tasks outstanding", inFlight);
        }
    }
}

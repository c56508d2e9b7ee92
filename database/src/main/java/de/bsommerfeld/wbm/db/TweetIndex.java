package de.bsommerfeld.wbm.db;

import de.bsommerfeld.wbm.core.domain.BrowserTweet;
import de.bsommerfeld.wbm.core.domain.UserRecord;

import java.util.List;
import java.util.Optional;

/**
 * Index of the tweets found in archived captures. Implementations must be
 * thread-safe: lookups may run concurrently, ingestion is serialized.
 *
 * <p>
 * The index never touches the archive itself. Captures are referred to by
 * the digest the caller got from the archive store.
 */
public interface TweetIndex extends AutoCloseable {

    /**
     * Returns the row id of the file with {@code digest}, or empty if the
     * capture has not been indexed yet. Callers check this before
     * {@link #addTweets}.
     */
    Optional<Long> checkDigest(String digest) throws TweetStoreException;

    /**
     * Records a new capture and every tweet it contains, atomically. A tweet
     * revision that is already stored is linked to the new file instead of
     * being inserted again; an author whose (id, screen name, name) triple is
     * new gets a new user row, so renames keep their history.
     *
     * <p>
     * The capture itself must be new. Adding a digest twice fails and leaves
     * the index unchanged.
     *
     * @param digest           digest of the capture
     * @param primaryTwitterId account whose page the capture shows, if any
     * @param tweets           tweets parsed from the capture, in page order
     */
    void addTweets(String digest, Long primaryTwitterId, List<BrowserTweet> tweets) throws TweetStoreException;

    /**
     * Returns, for each status id, its most complete stored revision (the
     * longest text) paired with a capture that contained it. Ids that are
     * unknown or fail to load are logged and left out.
     */
    List<TweetCapture> getTweets(List<Long> statusIds) throws TweetStoreException;

    /**
     * Returns the naming history of every account seen so far, ordered by
     * Twitter id.
     */
    List<UserRecord> getUsers() throws TweetStoreException;

    @Override
    void close() throws TweetStoreException;
}

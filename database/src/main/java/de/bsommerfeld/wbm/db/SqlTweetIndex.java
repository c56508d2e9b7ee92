package de.bsommerfeld.wbm.db;

import com.google.common.base.Preconditions;
import de.bsommerfeld.wbm.core.domain.BrowserTweet;
import de.bsommerfeld.wbm.core.domain.UserRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * SQLite-backed {@link TweetIndex}.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} whenever the index is opened;
 * every DDL statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * One {@link Connection} is held for the lifetime of the index, guarded by a
 * single {@link ReentrantReadWriteLock}. Lookups share the read lock;
 * {@link #addTweets} takes the write lock for exactly one transaction, so
 * ingestion is serialized while queries keep running between writes.
 *
 * <h3>Transaction boundaries</h3>
 * {@link #addTweets} and the recreate path of the constructor run in explicit
 * transactions with rollback-on-failure. Single-statement queries use
 * auto-commit.
 *
 * @see SqlLoader
 */
public class SqlTweetIndex implements TweetIndex {

    private static final Logger LOG = LoggerFactory.getLogger(SqlTweetIndex.class);

    private final Path path;
    private final Connection connection;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Opens the index at {@code path}, creating the file and schema if needed.
     *
     * @param recreate drop and recreate all tables of an existing database.
     *                 Destructive; meant for rebuilding the index from the
     *                 archive.
     * @throws TweetStoreException if the file cannot be opened or the schema
     *                             cannot be applied
     */
    public SqlTweetIndex(Path path, boolean recreate) throws TweetStoreException {
        this.path = Preconditions.checkNotNull(path, "path");
        boolean exists = Files.isRegularFile(path);
        this.connection = open(path);

        try {
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA foreign_keys = ON");
            }
            if (exists && recreate) {
                LOG.warn("Recreating tweet index at {}", path.toAbsolutePath());
                runInTransaction(SqlLoader.load("drop-tables"), SqlLoader.loadSchema());
            } else {
                runInTransaction(SqlLoader.loadSchema());
            }
        } catch (SQLException | IllegalStateException e) {
            closeQuietly();
            throw new TweetStoreException("Failed to apply schema to " + path, e);
        }
        LOG.info("Opened tweet index at {}", path.toAbsolutePath());
    }

    private static Connection open(Path path) throws TweetStoreException {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            return DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath());
        } catch (IOException | SQLException e) {
            throw new TweetStoreException("Cannot open tweet index at " + path, e);
        }
    }

    /** Executes every statement of {@code scripts} in one transaction. */
    private void runInTransaction(String... scripts) throws SQLException {
        connection.setAutoCommit(false);
        try (Statement stmt = connection.createStatement()) {
            for (String script : scripts) {
                for (String sql : SqlLoader.statements(script)) {
                    stmt.execute(sql);
                }
            }
            connection.commit();
        } catch (SQLException e) {
            connection.rollback();
            throw e;
        } finally {
            connection.setAutoCommit(true);
        }
    }

    // =====================================================================
    // Lookups
    // =====================================================================

    @Override
    public Optional<Long> checkDigest(String digest) throws TweetStoreException {
        lock.readLock().lock();
        try (PreparedStatement ps = connection.prepareStatement(SqlLoader.load("select-file-by-digest"))) {
            ps.setString(1, normalize(digest));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new TweetStoreException("Failed to look up digest " + digest, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<TweetCapture> getTweets(List<Long> statusIds) throws TweetStoreException {
        List<TweetCapture> result = new ArrayList<>(statusIds.size());

        lock.readLock().lock();
        try (PreparedStatement ps = connection.prepareStatement(SqlLoader.load("select-tweet-by-id"))) {
            for (long id : statusIds) {
                try {
                    ps.setLong(1, id);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (rs.next()) {
                            result.add(mapCapture(id, rs));
                        } else {
                            LOG.warn("No stored revision for tweet {}", id);
                        }
                    }
                } catch (SQLException e) {
                    LOG.error("Error for {}", id, e);
                }
            }
        } catch (SQLException e) {
            throw new TweetStoreException("Failed to prepare tweet lookup", e);
        } finally {
            lock.readLock().unlock();
        }
        return result;
    }

    /** Maps a row of {@code select-tweet-by-id}; a self-parent means no parent. */
    private static TweetCapture mapCapture(long id, ResultSet rs) throws SQLException {
        long parentId = rs.getLong("parent_twitter_id");
        BrowserTweet tweet = new BrowserTweet(
                id,
                parentId == id ? null : parentId,
                Instant.ofEpochSecond(rs.getLong("ts")),
                rs.getLong("user_twitter_id"),
                rs.getString("screen_name"),
                rs.getString("name"),
                rs.getString("content"));
        return new TweetCapture(tweet, rs.getString("digest"));
    }

    @Override
    public List<UserRecord> getUsers() throws TweetStoreException {
        Map<Long, UserHistory> histories = new LinkedHashMap<>();

        lock.readLock().lock();
        try (PreparedStatement ps = connection.prepareStatement(SqlLoader.load("select-users"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                long twitterId = rs.getLong("twitter_id");
                long lastSeen = rs.getLong("last_seen");
                Instant seen = rs.wasNull() ? null : Instant.ofEpochSecond(lastSeen);

                UserHistory history = histories.computeIfAbsent(twitterId, k -> new UserHistory());
                history.screenNames.add(rs.getString("screen_name"));
                history.names.add(rs.getString("name"));
                if (seen != null && (history.lastSeen == null || seen.isAfter(history.lastSeen))) {
                    history.lastSeen = seen;
                }
            }
        } catch (SQLException e) {
            throw new TweetStoreException("Failed to load users", e);
        } finally {
            lock.readLock().unlock();
        }

        List<UserRecord> users = new ArrayList<>(histories.size());
        histories.forEach((id, h) -> users.add(
                new UserRecord(id, h.lastSeen, new ArrayList<>(h.screenNames), new ArrayList<>(h.names))));
        return users;
    }

    private static final class UserHistory {
        private final Set<String> screenNames = new LinkedHashSet<>();
        private final Set<String> names = new LinkedHashSet<>();
        private Instant lastSeen;
    }

    // =====================================================================
    // Ingestion
    // =====================================================================

    /**
     * Inserts the file row, then per tweet: user upsert, tweet lookup-or-insert,
     * link insert. Everything commits together or not at all.
     */
    @Override
    public void addTweets(String digest, Long primaryTwitterId, List<BrowserTweet> tweets)
            throws TweetStoreException {
        Preconditions.checkNotNull(tweets, "tweets");
        for (int i = 0; i < tweets.size(); i++) {
            Preconditions.checkNotNull(tweets.get(i), "tweets[%s]", i);
        }
        String normalized = normalize(digest);

        lock.writeLock().lock();
        try {
            connection.setAutoCommit(false);
            try (PreparedStatement insertFile = connection.prepareStatement(SqlLoader.load("insert-file"));
                    PreparedStatement selectUser = connection.prepareStatement(SqlLoader.load("select-user"));
                    PreparedStatement insertUser = connection.prepareStatement(SqlLoader.load("insert-user"));
                    PreparedStatement selectTweet = connection.prepareStatement(SqlLoader.load("select-tweet-full"));
                    PreparedStatement insertTweet = connection.prepareStatement(SqlLoader.load("insert-tweet"));
                    PreparedStatement insertLink = connection.prepareStatement(SqlLoader.load("insert-tweet-file"));
                    PreparedStatement lastId = connection.prepareStatement(SqlLoader.load("last-insert-id"))) {

                insertFile.setString(1, normalized);
                if (primaryTwitterId != null) {
                    insertFile.setLong(2, primaryTwitterId);
                } else {
                    insertFile.setNull(2, Types.INTEGER);
                }
                insertFile.executeUpdate();
                long fileId = lastInsertId(lastId);

                int inserted = 0;
                for (BrowserTweet tweet : tweets) {
                    long userId = addUser(selectUser, insertUser, lastId, tweet);

                    bindTweet(selectTweet, tweet);
                    Long tweetId = null;
                    try (ResultSet rs = selectTweet.executeQuery()) {
                        if (rs.next()) {
                            tweetId = rs.getLong(1);
                        }
                    }
                    if (tweetId == null) {
                        bindTweet(insertTweet, tweet);
                        insertTweet.executeUpdate();
                        tweetId = lastInsertId(lastId);
                        inserted++;
                    }

                    insertLink.setLong(1, tweetId);
                    insertLink.setLong(2, fileId);
                    insertLink.setLong(3, userId);
                    insertLink.executeUpdate();
                }

                connection.commit();
                LOG.debug("[DB] Indexed {} with {} tweets ({} new revisions).", normalized, tweets.size(), inserted);
            } catch (SQLException | RuntimeException e) {
                // restoring auto-commit would otherwise commit the partial transaction
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new TweetStoreException("Failed to add tweets for " + normalized, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Returns the id of the exact (id, screen name, name) row, inserting it if new. */
    private static long addUser(PreparedStatement select, PreparedStatement insert, PreparedStatement lastId,
            BrowserTweet tweet) throws SQLException {
        select.setLong(1, tweet.userId());
        select.setString(2, tweet.userScreenName());
        select.setString(3, tweet.userName());
        try (ResultSet rs = select.executeQuery()) {
            if (rs.next()) {
                return rs.getLong(1);
            }
        }

        insert.setLong(1, tweet.userId());
        insert.setString(2, tweet.userScreenName());
        insert.setString(3, tweet.userName());
        insert.executeUpdate();
        return lastInsertId(lastId);
    }

    /** Binds the five identity columns shared by the tweet select and insert. */
    private static void bindTweet(PreparedStatement ps, BrowserTweet tweet) throws SQLException {
        ps.setLong(1, tweet.id());
        ps.setLong(2, tweet.parentIdOrSelf());
        ps.setLong(3, tweet.time().getEpochSecond());
        ps.setLong(4, tweet.userId());
        ps.setString(5, tweet.text());
    }

    private static long lastInsertId(PreparedStatement lastId) throws SQLException {
        try (ResultSet rs = lastId.executeQuery()) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() returned no row");
            }
            return rs.getLong(1);
        }
    }

    private static String normalize(String digest) {
        Preconditions.checkNotNull(digest, "digest");
        return digest.toLowerCase(Locale.ROOT);
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    @Override
    public void close() throws TweetStoreException {
        lock.writeLock().lock();
        try {
            connection.close();
        } catch (SQLException e) {
            throw new TweetStoreException("Failed to close tweet index at " + path, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void closeQuietly() {
        try {
            connection.close();
        } catch (SQLException e) {
            LOG.warn("Failed to close tweet index at {}", path, e);
        }
    }
}

/**
 * Tweet dedup index: which tweets were seen in which archived capture, and
 * by which author name.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [wbm command line / ingestion]
 *        │
 *        ▼
 *   TweetIndex       ← interface
 *        │
 *        ▼
 *   SqlTweetIndex    ← one SQLite connection behind a read/write lock
 * </pre>
 *
 * <h2>Database Schema</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ user                                                              │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK)         │ Surrogate key                                  │
 * │ twitter_id       │ Numeric account id                             │
 * │ screen_name      │ Handle as seen in a capture                    │
 * │ name             │ Display name as seen in a capture              │
 * └──────────────────┴────────────────────────────────────────────────┘
 *   UNIQUE (twitter_id, screen_name, name): a rename adds a row.
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ file                                                              │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK)         │ Surrogate key                                  │
 * │ digest (UQ)      │ Archive digest of the capture                  │
 * │ primary_twitter_id│ Account whose page was captured (nullable)    │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ tweet (one row per revision)                                      │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK)         │ Surrogate key                                  │
 * │ twitter_id       │ Status id                                      │
 * │ parent_twitter_id│ Replied-to status id, or twitter_id itself     │
 * │ ts               │ Epoch seconds                                  │
 * │ user_twitter_id  │ Author account id                              │
 * │ content          │ Text as captured                               │
 * └──────────────────┴────────────────────────────────────────────────┘
 *   UNIQUE over all five non-key columns.
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ tweet_file (one row per occurrence)                               │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ tweet_id         │ FK → tweet.id                                  │
 * │ file_id          │ FK → file.id                                   │
 * │ user_id          │ FK → user.id (author naming at capture time)   │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>SQL File Inventory</h2>
 * All statements are externalized to {@code sql/*.sql} and loaded via
 * {@link de.bsommerfeld.wbm.db.SqlLoader}:
 * <ul>
 * <li>{@code select-file-by-digest.sql}, {@code insert-file.sql}</li>
 * <li>{@code select-user.sql}, {@code insert-user.sql}</li>
 * <li>{@code select-tweet-full.sql}, {@code insert-tweet.sql}</li>
 * <li>{@code insert-tweet-file.sql}</li>
 * <li>{@code select-tweet-by-id.sql}: longest revision of one status</li>
 * <li>{@code select-users.sql}: naming history with last activity</li>
 * <li>{@code last-insert-id.sql}, {@code drop-tables.sql}</li>
 * </ul>
 */
package de.bsommerfeld.wbm.db;

package de.bsommerfeld.wbm.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.ProvisionException;
import com.google.inject.name.Names;
import de.bsommerfeld.wbm.archive.ArchiveStore;
import de.bsommerfeld.wbm.core.config.ArchiveConfig;
import de.bsommerfeld.wbm.core.domain.BrowserTweet;
import de.bsommerfeld.wbm.db.SqlTweetIndex;
import de.bsommerfeld.wbm.db.TweetIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveModuleTest {

    @TempDir
    Path tempDir;

    private ArchiveConfig config;
    private Injector injector;

    @BeforeEach
    void setUp() {
        config = new ArchiveConfig();
        config.setStoreDir(tempDir.resolve("store"));
        config.setDatabasePath(tempDir.resolve("db").resolve("tweets.db"));
        injector = Guice.createInjector(new ArchiveModule(config));
    }

    @Test
    void injector_shouldBindLoadedConfig() {
        assertSame(config, injector.getInstance(ArchiveConfig.class));
    }

    @Test
    void archiveStore_shouldBeSingletonOnConfiguredRoot() {
        ArchiveStore store = injector.getInstance(ArchiveStore.class);

        assertSame(store, injector.getInstance(ArchiveStore.class));
        assertEquals(tempDir.resolve("store"), store.root());
    }

    @Test
    void tweetIndex_shouldOpenSqliteFileOnFirstUse() throws Exception {
        assertFalse(Files.exists(config.getDatabasePath()));

        TweetIndex index = injector.getInstance(TweetIndex.class);
        try {
            assertInstanceOf(SqlTweetIndex.class, index);
            assertSame(index, injector.getInstance(TweetIndex.class));
            assertTrue(Files.exists(config.getDatabasePath()));
        } finally {
            index.close();
        }
    }

    @Test
    void tweetIndex_shouldIgnoreRecreateFlag() throws Exception {
        seedTweet();
        config.setRecreateDatabase(true);

        TweetIndex index = injector.getInstance(TweetIndex.class);
        try {
            assertEquals(1, index.getTweets(List.of(100L)).size());
        } finally {
            index.close();
        }
    }

    @Test
    void rebuildIndex_shouldDropTablesWhenRecreateIsSet() throws Exception {
        seedTweet();
        config.setRecreateDatabase(true);

        TweetIndex index = injector.getInstance(Key.get(TweetIndex.class, Names.named(ArchiveModule.REBUILD)));
        try {
            assertTrue(index.getTweets(List.of(100L)).isEmpty());
        } finally {
            index.close();
        }
    }

    @Test
    void rebuildIndex_shouldKeepDataWhenRecreateIsUnset() throws Exception {
        seedTweet();

        TweetIndex index = injector.getInstance(Key.get(TweetIndex.class, Names.named(ArchiveModule.REBUILD)));
        try {
            assertEquals(1, index.getTweets(List.of(100L)).size());
        } finally {
            index.close();
        }
    }

    @Test
    void tweetIndex_shouldSurfaceOpenFailureAsProvisionException() {
        config.setDatabasePath(tempDir);

        ProvisionException e = assertThrows(ProvisionException.class,
                () -> injector.getInstance(TweetIndex.class));
        assertNotNull(e.getCause());
    }

    @Test
    void commandRunner_shouldBeInjectable() {
        assertNotNull(injector.getInstance(CommandRunner.class));
    }

    private void seedTweet() throws Exception {
        try (SqlTweetIndex seed = new SqlTweetIndex(config.getDatabasePath(), false)) {
            seed.addTweets("1111111111111111111111111111111111111111", 7L,
                    List.of(new BrowserTweet(100L, null, Instant.EPOCH, 7L, "jack", "Jack", "hi")));
        }
    }
}

package de.bsommerfeld.wbm.app;

import de.bsommerfeld.wbm.core.config.ArchiveConfig;
import de.bsommerfeld.wbm.core.config.ConfigLoader;
import de.bsommerfeld.wbm.core.domain.BrowserTweet;
import de.bsommerfeld.wbm.db.SqlTweetIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the command line against a temporary store, index and
 * configuration file.
 */
class WbmMainTest {

    @TempDir
    Path tempDir;

    private Path configPath;
    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("config.toml");
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
    }

    @Test
    void run_shouldReturnUsageCodeForBadCommandLine() {
        assertEquals(2, run("frobnicate"));
        assertTrue(err().contains("Unknown command"));
        assertTrue(err().contains("Usage: wbm"));
    }

    @Test
    void run_shouldWriteDefaultConfigOnFirstStart() {
        assertEquals(0, run("--config", configPath.toString(), "--dir", tempDir.resolve("s").toString(), "create"));

        assertTrue(Files.exists(configPath));
    }

    @Test
    void run_shouldIngestAndExtractThroughStore() throws Exception {
        Path store = tempDir.resolve("store");
        Path input = Files.writeString(tempDir.resolve("capture.html"), "<p>archived</p>");

        assertEquals(0, run("--config", configPath.toString(), "--dir", store.toString(), "create"));
        assertEquals(0, run("--config", configPath.toString(), "--dir", store.toString(), "add-file", input.toString()));
        String target = out().trim().split(",")[1];
        String digest = Path.of(target).getParent().getFileName().toString()
                + Path.of(target).getFileName().toString().replace(".gz", "");
        outBytes.reset();

        assertEquals(0, run("--config", configPath.toString(), "--dir", store.toString(), "extract", digest));
        assertEquals("<p>archived</p>", out());
    }

    @Test
    void run_shouldReportUsersFromEmptyIndex() {
        Path db = tempDir.resolve("tweets.db");

        assertEquals(0, run("--config", configPath.toString(), "--db", db.toString(), "users"));
        assertEquals("", out());
        assertTrue(Files.exists(db));
    }

    @Test
    void run_shouldKeepIndexDataForQueriesWhenRecreateIsConfigured() throws Exception {
        Path db = seedIndexWithRecreateConfigured();

        assertEquals(0, run("--config", configPath.toString(), "tweets", "100"));
        assertEquals(0, run("--config", configPath.toString(), "tweets", "100"));

        assertEquals(2, out().lines().filter(line -> line.startsWith("100\t")).count());
        try (SqlTweetIndex index = new SqlTweetIndex(db, false)) {
            assertEquals(1, index.getTweets(List.of(100L)).size());
        }
    }

    @Test
    void run_shouldRecreateIndexOnlyThroughInitIndex() throws Exception {
        Path db = seedIndexWithRecreateConfigured();

        assertEquals(0, run("--config", configPath.toString(), "init-index"));

        try (SqlTweetIndex index = new SqlTweetIndex(db, false)) {
            assertTrue(index.getTweets(List.of(100L)).isEmpty());
        }
    }

    @Test
    void run_shouldFailWhenIndexCannotBeOpened() {
        assertEquals(1, run("--config", configPath.toString(), "--db", tempDir.toString(), "users"));
    }

    @Test
    void run_shouldFailForUnreadableConfig() throws Exception {
        Files.writeString(configPath, "parallelism = \"not a number\"\n");

        assertEquals(1, run("--config", configPath.toString(), "list"));
    }

    @Test
    void run_shouldReturnUsageCodeForMalformedDigest() {
        assertEquals(2, run("--config", configPath.toString(), "--dir", tempDir.toString(), "extract", "zz"));
    }

    private Path seedIndexWithRecreateConfigured() throws Exception {
        Path db = tempDir.resolve("tweets.db");
        try (SqlTweetIndex index = new SqlTweetIndex(db, false)) {
            index.addTweets("1111111111111111111111111111111111111111", 7L,
                    List.of(new BrowserTweet(100L, null, Instant.EPOCH, 7L, "jack", "Jack", "hi")));
        }
        ArchiveConfig config = new ArchiveConfig();
        config.setStoreDir(tempDir.resolve("store"));
        config.setDatabasePath(db);
        config.setRecreateDatabase(true);
        ConfigLoader.save(config, configPath);
        return db;
    }

    private int run(String... args) {
        return WbmMain.run(args,
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }
}

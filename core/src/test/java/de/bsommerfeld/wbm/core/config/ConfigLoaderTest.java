package de.bsommerfeld.wbm.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldWriteDefaultsWhenMissing() throws IOException {
        Path file = tempDir.resolve("nested").resolve("config.toml");

        ArchiveConfig config = ConfigLoader.load(file);

        assertTrue(Files.exists(file));
        assertEquals(ArchiveConfig.DEFAULT_PARALLELISM, config.getParallelism());
        assertTrue(Files.readString(file).contains("parallelism"));
    }

    @Test
    void load_shouldReadExistingValues() throws IOException {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, String.join("\n",
                "store-dir = '/data/store'",
                "database-path = '/data/tweets.db'",
                "parallelism = 12",
                "recreate-database = true",
                "debug-mode = true",
                ""));

        ArchiveConfig config = ConfigLoader.load(file);

        assertEquals(Path.of("/data/store"), config.getStoreDir());
        assertEquals(Path.of("/data/tweets.db"), config.getDatabasePath());
        assertEquals(12, config.getParallelism());
        assertTrue(config.isRecreateDatabase());
        assertTrue(config.isDebugMode());
    }

    @Test
    void load_shouldKeepDefaultsForAbsentKeys() throws IOException {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, "parallelism = 3\n");

        ArchiveConfig config = ConfigLoader.load(file);

        assertEquals(3, config.getParallelism());
        assertFalse(config.isDebugMode());
        assertEquals(new ArchiveConfig().getStoreDir(), config.getStoreDir());
    }

    @Test
    void load_shouldIgnoreUnknownKeys() throws IOException {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, "parallelism = 4\nsomething-else = 'x'\n");

        assertEquals(4, ConfigLoader.load(file).getParallelism());
    }

    @Test
    void load_shouldRejectInvalidParallelism() throws IOException {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, "parallelism = 0\n");

        assertThrows(IOException.class, () -> ConfigLoader.load(file));
    }

    @Test
    void save_shouldRoundTripOverrides() throws IOException {
        Path file = tempDir.resolve("config.toml");
        ArchiveConfig config = new ArchiveConfig();
        config.setParallelism(9);
        config.setStoreDir(tempDir.resolve("store"));

        ConfigLoader.save(config, file);
        ArchiveConfig loaded = ConfigLoader.load(file);

        assertEquals(9, loaded.getParallelism());
        assertEquals(tempDir.resolve("store"), loaded.getStoreDir());
    }
}

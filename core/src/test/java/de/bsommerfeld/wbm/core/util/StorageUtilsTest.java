package de.bsommerfeld.wbm.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @Test
    void getAppDataDir_shouldContainAppName() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.toString().contains("test-app"));
    }

    @Test
    void getAppDataDir_shouldBeAbsolute() {
        assertTrue(StorageUtils.getAppDataDir("test-app").isAbsolute());
    }

    @Test
    void defaults_shouldLiveInsideAppDataDir() {
        Path appDir = StorageUtils.getAppDataDir(StorageUtils.APP_NAME);

        assertEquals(appDir.resolve("store"), StorageUtils.getDefaultStoreDir());
        assertEquals(appDir.resolve("tweets.db"), StorageUtils.getDefaultDatabasePath());
        assertEquals(appDir.resolve("config.toml"), StorageUtils.getDefaultConfigPath());
    }

    @Test
    void getAppDataDir_differentNames_shouldProduceDifferentPaths() {
        assertNotEquals(StorageUtils.getAppDataDir("app-one"), StorageUtils.getAppDataDir("app-two"));
    }
}

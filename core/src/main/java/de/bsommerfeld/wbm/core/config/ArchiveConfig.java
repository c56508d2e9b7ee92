package de.bsommerfeld.wbm.core.config;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import de.bsommerfeld.wbm.core.util.StorageUtils;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Settings for the archive store and the tweet index. Values are persisted in
 * {@code config.toml} and loaded at startup by {@link ConfigLoader}; command
 * line flags may override them afterwards through the setters.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class ArchiveConfig {

    public static final int DEFAULT_PARALLELISM = 6;

    @JsonProperty("store-dir")
    @JsonPropertyDescription("Root directory of the sharded archive store")
    private String storeDir = StorageUtils.getDefaultStoreDir().toString();

    @JsonProperty("database-path")
    @JsonPropertyDescription("SQLite file of the tweet index")
    private String databasePath = StorageUtils.getDefaultDatabasePath().toString();

    @JsonProperty("parallelism")
    @JsonPropertyDescription("Worker threads used when verifying digests (default: 6)")
    private int parallelism = DEFAULT_PARALLELISM;

    @JsonProperty("recreate-database")
    @JsonPropertyDescription("Drop and recreate the tweet index tables on startup")
    private boolean recreateDatabase = false;

    @JsonProperty("debug-mode")
    @JsonPropertyDescription("Enable detailed debug logging")
    private boolean debugMode = false;

    public Path getStoreDir() {
        return Paths.get(storeDir);
    }

    public void setStoreDir(Path storeDir) {
        this.storeDir = storeDir.toString();
    }

    public Path getDatabasePath() {
        return Paths.get(databasePath);
    }

    public void setDatabasePath(Path databasePath) {
        this.databasePath = databasePath.toString();
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
        this.parallelism = parallelism;
    }

    public boolean isRecreateDatabase() {
        return recreateDatabase;
    }

    public void setRecreateDatabase(boolean recreateDatabase) {
        this.recreateDatabase = recreateDatabase;
    }

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }
}

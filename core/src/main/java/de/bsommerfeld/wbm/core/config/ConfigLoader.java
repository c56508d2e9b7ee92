package de.bsommerfeld.wbm.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link ArchiveConfig} from a TOML file. A missing file is created with
 * the default values so users have something to edit.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * Loads the configuration at {@code path}, writing defaults first when the
     * file does not exist yet.
     *
     * @throws IOException if the file cannot be read, parsed or created
     */
    public static ArchiveConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            ArchiveConfig defaults = new ArchiveConfig();
            save(defaults, path);
            LOG.info("Wrote default configuration to {}", path.toAbsolutePath());
            return defaults;
        }

        LOG.debug("Loading configuration from {}", path.toAbsolutePath());
        ArchiveConfig config = MAPPER.readValue(path.toFile(), ArchiveConfig.class);
        if (config.getParallelism() < 1) {
            throw new IOException("Invalid parallelism in " + path + ": " + config.getParallelism());
        }
        return config;
    }

    /**
     * Writes {@code config} to {@code path}, creating parent directories.
     */
    public static void save(ArchiveConfig config, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), config);
    }
}

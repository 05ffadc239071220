package de.bsommerfeld.reviewinsights.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link GlobalConfig} from a TOML file. A missing file is created with
 * the default values; keys absent from an existing file keep their
 * defaults.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * Loads the configuration at {@code path}, writing defaults first if the
     * file does not exist yet.
     *
     * @throws IllegalStateException if the file cannot be read, written or parsed
     */
    public static GlobalConfig load(Path path) {
        try {
            if (!Files.exists(path)) {
                GlobalConfig defaults = new GlobalConfig();
                writeDefaults(path, defaults);
                return defaults;
            }
            GlobalConfig config = MAPPER.readValue(path.toFile(), GlobalConfig.class);
            LOG.info("Loaded configuration from {}", path.toAbsolutePath());
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration from " + path, e);
        }
    }

    private static void writeDefaults(Path path, GlobalConfig defaults) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), defaults);
        LOG.info("No configuration found, wrote defaults to {}", path.toAbsolutePath());
    }
}

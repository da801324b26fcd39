package de.bsommerfeld.threadline.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ThreadlineConfig} from a TOML file. A missing file is
 * created with the defaults so users have something to edit; a broken file
 * fails loudly instead of silently falling back.
 */
public final class ConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLoader.class);

    private ConfigurationLoader() {
    }

    static TomlMapper mapper() {
        TomlMapper mapper = new TomlMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * @param configPath location of the TOML file
     * @return the parsed configuration, or defaults if the file did not exist
     * @throws ConfigurationException if the file exists but is unreadable or
     *                                malformed
     */
    public static ThreadlineConfig load(Path configPath) {
        TomlMapper mapper = mapper();
        if (!Files.exists(configPath)) {
            ThreadlineConfig defaults = new ThreadlineConfig();
            try {
                Path parent = configPath.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                mapper.writeValue(configPath.toFile(), defaults);
                LOG.info("No configuration found, wrote defaults to {}", configPath.toAbsolutePath());
            } catch (IOException e) {
                // Defaults are still usable, only persisting them failed
                LOG.warn("Could not write default configuration to {}", configPath, e);
            }
            return defaults;
        }

        try {
            ThreadlineConfig config = mapper.readValue(configPath.toFile(), ThreadlineConfig.class);
            LOG.info("Loaded configuration from {}", configPath.toAbsolutePath());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from " + configPath, e);
        }
    }
}

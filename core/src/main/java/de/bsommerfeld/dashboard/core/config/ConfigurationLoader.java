package de.bsommerfeld.dashboard.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link DashboardConfig} from a TOML file. A missing file is created
 * with the default values so users have a template to edit.
 */
public final class ConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLoader.class);

    private final Path path;
    private final ObjectMapper mapper;

    private ConfigurationLoader(Path path) {
        this.path = path;
        this.mapper = TomlMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public static ConfigurationLoader from(Path path) {
        return new ConfigurationLoader(path);
    }

    /**
     * Reads the configuration, writing defaults first if the file does not
     * exist yet.
     *
     * @throws ConfigurationException if the file is unreadable or malformed
     */
    public DashboardConfig load() {
        if (!Files.exists(path)) {
            DashboardConfig defaults = new DashboardConfig();
            save(defaults);
            LOG.info("Created default configuration at {}", path.toAbsolutePath());
            return defaults;
        }

        try {
            DashboardConfig config = mapper.readValue(path.toFile(), DashboardConfig.class);
            LOG.debug("Loaded configuration from {}", path.toAbsolutePath());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration: " + path, e);
        }
    }

    /**
     * Writes the configuration, creating parent directories as needed.
     *
     * @throws ConfigurationException if the file cannot be written
     */
    public void save(DashboardConfig config) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(path.toFile(), config);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to write configuration: " + path, e);
        }
    }
}

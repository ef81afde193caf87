package org.scout.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.scout.core.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Reads {@link ScoutConfig} from a project root.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper objectMapper;

    public ConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the defaults when the project has no config file.
     *
     * @throws ConfigurationException when the file exists but cannot be read or parsed
     */
    public ScoutConfig load(Path projectRoot) {
        Path file = projectRoot.resolve(ScoutConfig.FILE_NAME);
        if (!Files.isRegularFile(file)) {
            logger.debug("No {} in {}, using defaults", ScoutConfig.FILE_NAME, projectRoot);
            return new ScoutConfig();
        }
        ScoutConfig config;
        try {
            config = objectMapper.readValue(file.toFile(), ScoutConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid " + file + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigurationException("Invalid " + file + ": empty document");
        }
        // explicit nulls fall back to empty lists
        if (config.getPreps() == null) {
            config.setPreps(new ArrayList<>());
        }
        if (config.getExclude() == null) {
            config.setExclude(new ArrayList<>());
        }
        if (config.getClasspath() == null) {
            config.setClasspath(new ArrayList<>());
        }
        if (config.getWorkerJvmArgs() == null) {
            config.setWorkerJvmArgs(new ArrayList<>());
        }
        logger.info("Loaded {} ({} prep units)", file, config.getPreps().size());
        return config;
    }
}

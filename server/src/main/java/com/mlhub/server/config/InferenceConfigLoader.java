package com.mlhub.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class InferenceConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(InferenceConfigLoader.class);

    public static final String CONFIG_PROPERTY = "mlhub.config";
    public static final String MODEL_DIR_PROPERTY = "mlhub.model.dir";
    public static final String DEFAULT_RESOURCE = "/inference_config.json";

    public static InferenceConfig load() {
        ObjectMapper mapper = new ObjectMapper();
        InferenceConfig config = null;

        // 1. Explicit config file
        String configFile = System.getProperty(CONFIG_PROPERTY);
        if (configFile != null && !configFile.isEmpty()) {
            Path path = Paths.get(configFile);
            try (InputStream is = Files.newInputStream(path)) {
                config = mapper.readValue(is, InferenceConfig.class);
                logger.info("Loaded inference config from {}", path.toAbsolutePath());
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read inference config " + path, e);
            }
        }

        // 2. Classpath default
        if (config == null) {
            try (InputStream is = InferenceConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
                if (is != null) {
                    config = mapper.readValue(is, InferenceConfig.class);
                } else {
                    logger.warn("{} not found on classpath, using built-in defaults", DEFAULT_RESOURCE);
                }
            } catch (IOException e) {
                throw new IllegalStateException("Failed to parse " + DEFAULT_RESOURCE, e);
            }
        }
        if (config == null) {
            config = new InferenceConfig();
        }

        // 3. System property wins for the model directory
        String modelDir = System.getProperty(MODEL_DIR_PROPERTY);
        if (modelDir != null && !modelDir.isEmpty()) {
            config.modelDirectory = modelDir;
        }
        return config;
    }
}

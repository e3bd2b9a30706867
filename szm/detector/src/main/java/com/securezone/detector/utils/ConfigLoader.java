package com.securezone.detector.utils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

import com.securezone.detector.exception.ConfigurationException;
import com.securezone.detector.model.DetectorConfig;

@Slf4j
public final class ConfigLoader {

    public static final String DEFAULT_FILE = "config.json";

    private static final ObjectMapper objectMapper = new ObjectMapper()
        .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    private ConfigLoader() {}

    public static DetectorConfig loadDefault() throws ConfigurationException {
        return load(DEFAULT_FILE);
    }

    /**
     * Looks for {@code fileName} as given, then under {@code config/}, then on the
     * classpath. The loaded settings are validated before they are returned.
     */
    public static DetectorConfig load(String fileName) throws ConfigurationException {
        Path externalPath = Paths.get(fileName);
        if (!Files.exists(externalPath)) {
            externalPath = Paths.get("config", fileName);
        }

        if (Files.exists(externalPath) && Files.isRegularFile(externalPath)) {
            try (InputStream input = Files.newInputStream(externalPath)) {
                DetectorConfig config = parse(input, externalPath.toString());
                log.info("Configuration loaded from external file: {}", externalPath.toAbsolutePath());
                return config;
            } catch (IOException ex) {
                log.warn("Failed to read configuration from external file: {}, trying classpath", externalPath, ex);
            }
        }

        try (InputStream input = ConfigLoader.class.getClassLoader().getResourceAsStream(fileName)) {
            if (input == null) {
                throw new ConfigurationException("Configuration file '" + fileName
                    + "' not found in classpath or external directory");
            }
            DetectorConfig config = parse(input, fileName);
            log.info("Configuration loaded from classpath: {}", fileName);
            return config;
        } catch (IOException ex) {
            log.error("Error loading configuration file '{}': {}", fileName, ex.getMessage());
            throw new ConfigurationException("Failed to read configuration file '" + fileName + "'", ex);
        }
    }

    static DetectorConfig parse(InputStream input, String origin) throws IOException, ConfigurationException {
        DetectorConfig config;
        try {
            config = objectMapper.readValue(input, DetectorConfig.class);
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException("Malformed configuration in " + origin + ": "
                + ex.getOriginalMessage(), ex);
        }
        if (config == null) {
            throw new ConfigurationException("Configuration in " + origin + " is empty");
        }
        return config.validate();
    }
}

package com.m2m.cloud.auth.defaults;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Reads the project of the Cloud SDK's active configuration, an INI file with the project id
 * under {@code [core] project}.
 */
@Slf4j
final class CloudSdkConfig {
    static final Path ACTIVE_CONFIG_FILE = Path.of("configurations", "config_default");
    static final String PROJECT_SECTION = "core";
    static final String PROJECT_KEY = "project";

    private CloudSdkConfig() {}

    /**
     * @return the configured project, empty if the file is missing, unreadable or has none
     */
    static Optional<String> readProjectId(Path configDirectory) {
        Path configFile = configDirectory.resolve(ACTIVE_CONFIG_FILE);
        if (!Files.isRegularFile(configFile)) {
            return Optional.empty();
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(configFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Unable to read Cloud SDK config {}", configFile, e);
            return Optional.empty();
        }

        String section = null;
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[")) {
                if (!line.endsWith("]")) {
                    log.warn("Malformed section header in Cloud SDK config {}", configFile);
                    return Optional.empty();
                }
                section = line.substring(1, line.length() - 1).trim();
                continue;
            }
            if (section == null) {
                log.warn("Cloud SDK config {} has entries outside of any section", configFile);
                return Optional.empty();
            }

            int separator = indexOfSeparator(line);
            if (separator < 0) {
                continue;
            }
            String key = line.substring(0, separator).trim();
            if (PROJECT_SECTION.equals(section) && PROJECT_KEY.equals(key)) {
                String value = line.substring(separator + 1).trim();
                return value.isEmpty() ? Optional.empty() : Optional.of(value);
            }
        }
        return Optional.empty();
    }

    private static int indexOfSeparator(String line) {
        int equals = line.indexOf('=');
        int colon = line.indexOf(':');
        if (equals < 0) {
            return colon;
        }
        return colon < 0 ? equals : Math.min(equals, colon);
    }
}

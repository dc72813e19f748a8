package com.m2m.cloud.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.m2m.cloud.auth.error.AuthParseException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the JSON documents credentials are stored in.
 */
public final class CredentialsJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private CredentialsJson() {}

    /**
     * @throws AuthParseException   if the file is not a JSON object
     * @throws UncheckedIOException if the file can not be read
     */
    public static Map<String, Object> read(Path file) {
        try {
            Map<String, Object> info = MAPPER.readValue(file.toFile(), JSON_OBJECT);
            if (info == null) {
                throw new AuthParseException("File " + file + " is not a valid json file.");
            }
            return info;
        } catch (JsonProcessingException e) {
            throw new AuthParseException("File " + file + " is not a valid json file.", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + file, e);
        }
    }

    public static String requireString(Map<String, ?> info, String field) {
        String value = optionalString(info, field);
        if (value == null) {
            throw new AuthParseException("Credentials info is missing the " + field + " field");
        }
        return value;
    }

    public static String optionalString(Map<String, ?> info, String field) {
        Object value = info.get(field);
        return value == null ? null : value.toString();
    }
}

package com.dailyBrief.accountBrief.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Utility class for loading JSON files from the local filesystem.
 * Paths starting with "~" are resolved against the user's home directory.
 */
public class JsonFileLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonFileLoader.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonFileLoader() {}

    /**
     * Expands a leading "~" to the user's home directory.
     *
     * @param location File location as configured (e.g., "~/.account-brief/accounts.json")
     * @return The resolved path
     */
    public static Path resolvePath(String location) {
        if (location.equals("~")) {
            return Paths.get(System.getProperty("user.home"));
        }
        if (location.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home"), location.substring(2));
        }
        return Paths.get(location);
    }

    /**
     * Loads a JSON file and deserializes it to the specified type.
     *
     * @param path  The file to read
     * @param clazz The class to deserialize the JSON into
     * @param <T>   The type to deserialize to
     * @return An instance of the specified type
     * @throws IOException if the file cannot be read or cannot be deserialized
     */
    public static <T> T loadAsObject(Path path, Class<T> clazz) throws IOException {
        String jsonString = Files.readString(path, StandardCharsets.UTF_8);
        return objectMapper.readValue(jsonString, clazz);
    }

    /**
     * Loads a JSON file and deserializes it to the specified type, returning null if the
     * file doesn't exist or cannot be parsed. Useful for optional configuration.
     *
     * @param path  The file to read
     * @param clazz The class to deserialize the JSON into
     * @param <T>   The type to deserialize to
     * @return An instance of the specified type, or null if the file is missing or invalid
     */
    public static <T> T loadAsObjectOrNull(Path path, Class<T> clazz) {
        if (!Files.isRegularFile(path)) {
            log.debug("Optional JSON file not present: {}", path);
            return null;
        }
        try {
            return loadAsObject(path, clazz);
        } catch (IOException e) {
            log.warn("Failed to load JSON file: {} - {}", path, e.getMessage());
            return null;
        }
    }
}

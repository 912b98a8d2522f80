package com.edgeroute.proxy.core.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes JSON documents read from the configuration store.
 * A malformed document is reported as absent, never as an error.
 */
public final class JsonDocuments {

    private static final Logger log = LoggerFactory.getLogger(JsonDocuments.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonDocuments() {
        // Utility class
    }

    /**
     * Parses a document into the given type.
     *
     * @param json The raw document; may be null.
     * @param type Target class.
     * @param key  Store key the document was read from, for logging.
     * @param <T>  Document type.
     * @return The parsed document, or empty if the input is null, blank, not a JSON
     *         object or does not bind to {@code type}.
     */
    public static <T> Optional<T> read(String json, Class<T> type, String key) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(MAPPER.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed document at {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}

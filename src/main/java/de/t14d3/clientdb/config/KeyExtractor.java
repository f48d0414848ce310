package de.t14d3.clientdb.config;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Reads the primary key of an object of a given collection.
 */
@FunctionalInterface
public interface KeyExtractor {

    Optional<String> extract(String collection, JsonNode obj);

    /**
     * Key held in a top-level field; only string and number values count as keys.
     */
    static KeyExtractor field(String fieldName) {
        return (collection, obj) -> {
            if (obj == null || !obj.isObject()) {
                return Optional.empty();
            }
            JsonNode value = obj.get(fieldName);
            if (value == null || !(value.isTextual() || value.isNumber())) {
                return Optional.empty();
            }
            return Optional.of(value.asText());
        };
    }
}

package de.t14d3.clientdb.config;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves once per collection how its primary key is read, then reuses that extractor.
 *
 * Precedence: custom extractor, per-collection field, field resolver function, default field.
 */
public final class PrimaryKeys {
    private final ClientDbConfig config;
    private final ConcurrentHashMap<String, KeyExtractor> extractors = new ConcurrentHashMap<>();

    public PrimaryKeys(ClientDbConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public KeyExtractor forCollection(String collection) {
        return extractors.computeIfAbsent(collection, this::resolve);
    }

    public Optional<String> extract(String collection, JsonNode obj) {
        if (obj == null || obj.isNull()) {
            return Optional.empty();
        }
        return forCollection(collection).extract(collection, obj);
    }

    private KeyExtractor resolve(String collection) {
        if (config.getKeyExtractor() != null) {
            return config.getKeyExtractor();
        }
        String field = config.getPrimaryKeyMap().get(collection);
        if (field == null && config.getPrimaryKeyResolver() != null) {
            field = config.getPrimaryKeyResolver().apply(collection);
        }
        return KeyExtractor.field(field != null ? field : config.getPrimaryKey());
    }
}

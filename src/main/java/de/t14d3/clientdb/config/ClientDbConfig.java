package de.t14d3.clientdb.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.t14d3.clientdb.exceptions.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Immutable settings of a {@link de.t14d3.clientdb.core.ClientDb}. Every value is optional.
 *
 * <pre>
 * ClientDbConfig config = ClientDbConfig.builder()
 *         .crudPrefix("api/")
 *         .primaryKey("id")
 *         .relation("orders", "customers", true)
 *         .build();
 * </pre>
 */
public final class ClientDbConfig {
    public static final String DEFAULT_STORE_NAME = "client-db.db";
    public static final String DEFAULT_PRIMARY_KEY = "Id";
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(1440);
    public static final String DEFAULT_DATA_STRUCTURE_VERSION = "1";

    static final String PREFIX = "clientdb.";

    private final String storeName;
    private final String jdbcUrl;
    private final String crudPrefix;
    private final String primaryKey;
    private final Function<String, String> primaryKeyResolver;
    private final Map<String, String> primaryKeyMap;
    private final KeyExtractor keyExtractor;
    private final Map<String, EndpointResolver> endpointMap;
    private final List<CollectionRelation> relations;
    private final Duration defaultTtl;
    private final String dataStructureVersion;
    private final Clock clock;
    private final Executor invalidationExecutor;
    private final ObjectMapper objectMapper;

    private ClientDbConfig(Builder builder) {
        this.storeName = builder.storeName;
        this.jdbcUrl = builder.jdbcUrl != null ? builder.jdbcUrl : "jdbc:sqlite:" + builder.storeName;
        this.crudPrefix = builder.crudPrefix;
        this.primaryKey = builder.primaryKey;
        this.primaryKeyResolver = builder.primaryKeyResolver;
        this.primaryKeyMap = Collections.unmodifiableMap(new LinkedHashMap<>(builder.primaryKeyMap));
        this.keyExtractor = builder.keyExtractor;
        this.endpointMap = Collections.unmodifiableMap(new LinkedHashMap<>(builder.endpointMap));
        this.relations = List.copyOf(builder.relations);
        this.defaultTtl = builder.defaultTtl;
        this.dataStructureVersion = builder.dataStructureVersion;
        this.clock = builder.clock;
        this.invalidationExecutor = builder.invalidationExecutor;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ClientDbConfig defaults() {
        return builder().build();
    }

    public static ClientDbConfig fromProperties(Properties properties) {
        return builder().properties(properties).build();
    }

    /**
     * Load {@code clientdb.*} settings from a classpath properties file.
     */
    public static ClientDbConfig load(String resource) {
        try (InputStream in = ClientDbConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration resource: " + resource, e);
        }
    }

    public String getStoreName() {
        return storeName;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getCrudPrefix() {
        return crudPrefix;
    }

    public String getPrimaryKey() {
        return primaryKey;
    }

    public Function<String, String> getPrimaryKeyResolver() {
        return primaryKeyResolver;
    }

    public Map<String, String> getPrimaryKeyMap() {
        return primaryKeyMap;
    }

    public KeyExtractor getKeyExtractor() {
        return keyExtractor;
    }

    public Map<String, EndpointResolver> getEndpointMap() {
        return endpointMap;
    }

    public List<CollectionRelation> getRelations() {
        return relations;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public String getDataStructureVersion() {
        return dataStructureVersion;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Executor running deferred cascade passes, or {@code null} for the built-in daemon thread.
     */
    public Executor getInvalidationExecutor() {
        return invalidationExecutor;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public static final class Builder {
        private String storeName = DEFAULT_STORE_NAME;
        private String jdbcUrl;
        private String crudPrefix = "";
        private String primaryKey = DEFAULT_PRIMARY_KEY;
        private Function<String, String> primaryKeyResolver;
        private final Map<String, String> primaryKeyMap = new LinkedHashMap<>();
        private KeyExtractor keyExtractor;
        private final Map<String, EndpointResolver> endpointMap = new LinkedHashMap<>();
        private final List<CollectionRelation> relations = new ArrayList<>();
        private Duration defaultTtl = DEFAULT_TTL;
        private String dataStructureVersion = DEFAULT_DATA_STRUCTURE_VERSION;
        private Clock clock = Clock.systemUTC();
        private Executor invalidationExecutor;
        private ObjectMapper objectMapper;

        private Builder() {
        }

        public Builder storeName(String storeName) {
            this.storeName = requireText(storeName, "storeName");
            return this;
        }

        /**
         * Store location; defaults to {@code jdbc:sqlite:<storeName>}.
         */
        public Builder jdbcUrl(String jdbcUrl) {
            this.jdbcUrl = requireText(jdbcUrl, "jdbcUrl");
            return this;
        }

        public Builder crudPrefix(String crudPrefix) {
            this.crudPrefix = crudPrefix == null ? "" : crudPrefix;
            return this;
        }

        public Builder primaryKey(String primaryKey) {
            this.primaryKey = requireText(primaryKey, "primaryKey");
            return this;
        }

        /**
         * Maps a collection to the name of its primary-key field.
         */
        public Builder primaryKeyResolver(Function<String, String> primaryKeyResolver) {
            this.primaryKeyResolver = primaryKeyResolver;
            return this;
        }

        public Builder primaryKey(String collection, String field) {
            primaryKeyMap.put(requireText(collection, "collection"), requireText(field, "field"));
            return this;
        }

        /**
         * Custom key extraction for every collection; wins over all field-based settings.
         */
        public Builder keyExtractor(KeyExtractor keyExtractor) {
            this.keyExtractor = keyExtractor;
            return this;
        }

        public Builder endpoint(String collection, EndpointResolver resolver) {
            endpointMap.put(requireText(collection, "collection"), Objects.requireNonNull(resolver, "resolver"));
            return this;
        }

        public Builder endpoint(String collection, String path) {
            return endpoint(collection, EndpointResolver.fixed(requireText(path, "path")));
        }

        public Builder relation(String collection, String depCollection, boolean cascadeAll) {
            relations.add(new CollectionRelation(collection, depCollection, cascadeAll));
            return this;
        }

        public Builder relation(CollectionRelation relation) {
            relations.add(Objects.requireNonNull(relation, "relation"));
            return this;
        }

        /**
         * Lifetime of fetched objects; zero means fetched objects never expire.
         */
        public Builder defaultTtl(Duration defaultTtl) {
            Objects.requireNonNull(defaultTtl, "defaultTtl");
            if (defaultTtl.isNegative()) {
                throw new ConfigurationException("defaultTtl must not be negative");
            }
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder defaultTtlMinutes(long minutes) {
            return defaultTtl(Duration.ofMinutes(minutes));
        }

        /**
         * Version of the cached payload shapes. Changing it wipes the cached rows on the next start.
         */
        public Builder dataStructureVersion(String dataStructureVersion) {
            this.dataStructureVersion = requireText(dataStructureVersion, "dataStructureVersion");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder invalidationExecutor(Executor invalidationExecutor) {
            this.invalidationExecutor = invalidationExecutor;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Apply {@code clientdb.*} keys:
         * {@code storeName}, {@code jdbcUrl}, {@code crudPrefix}, {@code primaryKey},
         * {@code primaryKey.<collection>}, {@code endpoint.<collection>},
         * {@code relation.<collection>} (comma separated cascading dependencies),
         * {@code defaultTtlMinutes} and {@code dataStructureVersion}.
         */
        public Builder properties(Properties properties) {
            for (String name : properties.stringPropertyNames()) {
                if (!name.startsWith(PREFIX)) {
                    continue;
                }
                String key = name.substring(PREFIX.length());
                String value = properties.getProperty(name).trim();
                applyProperty(key, value);
            }
            return this;
        }

        private void applyProperty(String key, String value) {
            switch (key) {
                case "storeName" -> storeName(value);
                case "jdbcUrl" -> jdbcUrl(value);
                case "crudPrefix" -> crudPrefix(value);
                case "primaryKey" -> primaryKey(value);
                case "dataStructureVersion" -> dataStructureVersion(value);
                case "defaultTtlMinutes" -> {
                    try {
                        defaultTtlMinutes(Long.parseLong(value));
                    } catch (NumberFormatException e) {
                        throw new ConfigurationException("Invalid " + PREFIX + key + ": " + value, e);
                    }
                }
                default -> {
                    if (key.startsWith("primaryKey.")) {
                        primaryKey(key.substring("primaryKey.".length()), value);
                    } else if (key.startsWith("endpoint.")) {
                        endpoint(key.substring("endpoint.".length()), value);
                    } else if (key.startsWith("relation.")) {
                        String collection = key.substring("relation.".length());
                        for (String dep : value.split(",")) {
                            if (!dep.isBlank()) {
                                relation(collection, dep.trim(), true);
                            }
                        }
                    } else {
                        throw new ConfigurationException("Unknown configuration key: " + PREFIX + key);
                    }
                }
            }
        }

        public ClientDbConfig build() {
            return new ClientDbConfig(this);
        }

        private static String requireText(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new ConfigurationException(name + " must not be blank");
            }
            return value;
        }
    }
}

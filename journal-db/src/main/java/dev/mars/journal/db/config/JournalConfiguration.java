package dev.mars.journal.db.config;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Layered configuration for the journal.
 *
 * Sources, each overriding the one before:
 * <ol>
 *   <li>classpath {@code /journal-default.properties}</li>
 *   <li>classpath {@code /journal-<profile>.properties} for a non-default profile</li>
 *   <li>environment variables starting with {@code JOURNAL_}, lower-cased with {@code _} read as {@code .};
 *       a variable naming a hyphenated key such as {@code JOURNAL_DATABASE_POOL_MAX_SIZE} sets that key</li>
 *   <li>system properties starting with {@code journal.}</li>
 *   <li>explicit overrides passed to a constructor</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class JournalConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(JournalConfiguration.class);

    /** Unquoted PostgreSQL identifier accepted as the journal schema. */
    static final Pattern SCHEMA_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /** Keys read by the typed views, used to resolve environment variable names. */
    static final Set<String> KNOWN_KEYS = Set.of(
        "journal.database.host", "journal.database.port", "journal.database.name",
        "journal.database.username", "journal.database.password", "journal.database.schema",
        "journal.database.ssl.enabled",
        "journal.database.pool.max-size", "journal.database.pool.max-wait-queue-size",
        "journal.database.pool.connection-timeout-ms", "journal.database.pool.idle-timeout-ms",
        "journal.database.pool.shared",
        "journal.schema.auto-create", "journal.metrics.enabled", "journal.metrics.instance-id");

    private final Properties properties;
    private final String profile;

    public JournalConfiguration() {
        this(getActiveProfile());
    }

    public JournalConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * Creates a configuration whose explicit overrides win over every other source.
     */
    public JournalConfiguration(String profile, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        validateConfiguration();
        logger.info("Loaded journal configuration for profile: {}", profile);
    }

    /**
     * Creates a configuration with explicit database settings, without touching system properties.
     *
     * @param dbSchema schema for the journal tables, ignored when null or empty
     */
    public JournalConfiguration(String profile, String dbHost, int dbPort, String dbName,
                                String dbUsername, String dbPassword, String dbSchema) {
        this(profile, databaseOverrides(dbHost, dbPort, dbName, dbUsername, dbPassword, dbSchema));
    }

    private static Properties databaseOverrides(String dbHost, int dbPort, String dbName,
                                                String dbUsername, String dbPassword, String dbSchema) {
        Properties overrides = new Properties();
        overrides.setProperty("journal.database.host", dbHost);
        overrides.setProperty("journal.database.port", String.valueOf(dbPort));
        overrides.setProperty("journal.database.name", dbName);
        overrides.setProperty("journal.database.username", dbUsername);
        overrides.setProperty("journal.database.password", dbPassword != null ? dbPassword : "");
        if (dbSchema != null && !dbSchema.isEmpty()) {
            overrides.setProperty("journal.database.schema", dbSchema);
        }
        return overrides;
    }

    private static String getActiveProfile() {
        return System.getProperty("journal.profile",
               System.getenv("JOURNAL_PROFILE") != null ? System.getenv("JOURNAL_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/journal-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/journal-" + profile + ".properties");
        }

        applyEnvironment(props, System.getenv());

        // system properties are applied after the environment so that -D wins
        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("journal.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    static void applyEnvironment(Properties props, Map<String, String> environment) {
        environment.forEach((key, value) -> {
            if (key.startsWith("JOURNAL_")) {
                props.setProperty(environmentKey(key), value);
            }
        });
    }

    /**
     * Maps {@code JOURNAL_DATABASE_POOL_MAX_SIZE} to {@code journal.database.pool.max-size}. Names that
     * match no known key map to the plain dotted form.
     */
    static String environmentKey(String variable) {
        String dotted = variable.toLowerCase().replace('_', '.');
        for (String known : KNOWN_KEYS) {
            if (known.replace('-', '.').equals(dotted)) {
                return known;
            }
        }
        return dotted;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        if (getString("journal.database.host", "").isEmpty()) {
            errors.add("Database host is required");
        }

        int port = getInt("journal.database.port", 5432);
        if (port < 1 || port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }

        if (getString("journal.database.name", "").isEmpty()) {
            errors.add("Database name is required");
        }

        if (getString("journal.database.username", "").isEmpty()) {
            errors.add("Database username is required");
        }

        String schema = getString("journal.database.schema", "");
        if (!schema.isEmpty() && !SCHEMA_NAME.matcher(schema).matches()) {
            errors.add("Database schema must be a plain identifier");
        }

        if (getInt("journal.database.pool.max-size", 16) < 1) {
            errors.add("Maximum pool size must be at least 1");
        }

        if (getInt("journal.database.pool.max-wait-queue-size", 128) < -1) {
            errors.add("Pool wait queue size must be -1 (unbounded) or more");
        }

        if (getLong("journal.database.pool.connection-timeout-ms", 30000) < 0) {
            errors.add("Connection timeout must be non-negative");
        }

        if (getLong("journal.database.pool.idle-timeout-ms", 600000) < 0) {
            errors.add("Idle timeout must be non-negative");
        }

        if (getBoolean("journal.metrics.enabled", true) && getString("journal.metrics.instance-id", "x").isBlank()) {
            errors.add("Metrics instance id must not be blank");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Reads an ISO-8601 duration such as {@code PT30S}.
     */
    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (RuntimeException e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public DatabaseConfig getDatabaseConfig() {
        String schema = getString("journal.database.schema", "");
        return new DatabaseConfig(
            getString("journal.database.host", "localhost"),
            getInt("journal.database.port", 5432),
            getString("journal.database.name", "journal"),
            getString("journal.database.username", "journal"),
            getString("journal.database.password", ""),
            schema.isEmpty() ? null : schema,
            getBoolean("journal.database.ssl.enabled", false));
    }

    public PoolConfig getPoolConfig() {
        return new PoolConfig(
            getInt("journal.database.pool.max-size", 16),
            getInt("journal.database.pool.max-wait-queue-size", 128),
            Duration.ofMillis(getLong("journal.database.pool.connection-timeout-ms", 30000)),
            Duration.ofMillis(getLong("journal.database.pool.idle-timeout-ms", 600000)),
            getBoolean("journal.database.pool.shared", false));
    }

    public MetricsConfig getMetricsConfig() {
        return new MetricsConfig(
            getBoolean("journal.metrics.enabled", true),
            getString("journal.metrics.instance-id", "journal-" + UUID.randomUUID().toString().substring(0, 8))
        );
    }

    /** Whether the journal tables are created on startup. */
    public boolean isSchemaAutoCreate() {
        return getBoolean("journal.schema.auto-create", true);
    }

    /**
     * Where the journal tables live. The password is never part of {@link #toString()}.
     */
    public static final class DatabaseConfig {
        private final String host;
        private final int port;
        private final String database;
        private final String username;
        private final String password;
        private final String schema;
        private final boolean sslEnabled;

        public DatabaseConfig(String host, int port, String database, String username, String password) {
            this(host, port, database, username, password, null, false);
        }

        /**
         * @param schema schema holding the journal tables, or null for the server's search path
         * @throws IllegalArgumentException when a setting could never produce a working connection
         */
        public DatabaseConfig(String host, int port, String database, String username, String password,
                              String schema, boolean sslEnabled) {
            this.host = requireText(host, "Database host");
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("Database port must be between 1 and 65535, got " + port);
            }
            this.port = port;
            this.database = requireText(database, "Database name");
            this.username = requireText(username, "Database username");
            this.password = password != null ? password : "";
            if (schema != null && !SCHEMA_NAME.matcher(schema).matches()) {
                throw new IllegalArgumentException("Database schema must be a plain identifier: " + schema);
            }
            this.schema = schema;
            this.sslEnabled = sslEnabled;
        }

        public DatabaseConfig withSchema(String schema) {
            return new DatabaseConfig(host, port, database, username, password, schema, sslEnabled);
        }

        public String getHost() { return host; }
        public int getPort() { return port; }
        public String getDatabase() { return database; }
        public String getUsername() { return username; }
        public String getPassword() { return password; }

        /** Applied as the connection's search_path and created on startup; null when unset. */
        public String getSchema() { return schema; }

        public boolean isSslEnabled() { return sslEnabled; }

        @Override
        public String toString() {
            return "DatabaseConfig{" + username + "@" + host + ":" + port + "/" + database +
                (schema != null ? ", schema=" + schema : "") + ", ssl=" + sslEnabled + '}';
        }
    }

    /**
     * Sizing and timeouts of the reactive pool shared by every store of one manager.
     */
    public static final class PoolConfig {
        private final int maxSize;
        private final int maxWaitQueueSize;
        private final Duration connectionTimeout;
        private final Duration idleTimeout;
        private final boolean shared;

        public PoolConfig(int maxSize, int maxWaitQueueSize, Duration connectionTimeout,
                          Duration idleTimeout, boolean shared) {
            if (maxSize < 1) {
                throw new IllegalArgumentException("Maximum pool size must be at least 1, got " + maxSize);
            }
            if (maxWaitQueueSize < -1) {
                throw new IllegalArgumentException("Pool wait queue size must be -1 or more, got " + maxWaitQueueSize);
            }
            this.maxSize = maxSize;
            this.maxWaitQueueSize = maxWaitQueueSize;
            this.connectionTimeout = requireNonNegative(connectionTimeout, "Connection timeout");
            this.idleTimeout = requireNonNegative(idleTimeout, "Idle timeout");
            this.shared = shared;
        }

        /** Same values as {@code journal-default.properties}. */
        public static PoolConfig defaults() {
            return new PoolConfig(16, 128, Duration.ofSeconds(30), Duration.ofMinutes(10), false);
        }

        public PoolConfig withMaxSize(int maxSize) {
            return new PoolConfig(maxSize, maxWaitQueueSize, connectionTimeout, idleTimeout, shared);
        }

        public int getMaxSize() { return maxSize; }

        /** -1 leaves the queue of callers waiting for a connection unbounded. */
        public int getMaxWaitQueueSize() { return maxWaitQueueSize; }

        public Duration getConnectionTimeout() { return connectionTimeout; }
        public Duration getIdleTimeout() { return idleTimeout; }
        public boolean isShared() { return shared; }

        @Override
        public String toString() {
            return "PoolConfig{maxSize=" + maxSize + ", maxWaitQueueSize=" + maxWaitQueueSize +
                ", connectionTimeout=" + connectionTimeout + ", idleTimeout=" + idleTimeout +
                ", shared=" + shared + '}';
        }
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    private static Duration requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
        return value;
    }

    public static class MetricsConfig {
        private final boolean enabled;
        private final String instanceId;

        public MetricsConfig(boolean enabled, String instanceId) {
            this.enabled = enabled;
            this.instanceId = instanceId;
        }

        public boolean isEnabled() { return enabled; }
        public String getInstanceId() { return instanceId; }
    }

    public String getProfile() { return profile; }

    public Properties getProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }
}

package dev.mars.pgcast.db.config;

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

import dev.mars.pgcast.api.error.PgCastErrorCodes;
import dev.mars.pgcast.api.error.PgCastException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Layered configuration for PgCast.
 *
 * <p>Sources, lowest precedence first:</p>
 * <ol>
 *   <li>{@code /pgcast-default.properties} on the classpath</li>
 *   <li>{@code /pgcast-<profile>.properties} on the classpath</li>
 *   <li>{@code PGCAST_*} environment variables ({@code PGCAST_DATABASE_HOST} becomes {@code pgcast.database.host})</li>
 *   <li>{@code pgcast.*} system properties</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgCastConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(PgCastConfiguration.class);

    private final Properties properties;
    private final String profile;

    public PgCastConfiguration() {
        this(getActiveProfile());
    }

    public PgCastConfiguration(String profile) {
        this(profile, System.getenv());
    }

    PgCastConfiguration(String profile, Map<String, String> environment) {
        this.profile = profile;
        this.properties = loadProperties(profile, environment);
        validateConfiguration();
        logger.info("Loaded PgCast configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("pgcast.profile",
               System.getenv("PGCAST_PROFILE") != null ? System.getenv("PGCAST_PROFILE") : "default");
    }

    private Properties loadProperties(String profile, Map<String, String> environment) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/pgcast-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/pgcast-" + profile + ".properties");
        }

        // Environment first, system properties last so -D always wins
        environment.forEach((key, value) -> {
            if (key.startsWith("PGCAST_")) {
                props.setProperty(environmentKeyToProperty(key), value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("pgcast.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    /**
     * Maps {@code PGCAST_DATABASE_POOL_MAX__SIZE} style names onto property keys.
     * A single underscore separates segments, a double underscore stands for a hyphen.
     */
    static String environmentKeyToProperty(String key) {
        return key.toLowerCase(Locale.ROOT).replace("__", "-").replace('_', '.');
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

        validateDatabaseConfig(errors);
        validateSslConfig(errors);
        validateSubscriptionConfig(errors);

        if (!errors.isEmpty()) {
            throw new PgCastException(PgCastErrorCodes.INVALID_CONFIG,
                "Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateDatabaseConfig(List<String> errors) {
        if (getString("pgcast.database.connection-string", "").isBlank()) {
            if (getString("pgcast.database.host", "").isEmpty()) {
                errors.add("Database host is required");
            }
            if (getString("pgcast.database.name", "").isEmpty()) {
                errors.add("Database name is required");
            }
            if (getString("pgcast.database.username", "").isEmpty()) {
                errors.add("Database username is required");
            }
        } else if (!getString("pgcast.database.connection-string").trim().matches("^postgres(ql)?://.*")) {
            errors.add("Connection string must start with postgresql:// or postgres://");
        }

        int port = getInt("pgcast.database.port", 5432);
        if (port < 1 || port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }

        if (getInt("pgcast.database.pool.max-size", 16) < 1) {
            errors.add("Pool max size must be at least 1");
        }
    }

    private void validateSslConfig(List<String> errors) {
        try {
            SslSettings.Mode.parse(getString("pgcast.database.ssl.mode", "prefer"));
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
    }

    private void validateSubscriptionConfig(List<String> errors) {
        long lockTimeoutMs = getLong("pgcast.subscription.lock-timeout-ms", 30000);
        if (lockTimeoutMs < 100) {
            errors.add("Subscription lock timeout must be at least 100ms");
        }
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

    public SslSettings getSslSettings() {
        SslSettings.Mode mode = SslSettings.Mode.parse(getString("pgcast.database.ssl.mode", "prefer"));
        switch (mode) {
            case DISABLED:
                return SslSettings.disabled();
            case REQUIRED:
                return SslSettings.required(
                    getBoolean("pgcast.database.ssl.reject-unauthorized", true),
                    readCaFile(getString("pgcast.database.ssl.ca-file", "")));
            case PREFER:
            default:
                return SslSettings.prefer();
        }
    }

    private String readCaFile(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        try {
            return Files.readString(Path.of(path.trim()), StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new PgCastException(PgCastErrorCodes.INVALID_CONFIG, "Cannot read CA file: " + path, e);
        }
    }

    public BroadcastConfig getBroadcastConfig() {
        return BroadcastConfig.builder()
            .connectionString(getString("pgcast.database.connection-string", null))
            .host(getString("pgcast.database.host", "localhost"))
            .port(getInt("pgcast.database.port", 5432))
            .database(getString("pgcast.database.name", "pgcast"))
            .username(getString("pgcast.database.username", "pgcast"))
            .password(getString("pgcast.database.password", ""))
            .ssl(getSslSettings())
            .maxPoolSize(getInt("pgcast.database.pool.max-size", 16))
            .maxWaitQueueSize(getInt("pgcast.database.pool.max-wait-queue-size", 128))
            .connectionTimeout(Duration.ofMillis(getLong("pgcast.database.pool.connection-timeout-ms", 30000)))
            .idleTimeout(Duration.ofMillis(getLong("pgcast.database.pool.idle-timeout-ms", 600000)))
            .lockTimeout(Duration.ofMillis(getLong("pgcast.subscription.lock-timeout-ms", 30000)))
            .isolateCallbackFailures(getBoolean("pgcast.dispatch.isolate-failures", false))
            .build();
    }

    public boolean isMetricsEnabled() {
        return getBoolean("pgcast.metrics.enabled", true);
    }

    public String getProfile() {
        return profile;
    }

    public Properties getProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }
}

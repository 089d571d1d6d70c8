package dev.mars.pgnotify.db.config;

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

import dev.mars.pgnotify.api.DecodeFailurePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Layered configuration for the notification layer.
 *
 * <p>Sources, later ones winning:
 * <ol>
 *   <li>{@code /pgnotify-default.properties} on the classpath</li>
 *   <li>{@code /pgnotify-<profile>.properties} when a profile other than {@code default} is active</li>
 *   <li>environment variables prefixed {@code PGNOTIFY_} ({@code PGNOTIFY_DATABASE_HOST} becomes
 *       {@code pgnotify.database.host})</li>
 *   <li>system properties prefixed {@code pgnotify.}</li>
 * </ol>
 *
 * <p>All validation errors are collected and reported together.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgNotifyConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(PgNotifyConfiguration.class);

    private final Properties properties;
    private final String profile;

    public PgNotifyConfiguration() {
        this(getActiveProfile());
    }

    public PgNotifyConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * Creates a configuration with explicit overrides applied on top of every other source.
     * Used by tests to avoid polluting system properties.
     *
     * @param profile the configuration profile to use
     * @param overrides properties that take precedence over files, environment and system properties
     */
    public PgNotifyConfiguration(String profile, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        validateConfiguration();
        logger.info("Loaded pgnotify configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("pgnotify.profile",
            System.getenv("PGNOTIFY_PROFILE") != null ? System.getenv("PGNOTIFY_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/pgnotify-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/pgnotify-" + profile + ".properties");
        }

        // Environment first, then system properties so that -D wins
        System.getenv().forEach((key, value) -> {
            if (key.startsWith("PGNOTIFY_")) {
                String propKey = key.toLowerCase(Locale.ROOT).replace("_", ".");
                props.setProperty(propKey, value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("pgnotify.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
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

        if (getString("pgnotify.database.host", "").isEmpty()) {
            errors.add("Database host is required");
        }

        int port = getInt("pgnotify.database.port", 5432);
        if (port < 1 || port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }

        if (getString("pgnotify.database.name", "").isEmpty()) {
            errors.add("Database name is required");
        }

        if (getString("pgnotify.database.username", "").isEmpty()) {
            errors.add("Database username is required");
        }

        if (getInt("pgnotify.database.pool.max-size", 16) < 1) {
            errors.add("Query pool max size must be at least 1");
        }

        if (getInt("pgnotify.notifications.max-connections", NotificationPoolConfig.DEFAULT_MAX_CONNECTIONS) < 1) {
            errors.add("Notification max connections must be at least 1");
        }

        if (getInt("pgnotify.notifications.buffer-capacity", NotificationPoolConfig.DEFAULT_BUFFER_CAPACITY) < 1) {
            errors.add("Notification buffer capacity must be at least 1");
        }

        String policy = getString("pgnotify.notifications.decode-failure-policy", DecodeFailurePolicy.TERMINATE.name());
        try {
            DecodeFailurePolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            errors.add("Unknown decode failure policy: " + policy);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    public String getProfile() {
        return profile;
    }

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
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

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public PgConnectionConfig getDatabaseConfig() {
        return new PgConnectionConfig.Builder()
            .host(getString("pgnotify.database.host", "localhost"))
            .port(getInt("pgnotify.database.port", 5432))
            .database(getString("pgnotify.database.name", "postgres"))
            .username(getString("pgnotify.database.username", "postgres"))
            .password(getString("pgnotify.database.password", ""))
            .sslEnabled(getBoolean("pgnotify.database.ssl.enabled", false))
            .applicationName(getString("pgnotify.database.application-name", "pgnotify"))
            .build();
    }

    public PgPoolConfig getPoolConfig() {
        return new PgPoolConfig.Builder()
            .maxSize(getInt("pgnotify.database.pool.max-size", 16))
            .maxWaitQueueSize(getInt("pgnotify.database.pool.max-wait-queue-size", 128))
            .connectionTimeout(Duration.ofMillis(getLong("pgnotify.database.pool.connection-timeout-ms", 30000)))
            .idleTimeout(Duration.ofMillis(getLong("pgnotify.database.pool.idle-timeout-ms", 600000)))
            .shared(getBoolean("pgnotify.database.pool.shared", false))
            .build();
    }

    public NotificationPoolConfig getNotificationPoolConfig() {
        return new NotificationPoolConfig.Builder()
            .maxConnections(getInt("pgnotify.notifications.max-connections", NotificationPoolConfig.DEFAULT_MAX_CONNECTIONS))
            .connectTimeout(Duration.ofSeconds(getLong("pgnotify.notifications.connect-timeout-seconds", 30)))
            .keepAliveInterval(Duration.ofSeconds(getLong("pgnotify.notifications.keep-alive-seconds", 300)))
            .bufferCapacity(getInt("pgnotify.notifications.buffer-capacity", NotificationPoolConfig.DEFAULT_BUFFER_CAPACITY))
            .decodeFailurePolicy(DecodeFailurePolicy.valueOf(
                getString("pgnotify.notifications.decode-failure-policy", DecodeFailurePolicy.TERMINATE.name())
                    .trim().toUpperCase(Locale.ROOT)))
            .build();
    }
}

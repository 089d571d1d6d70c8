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

import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;

import java.util.Objects;

/**
 * Configuration for PostgreSQL database connections.
 *
 * <p>Shared by the general query pool and the dedicated listener connection source;
 * both connect to the same database but are sized and managed independently.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgConnectionConfig {
    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;
    private final boolean sslEnabled;
    private final String applicationName;

    private PgConnectionConfig(Builder builder) {
        this.host = Objects.requireNonNull(builder.host, "Host cannot be null");
        this.port = builder.port;
        this.database = Objects.requireNonNull(builder.database, "Database cannot be null");
        this.username = Objects.requireNonNull(builder.username, "Username cannot be null");
        this.password = builder.password;
        this.sslEnabled = builder.sslEnabled;
        this.applicationName = builder.applicationName;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getDatabase() {
        return database;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public boolean isSslEnabled() {
        return sslEnabled;
    }

    public String getApplicationName() {
        return applicationName;
    }

    /**
     * A fresh options instance per call; listener connections are opened from it one by one
     * and the query pool keeps its own copy. The application name shows up in
     * {@code pg_stat_activity}, which is how listener backends are told apart.
     */
    public PgConnectOptions toConnectOptions() {
        PgConnectOptions options = new PgConnectOptions()
            .setHost(host)
            .setPort(port)
            .setDatabase(database)
            .setUser(username)
            .setSslMode(sslEnabled ? SslMode.REQUIRE : SslMode.DISABLE);
        if (password != null) {
            options.setPassword(password);
        }
        if (applicationName != null && !applicationName.isBlank()) {
            options.addProperty("application_name", applicationName);
        }
        return options;
    }

    // never includes the password
    @Override
    public String toString() {
        return "PgConnectionConfig{" + username + "@" + host + ":" + port + "/" + database
            + (sslEnabled ? ", ssl" : "") + '}';
    }

    public static class Builder {
        private String host = "localhost";
        private int port = 5432;
        private String database;
        private String username;
        private String password;
        private boolean sslEnabled = false;
        private String applicationName = "pgnotify";

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder sslEnabled(boolean sslEnabled) {
            this.sslEnabled = sslEnabled;
            return this;
        }

        public Builder applicationName(String applicationName) {
            this.applicationName = applicationName;
            return this;
        }

        public PgConnectionConfig build() {
            return new PgConnectionConfig(this);
        }
    }
}

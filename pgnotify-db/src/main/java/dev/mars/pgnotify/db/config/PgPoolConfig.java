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

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the query pool that publishes notifications and provisions triggers.
 *
 * <p>Checkouts from this pool are short. Subscriptions never borrow from it; their
 * connections are governed by {@link NotificationPoolConfig}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class PgPoolConfig {
    public static final int DEFAULT_MAX_SIZE = 16;
    public static final int DEFAULT_MAX_WAIT_QUEUE_SIZE = 128;

    private final int maxSize;
    private final int maxWaitQueueSize;
    private final Duration connectionTimeout;
    private final Duration idleTimeout;
    private final boolean shared;

    private PgPoolConfig(Builder builder) {
        this.maxSize = builder.maxSize;
        this.maxWaitQueueSize = builder.maxWaitQueueSize;
        this.connectionTimeout = builder.connectionTimeout;
        this.idleTimeout = builder.idleTimeout;
        this.shared = builder.shared;
    }

    public static PgPoolConfig defaults() {
        return new Builder().build();
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Publishers waiting for a connection beyond this bound fail immediately.
     */
    public int getMaxWaitQueueSize() {
        return maxWaitQueueSize;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    /**
     * Whether Vert.x may hand the same pool to every verticle using identical options.
     */
    public boolean isShared() {
        return shared;
    }

    @Override
    public String toString() {
        return "PgPoolConfig{maxSize=" + maxSize + ", maxWaitQueueSize=" + maxWaitQueueSize
            + ", connectionTimeout=" + connectionTimeout + ", idleTimeout=" + idleTimeout
            + ", shared=" + shared + '}';
    }

    public static final class Builder {
        private int maxSize = DEFAULT_MAX_SIZE;
        private int maxWaitQueueSize = DEFAULT_MAX_WAIT_QUEUE_SIZE;
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration idleTimeout = Duration.ofMinutes(10);
        private boolean shared;

        public Builder maxSize(int maxSize) {
            if (maxSize < 1) {
                throw new IllegalArgumentException("maxSize must be at least 1");
            }
            this.maxSize = maxSize;
            return this;
        }

        /**
         * @param maxWaitQueueSize negative for an unbounded queue, as in Vert.x
         */
        public Builder maxWaitQueueSize(int maxWaitQueueSize) {
            this.maxWaitQueueSize = maxWaitQueueSize;
            return this;
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = positive(connectionTimeout, "connectionTimeout");
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = positive(idleTimeout, "idleTimeout");
            return this;
        }

        public Builder shared(boolean shared) {
            this.shared = shared;
            return this;
        }

        public PgPoolConfig build() {
            return new PgPoolConfig(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}

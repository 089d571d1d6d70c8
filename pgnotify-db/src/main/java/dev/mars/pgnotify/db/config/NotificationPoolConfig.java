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

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of the dedicated listener connections and of the subscriptions that hold them.
 *
 * <p>A subscription keeps its connection for minutes or hours, so these connections come
 * from their own bounded source and never from the query pool.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class NotificationPoolConfig {

    public static final int DEFAULT_MAX_CONNECTIONS = 50;
    public static final int DEFAULT_BUFFER_CAPACITY = 100;

    private final int maxConnections;
    private final Duration connectTimeout;
    private final Duration keepAliveInterval;
    private final int bufferCapacity;
    private final DecodeFailurePolicy decodeFailurePolicy;

    private NotificationPoolConfig(Builder builder) {
        this.maxConnections = builder.maxConnections;
        this.connectTimeout = builder.connectTimeout;
        this.keepAliveInterval = builder.keepAliveInterval;
        this.bufferCapacity = builder.bufferCapacity;
        this.decodeFailurePolicy = builder.decodeFailurePolicy;
    }

    public static NotificationPoolConfig defaults() {
        return new Builder().build();
    }

    /**
     * Upper bound on dedicated connections held at once, i.e. on concurrent subscriptions.
     */
    public int getMaxConnections() {
        return maxConnections;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * Interval at which every held listener connection is probed with a trivial query so
     * that dead connections are detected even on quiet channels.
     */
    public Duration getKeepAliveInterval() {
        return keepAliveInterval;
    }

    /**
     * Capacity of each subscription's buffer. On overflow the oldest entry is dropped.
     */
    public int getBufferCapacity() {
        return bufferCapacity;
    }

    public DecodeFailurePolicy getDecodeFailurePolicy() {
        return decodeFailurePolicy;
    }

    @Override
    public String toString() {
        return "NotificationPoolConfig{" +
            "maxConnections=" + maxConnections +
            ", connectTimeout=" + connectTimeout +
            ", keepAliveInterval=" + keepAliveInterval +
            ", bufferCapacity=" + bufferCapacity +
            ", decodeFailurePolicy=" + decodeFailurePolicy +
            '}';
    }

    public static final class Builder {
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration keepAliveInterval = Duration.ofMinutes(5);
        private int bufferCapacity = DEFAULT_BUFFER_CAPACITY;
        private DecodeFailurePolicy decodeFailurePolicy = DecodeFailurePolicy.TERMINATE;

        public Builder maxConnections(int maxConnections) {
            if (maxConnections < 1) {
                throw new IllegalArgumentException("maxConnections must be at least 1");
            }
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder keepAliveInterval(Duration keepAliveInterval) {
            this.keepAliveInterval = Objects.requireNonNull(keepAliveInterval, "keepAliveInterval");
            return this;
        }

        public Builder bufferCapacity(int bufferCapacity) {
            if (bufferCapacity < 1) {
                throw new IllegalArgumentException("bufferCapacity must be at least 1");
            }
            this.bufferCapacity = bufferCapacity;
            return this;
        }

        public Builder decodeFailurePolicy(DecodeFailurePolicy decodeFailurePolicy) {
            this.decodeFailurePolicy = Objects.requireNonNull(decodeFailurePolicy, "decodeFailurePolicy");
            return this;
        }

        public NotificationPoolConfig build() {
            return new NotificationPoolConfig(this);
        }
    }
}

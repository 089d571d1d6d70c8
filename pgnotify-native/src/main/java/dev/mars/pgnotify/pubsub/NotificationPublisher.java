package dev.mars.pgnotify.pubsub;

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

import dev.mars.pgnotify.api.ChannelDescriptor;
import dev.mars.pgnotify.api.codec.EncodedPayload;
import dev.mars.pgnotify.api.codec.PayloadCodec;
import dev.mars.pgnotify.api.error.PayloadEncodingException;
import dev.mars.pgnotify.api.identifier.ChannelName;
import dev.mars.pgnotify.api.metrics.NotificationMetrics;
import dev.mars.pgnotify.db.connection.SqlExecutor;
import dev.mars.pgnotify.db.metrics.NoOpNotificationMetrics;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Publishes notifications with {@code NOTIFY}.
 *
 * <p>A value is encoded, checked against the 8000 byte limit and sent as a single
 * {@code NOTIFY "<channel>", '<payload>'} statement. Encode and size failures are reported
 * before any statement runs, as is a {@code null} value. Nothing is retried or buffered.
 *
 * <p>Every operation has a variant taking a {@link SqlClient}. Pass the connection of an
 * open transaction to have the notification delivered only if that transaction commits.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class NotificationPublisher {
    private static final Logger logger = LoggerFactory.getLogger(NotificationPublisher.class);

    private final SqlExecutor defaultExecutor;
    private final PayloadCodec codec;
    private final NotificationMetrics metrics;

    public NotificationPublisher(SqlClient defaultClient, PayloadCodec codec) {
        this(defaultClient, codec, NoOpNotificationMetrics.INSTANCE);
    }

    public NotificationPublisher(SqlClient defaultClient, PayloadCodec codec, NotificationMetrics metrics) {
        this(SqlExecutor.of(defaultClient), codec, metrics);
    }

    NotificationPublisher(SqlExecutor defaultExecutor, PayloadCodec codec, NotificationMetrics metrics) {
        this.defaultExecutor = Objects.requireNonNull(defaultExecutor, "defaultExecutor");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.metrics = metrics != null ? metrics : NoOpNotificationMetrics.INSTANCE;
    }

    public <T> Future<Void> publish(ChannelDescriptor<T> descriptor, T value) {
        Objects.requireNonNull(descriptor, "descriptor");
        return publish(defaultExecutor, descriptor.name(), value);
    }

    public <T> Future<Void> publish(SqlClient client, ChannelDescriptor<T> descriptor, T value) {
        Objects.requireNonNull(descriptor, "descriptor");
        return publish(executorFor(client), descriptor.name(), value);
    }

    /**
     * Untyped publish: the value is encoded as-is without a descriptor.
     */
    public Future<Void> publish(ChannelName channel, Object value) {
        return publish(defaultExecutor, channel, value);
    }

    public Future<Void> publish(SqlClient client, ChannelName channel, Object value) {
        return publish(executorFor(client), channel, value);
    }

    private Future<Void> publish(SqlExecutor executor, ChannelName channel, Object value) {
        Objects.requireNonNull(channel, "channel");
        if (value == null) {
            // subscribers read null as the end of their stream
            return Future.failedFuture(new PayloadEncodingException("null",
                new IllegalArgumentException("null cannot be published on channel " + channel)));
        }
        EncodedPayload payload;
        try {
            payload = codec.encode(value);
            codec.checkSize(payload);
        } catch (RuntimeException e) {
            logger.warn("Not publishing on channel {}: {}", channel, e.getMessage());
            return Future.failedFuture(e);
        }
        return send(executor, channel, notifyStatement(channel, payload.text()));
    }

    /**
     * Publishes text that is already in its wire form. The size limit still applies.
     */
    public Future<Void> publishRaw(ChannelName channel, String payload) {
        return publishRaw(defaultExecutor, channel, payload);
    }

    public Future<Void> publishRaw(SqlClient client, ChannelName channel, String payload) {
        return publishRaw(executorFor(client), channel, payload);
    }

    private Future<Void> publishRaw(SqlExecutor executor, ChannelName channel, String payload) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(payload, "payload");
        try {
            codec.checkSize(EncodedPayload.of(payload));
        } catch (RuntimeException e) {
            logger.warn("Not publishing on channel {}: {}", channel, e.getMessage());
            return Future.failedFuture(e);
        }
        return send(executor, channel, notifyStatement(channel, payload));
    }

    /**
     * Sends a notification without payload; listeners receive an empty string.
     */
    public Future<Void> publishEmpty(ChannelName channel) {
        Objects.requireNonNull(channel, "channel");
        return send(defaultExecutor, channel, "NOTIFY " + channel.quoted());
    }

    public Future<Void> publishEmpty(SqlClient client, ChannelName channel) {
        Objects.requireNonNull(channel, "channel");
        return send(executorFor(client), channel, "NOTIFY " + channel.quoted());
    }

    /**
     * Renders {@code NOTIFY "<channel>", '<payload>'} with single quotes in the payload doubled.
     */
    static String notifyStatement(ChannelName channel, String payload) {
        return "NOTIFY " + channel.quoted() + ", '" + escapeLiteral(payload) + "'";
    }

    static String escapeLiteral(String text) {
        return text.replace("'", "''");
    }

    private static SqlExecutor executorFor(SqlClient client) {
        return SqlExecutor.of(Objects.requireNonNull(client, "client"));
    }

    private Future<Void> send(SqlExecutor executor, ChannelName channel, String sql) {
        return executor.execute(sql)
            .onSuccess(v -> {
                metrics.notificationPublished(channel.value());
                logger.debug("Published notification on channel {}", channel);
            })
            .onFailure(err -> logger.warn("NOTIFY on channel {} failed: {}", channel, err.getMessage()));
    }
}

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
import dev.mars.pgnotify.api.DecodeFailurePolicy;
import dev.mars.pgnotify.api.NotificationEvent;
import dev.mars.pgnotify.api.RawNotification;
import dev.mars.pgnotify.api.codec.JacksonPayloadCodec;
import dev.mars.pgnotify.api.codec.PayloadCodec;
import dev.mars.pgnotify.api.error.PayloadDecodingException;
import dev.mars.pgnotify.api.identifier.ChannelName;
import dev.mars.pgnotify.api.metrics.NotificationMetrics;
import dev.mars.pgnotify.db.config.NotificationPoolConfig;
import dev.mars.pgnotify.db.config.PgConnectionConfig;
import dev.mars.pgnotify.db.config.PgNotifyConfiguration;
import dev.mars.pgnotify.db.connection.DedicatedConnectionSource;
import dev.mars.pgnotify.db.connection.PgConnectionManager;
import dev.mars.pgnotify.db.connection.PgDedicatedConnectionSource;
import dev.mars.pgnotify.db.metrics.MicrometerNotificationMetrics;
import dev.mars.pgnotify.db.metrics.NoOpNotificationMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.SqlClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * Entry point for subscribing to and publishing on PostgreSQL notification channels.
 *
 * <p>Each subscription holds its own dedicated connection from the
 * {@link DedicatedConnectionSource}; several subscriptions on the same channel each get
 * every notification. Publishing goes through the query pool.
 *
 * <pre>{@code
 * ChannelDescriptor<OrderPlaced> orders = ChannelDescriptor.of("orders", OrderPlaced.class);
 * client.subscribe(orders).compose(sub -> {
 *     // LISTEN is acknowledged here, a publish from now on is seen
 *     return client.publish(orders, new OrderPlaced(42)).compose(v -> sub.next());
 * });
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgNotificationClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgNotificationClient.class);

    private final DedicatedConnectionSource connectionSource;
    private final NotificationPublisher publisher;
    private final PayloadCodec codec;
    private final NotificationPoolConfig config;
    private final NotificationMetrics metrics;
    private final PgConnectionManager ownedConnectionManager;

    public PgNotificationClient(DedicatedConnectionSource connectionSource, SqlClient queryClient) {
        this(connectionSource, queryClient, new JacksonPayloadCodec(), NotificationPoolConfig.defaults(),
            NoOpNotificationMetrics.INSTANCE);
    }

    public PgNotificationClient(DedicatedConnectionSource connectionSource, SqlClient queryClient,
                                PayloadCodec codec, NotificationPoolConfig config, NotificationMetrics metrics) {
        this(connectionSource, new NotificationPublisher(queryClient, codec, metrics), codec, config, metrics, null);
    }

    PgNotificationClient(DedicatedConnectionSource connectionSource, NotificationPublisher publisher,
                         PayloadCodec codec, NotificationPoolConfig config, NotificationMetrics metrics,
                         PgConnectionManager ownedConnectionManager) {
        this.connectionSource = Objects.requireNonNull(connectionSource, "connectionSource");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = metrics != null ? metrics : NoOpNotificationMetrics.INSTANCE;
        this.ownedConnectionManager = ownedConnectionManager;
    }

    /**
     * Builds a client, its query pool and its dedicated connection source from configuration.
     * Closing the client closes all of them.
     *
     * @param meterRegistry optional registry; null disables metrics
     */
    public static PgNotificationClient create(Vertx vertx, PgNotifyConfiguration configuration, MeterRegistry meterRegistry) {
        Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        Objects.requireNonNull(configuration, "configuration");

        PgConnectionConfig connectionConfig = configuration.getDatabaseConfig();
        NotificationPoolConfig notificationConfig = configuration.getNotificationPoolConfig();
        NotificationMetrics metrics = meterRegistry != null
            ? new MicrometerNotificationMetrics(meterRegistry)
            : NoOpNotificationMetrics.INSTANCE;

        PgConnectionManager connectionManager = new PgConnectionManager(vertx, meterRegistry);
        Pool pool = connectionManager.getOrCreatePool(null, connectionConfig, configuration.getPoolConfig());
        PgDedicatedConnectionSource source = new PgDedicatedConnectionSource(
            vertx, connectionConfig::toConnectOptions, notificationConfig, metrics);
        source.start();

        logger.info("Created notification client for {}:{}/{} (profile {})", connectionConfig.getHost(),
            connectionConfig.getPort(), connectionConfig.getDatabase(), configuration.getProfile());
        PayloadCodec codec = new JacksonPayloadCodec();
        return new PgNotificationClient(source, new NotificationPublisher(pool, codec, metrics), codec,
            notificationConfig, metrics, connectionManager);
    }

    /**
     * Subscribes with payloads decoded to the descriptor's type.
     *
     * @return a future completing once LISTEN is acknowledged
     */
    public <T> Future<NotificationSubscription<T>> subscribe(ChannelDescriptor<T> descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        return open(descriptor.name(), raw -> codec.<T>decode(raw.payload(), descriptor.payloadType()),
            descriptor.payloadType().toCanonical());
    }

    /**
     * Untyped override pairing an arbitrary decode type with a channel.
     */
    public <T> Future<NotificationSubscription<T>> subscribe(ChannelName channel, Class<T> payloadType) {
        return subscribe(ChannelDescriptor.of(channel, payloadType));
    }

    /**
     * Like {@link #subscribe(ChannelDescriptor)} but each element also carries the channel
     * and the sending backend's process id.
     */
    public <T> Future<NotificationSubscription<NotificationEvent<T>>> subscribeEvents(ChannelDescriptor<T> descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        return open(descriptor.name(),
            raw -> new NotificationEvent<>(decodeNonNull(raw, descriptor),
                raw.channel(), raw.senderBackendId()),
            descriptor.payloadType().toCanonical());
    }

    /**
     * Subscribes without decoding.
     */
    public Future<NotificationSubscription<RawNotification>> subscribeRaw(ChannelName channel) {
        Objects.requireNonNull(channel, "channel");
        return open(channel, Function.identity(), RawNotification.class.getName());
    }

    /**
     * Runs {@code body} with a fresh subscription and cancels it once the future returned by
     * {@code body} completes, whatever the outcome. The returned future completes after the
     * dedicated connection was released.
     */
    public <T, R> Future<R> withSubscription(ChannelDescriptor<T> descriptor,
                                             Function<NotificationSubscription<T>, Future<R>> body) {
        Objects.requireNonNull(body, "body");
        return subscribe(descriptor).compose(subscription -> {
            Future<R> result;
            try {
                result = body.apply(subscription);
            } catch (RuntimeException e) {
                result = Future.failedFuture(e);
            }
            return result.transform(outcome -> subscription.cancel().transform(cleanup -> {
                if (outcome.succeeded()) {
                    return cleanup.succeeded()
                        ? Future.succeededFuture(outcome.result())
                        : Future.<R>failedFuture(cleanup.cause());
                }
                if (cleanup.failed()) {
                    outcome.cause().addSuppressed(cleanup.cause());
                }
                return Future.<R>failedFuture(outcome.cause());
            }));
        });
    }

    public <T> Future<Void> publish(ChannelDescriptor<T> descriptor, T value) {
        return publisher.publish(descriptor, value);
    }

    public Future<Void> publish(ChannelName channel, Object value) {
        return publisher.publish(channel, value);
    }

    public NotificationPublisher publisher() {
        return publisher;
    }

    /**
     * Dedicated connections currently held, one per live subscription.
     */
    public int activeSubscriptions() {
        return connectionSource.activeConnections();
    }

    public DedicatedConnectionSource connectionSource() {
        return connectionSource;
    }

    @Override
    public void close() {
        if (ownedConnectionManager != null) {
            connectionSource.close();
            ownedConnectionManager.close();
            logger.info("Notification client closed");
        }
    }

    private <T> T decodeNonNull(RawNotification raw, ChannelDescriptor<T> descriptor) {
        T payload = codec.decode(raw.payload(), descriptor.payloadType());
        if (payload == null) {
            throw new PayloadDecodingException(descriptor.payloadType().toCanonical(), raw.payload(),
                new IllegalArgumentException("null payload"));
        }
        return payload;
    }

    private <E> Future<NotificationSubscription<E>> open(ChannelName channel, Function<RawNotification, E> decoder,
                                                         String elementTypeName) {
        DecodeFailurePolicy policy = config.getDecodeFailurePolicy();
        NotificationSubscription<E> subscription = new NotificationSubscription<>(channel, connectionSource,
            decoder, elementTypeName, policy, config.getBufferCapacity(), metrics);
        return subscription.open();
    }
}

package dev.mars.pgnotify.db.connection;

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

import dev.mars.pgnotify.api.error.NotificationConnectionException;
import dev.mars.pgnotify.api.error.NotificationsNotSupportedException;
import dev.mars.pgnotify.api.metrics.NotificationMetrics;
import dev.mars.pgnotify.db.config.NotificationPoolConfig;
import dev.mars.pgnotify.db.metrics.NoOpNotificationMetrics;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.PgConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded source of dedicated PostgreSQL connections for LISTEN.
 *
 * <p>Each {@link #acquire()} opens a fresh physical connection through
 * {@link PgConnection#connect}; {@link #release} closes it. At most
 * {@link NotificationPoolConfig#getMaxConnections()} connections are open or opening at
 * any time. Once started, the source probes every held connection with {@code SELECT 1}
 * at the configured keep-alive interval and closes connections whose probe fails, which
 * ends the owning subscription through its close handler.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgDedicatedConnectionSource implements DedicatedConnectionSource {
    private static final Logger logger = LoggerFactory.getLogger(PgDedicatedConnectionSource.class);

    private final Vertx vertx;
    private final ConnectOptionsProvider connectOptionsProvider;
    private final NotificationPoolConfig config;
    private final NotificationMetrics metrics;

    private final Set<ListenerConnection> held = ConcurrentHashMap.newKeySet();
    private final AtomicInteger reserved = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile long keepAliveTimerId = -1;

    public PgDedicatedConnectionSource(Vertx vertx, ConnectOptionsProvider connectOptionsProvider,
                                       NotificationPoolConfig config) {
        this(vertx, connectOptionsProvider, config, NoOpNotificationMetrics.INSTANCE);
    }

    public PgDedicatedConnectionSource(Vertx vertx, ConnectOptionsProvider connectOptionsProvider,
                                       NotificationPoolConfig config, NotificationMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.connectOptionsProvider = Objects.requireNonNull(connectOptionsProvider, "connectOptionsProvider");
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = metrics != null ? metrics : NoOpNotificationMetrics.INSTANCE;
        logger.info("Initialized dedicated connection source: {}", config);
    }

    @Override
    public Future<Void> start() {
        if (closed.get()) {
            return Future.failedFuture(new NotificationConnectionException("Dedicated connection source is closed"));
        }
        if (keepAliveTimerId < 0) {
            long interval = Math.max(1, config.getKeepAliveInterval().toMillis());
            keepAliveTimerId = vertx.setPeriodic(interval, id -> probeHeldConnections());
            logger.debug("Keep-alive probing every {} ms", interval);
        }
        return Future.succeededFuture();
    }

    @Override
    public Future<ListenerConnection> acquire() {
        if (closed.get()) {
            return Future.failedFuture(new NotificationConnectionException("Dedicated connection source is closed"));
        }

        PgConnectOptions options = connectOptionsProvider.getConnectOptions();
        if (options == null) {
            return Future.failedFuture(new NotificationsNotSupportedException(
                "No connect options available for dedicated LISTEN connections"));
        }

        int max = config.getMaxConnections();
        if (reserved.incrementAndGet() > max) {
            reserved.decrementAndGet();
            return Future.failedFuture(new NotificationConnectionException(
                "Dedicated connection limit reached (" + max + " connections in use)"));
        }

        Promise<ListenerConnection> promise = Promise.promise();
        long timerId = vertx.setTimer(Math.max(1, config.getConnectTimeout().toMillis()), id -> {
            if (promise.tryFail(new NotificationConnectionException(
                    "Timed out after " + config.getConnectTimeout() + " opening dedicated connection"))) {
                reserved.decrementAndGet();
            }
        });

        PgConnection.connect(vertx, options).onComplete(ar -> {
            vertx.cancelTimer(timerId);
            if (ar.failed()) {
                if (promise.tryFail(new NotificationConnectionException(
                        "Failed to open dedicated connection: " + ar.cause().getMessage(), ar.cause()))) {
                    reserved.decrementAndGet();
                }
                return;
            }
            PgListenerConnection connection = new PgListenerConnection(ar.result());
            if (closed.get() || !promise.tryComplete(connection)) {
                // timed out or source closed while connecting
                connection.close();
                if (closed.get() && promise.tryFail(
                        new NotificationConnectionException("Dedicated connection source is closed"))) {
                    reserved.decrementAndGet();
                }
                return;
            }
            held.add(connection);
            metrics.dedicatedConnectionAcquired();
            logger.debug("Acquired dedicated connection (backend {}), {} in use",
                connection.processId(), held.size());
        });
        return promise.future();
    }

    @Override
    public Future<Void> release(ListenerConnection connection) {
        if (connection == null || !held.remove(connection)) {
            logger.debug("Ignoring release of a connection that is not checked out");
            return Future.succeededFuture();
        }
        reserved.decrementAndGet();
        metrics.dedicatedConnectionReleased();
        return connection.close()
            .recover(err -> {
                logger.warn("Error closing dedicated connection: {}", err.getMessage());
                return Future.succeededFuture();
            })
            .onSuccess(v -> logger.debug("Released dedicated connection, {} in use", held.size()));
    }

    @Override
    public int activeConnections() {
        return held.size();
    }

    @Override
    public boolean supportsDedicatedConnections() {
        return true;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (keepAliveTimerId >= 0) {
            vertx.cancelTimer(keepAliveTimerId);
        }
        List<ListenerConnection> remaining = new ArrayList<>(held);
        logger.info("Closing dedicated connection source, {} connections still held", remaining.size());
        remaining.forEach(this::release);
    }

    private void probeHeldConnections() {
        for (ListenerConnection connection : new ArrayList<>(held)) {
            if (connection.isClosed()) {
                continue;
            }
            connection.execute("SELECT 1").onFailure(err -> {
                logger.warn("Keep-alive probe failed on backend {}, closing connection: {}",
                    connection.processId(), err.getMessage());
                connection.close();
            });
        }
    }
}

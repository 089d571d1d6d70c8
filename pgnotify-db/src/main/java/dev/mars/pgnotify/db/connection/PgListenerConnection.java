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

import dev.mars.pgnotify.api.RawNotification;
import dev.mars.pgnotify.api.identifier.ChannelName;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.pgclient.PgConnection;
import io.vertx.pgclient.PgNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ListenerConnection} backed by a Vert.x {@link PgConnection}.
 *
 * <p>The connection has a single notification handler; this class fans it out to the
 * callbacks registered per channel. Notifications for channels without a callback are
 * discarded at debug level.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgListenerConnection implements ListenerConnection {
    private static final Logger logger = LoggerFactory.getLogger(PgListenerConnection.class);

    private final PgConnection connection;
    private final Map<String, List<Registration>> registrations = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Handler<Void> closeHandler;
    private volatile Handler<Throwable> exceptionHandler;

    public PgListenerConnection(PgConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
        connection.notificationHandler(this::dispatch);
        connection.closeHandler(v -> handleClosed());
        connection.exceptionHandler(this::handleException);
    }

    @Override
    public Future<Void> execute(String sql) {
        if (closed.get()) {
            return Future.failedFuture(new IllegalStateException("Listener connection is closed"));
        }
        return connection.query(sql).execute().mapEmpty();
    }

    @Override
    public NotificationRegistration onNotification(ChannelName channel, Handler<RawNotification> handler) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(handler, "handler");
        Registration registration = new Registration(channel, handler);
        registrations.computeIfAbsent(channel.value(), k -> new CopyOnWriteArrayList<>()).add(registration);
        logger.debug("Registered notification callback for channel {} on backend {}", channel, processId());
        return registration;
    }

    @Override
    public ListenerConnection closeHandler(Handler<Void> handler) {
        this.closeHandler = handler;
        return this;
    }

    @Override
    public ListenerConnection exceptionHandler(Handler<Throwable> handler) {
        this.exceptionHandler = handler;
        return this;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public int processId() {
        return connection.processId();
    }

    @Override
    public Future<Void> close() {
        if (closed.get()) {
            return Future.succeededFuture();
        }
        return connection.close();
    }

    private void dispatch(PgNotification notification) {
        List<Registration> handlers = registrations.get(notification.getChannel());
        if (handlers == null || handlers.isEmpty()) {
            logger.debug("Discarding notification on unregistered channel {}", notification.getChannel());
            return;
        }
        for (Registration registration : handlers) {
            RawNotification raw = new RawNotification(registration.channel,
                notification.getPayload(), notification.getProcessId());
            try {
                registration.handler.handle(raw);
            } catch (RuntimeException e) {
                logger.error("Notification callback for channel {} failed", registration.channel, e);
            }
        }
    }

    private void handleClosed() {
        if (closed.compareAndSet(false, true)) {
            logger.debug("Listener connection closed");
            Handler<Void> handler = closeHandler;
            if (handler != null) {
                handler.handle(null);
            }
        }
    }

    private void handleException(Throwable error) {
        logger.warn("Listener connection error: {}", error.getMessage());
        Handler<Throwable> handler = exceptionHandler;
        if (handler != null) {
            handler.handle(error);
        }
    }

    private final class Registration implements NotificationRegistration {
        private final ChannelName channel;
        private final Handler<RawNotification> handler;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(ChannelName channel, Handler<RawNotification> handler) {
            this.channel = channel;
            this.handler = handler;
        }

        @Override
        public void stop() {
            if (active.compareAndSet(true, false)) {
                List<Registration> list = registrations.get(channel.value());
                if (list != null) {
                    list.remove(this);
                }
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}

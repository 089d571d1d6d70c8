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

import dev.mars.pgnotify.api.DecodeFailurePolicy;
import dev.mars.pgnotify.api.RawNotification;
import dev.mars.pgnotify.api.error.NotificationCleanupException;
import dev.mars.pgnotify.api.error.NotificationConnectionException;
import dev.mars.pgnotify.api.error.NotificationsNotSupportedException;
import dev.mars.pgnotify.api.error.PayloadDecodingException;
import dev.mars.pgnotify.api.identifier.ChannelName;
import dev.mars.pgnotify.api.metrics.NotificationMetrics;
import dev.mars.pgnotify.db.connection.DedicatedConnectionSource;
import dev.mars.pgnotify.db.connection.ListenerConnection;
import dev.mars.pgnotify.db.connection.NotificationRegistration;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.streams.ReadStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * A live subscription to one channel, holding one dedicated connection for its whole life.
 *
 * <p>Notifications arrive through the connection's callback and are appended to a bounded
 * FIFO buffer; when the buffer is full the oldest entry is dropped. The callback never
 * blocks. Entries are decoded when the consumer takes them, either by pulling with
 * {@link #next()} or by registering a {@link #handler(Handler) handler} and using the
 * {@link ReadStream} demand protocol. A subscription is consumed one way or the other,
 * never both, and by a single consumer.
 *
 * <p>The subscription ends when it is cancelled, when the connection reports an error,
 * when a payload cannot be decoded (unless the policy is {@link DecodeFailurePolicy#SKIP}),
 * or when the connection closes. Whatever ends it first, cleanup runs once:
 * the callback is deregistered, {@code UNLISTEN} is issued (skipped when the connection is
 * already gone) and the connection is released. {@link #termination()} completes after the
 * release and fails with {@link NotificationCleanupException} if {@code UNLISTEN} failed.
 *
 * <p>Consumers see the end of the stream as {@code next()} completing with {@code null}
 * (orderly end) or failing with the terminal error; push consumers get the end handler or
 * the exception handler. Entries buffered before a connection closure or connection error
 * are still delivered; cancellation and decode failures discard them.
 *
 * @param <E> element type delivered to the consumer
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class NotificationSubscription<E> implements ReadStream<E> {
    private static final Logger logger = LoggerFactory.getLogger(NotificationSubscription.class);

    private enum Mode { UNSET, PULL, PUSH }

    private final ChannelName channel;
    private final DedicatedConnectionSource connectionSource;
    private final Function<RawNotification, E> decoder;
    private final String elementTypeName;
    private final DecodeFailurePolicy decodeFailurePolicy;
    private final int capacity;
    private final NotificationMetrics metrics;

    private final Promise<Void> readiness = Promise.promise();
    private final Promise<Void> termination = Promise.promise();
    private final AtomicBoolean cleanupStarted = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    // guarded by this
    private final ArrayDeque<RawNotification> buffer = new ArrayDeque<>();
    private volatile SubscriptionState state = SubscriptionState.REQUESTED;
    private ListenerConnection connection;
    private NotificationRegistration registration;
    private boolean opened;
    private boolean inputEnded;
    private Throwable terminalError;
    private boolean draining;
    private Mode mode = Mode.UNSET;
    private Promise<E> pendingNext;
    private Handler<E> dataHandler;
    private Handler<Void> endHandler;
    private Handler<Throwable> exceptionHandler;
    private long demand = Long.MAX_VALUE;
    private boolean endEmitted;

    NotificationSubscription(ChannelName channel,
                             DedicatedConnectionSource connectionSource,
                             Function<RawNotification, E> decoder,
                             String elementTypeName,
                             DecodeFailurePolicy decodeFailurePolicy,
                             int capacity,
                             NotificationMetrics metrics) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.connectionSource = Objects.requireNonNull(connectionSource, "connectionSource");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.elementTypeName = elementTypeName;
        this.decodeFailurePolicy = Objects.requireNonNull(decodeFailurePolicy, "decodeFailurePolicy");
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Acquires the dedicated connection and issues LISTEN. The returned future completes
     * only once the database acknowledged LISTEN; a publish issued after that point is
     * guaranteed to reach this subscription.
     */
    Future<NotificationSubscription<E>> open() {
        if (!connectionSource.supportsDedicatedConnections()) {
            NotificationsNotSupportedException error = new NotificationsNotSupportedException(
                "Connection source does not provide dedicated connections required for LISTEN");
            failBeforeConnection(error);
            return Future.failedFuture(error);
        }
        logger.debug("Subscribing to channel {}", channel);
        return connectionSource.acquire()
            .recover(err -> {
                failBeforeConnection(err);
                return Future.failedFuture(err);
            })
            .compose(this::listen);
    }

    private Future<NotificationSubscription<E>> listen(ListenerConnection conn) {
        synchronized (this) {
            connection = conn;
            state = SubscriptionState.CONNECTION_ACQUIRED;
            // callback before LISTEN so nothing delivered right after the acknowledgement is lost
            registration = conn.onNotification(channel, this::onNotification);
        }
        conn.closeHandler(v -> onConnectionClosed());
        conn.exceptionHandler(this::onConnectionError);

        return conn.execute("LISTEN " + channel.quoted()).transform(ar -> {
            if (ar.failed()) {
                NotificationConnectionException error = new NotificationConnectionException(
                    "LISTEN on channel " + channel + " failed: " + ar.cause().getMessage(), ar.cause());
                logger.warn("Subscribe to channel {} failed: {}", channel, ar.cause().getMessage());
                return terminate(error, true, true)
                    .transform(v -> Future.<NotificationSubscription<E>>failedFuture(error));
            }

            boolean endedEarly;
            synchronized (this) {
                endedEarly = cleanupStarted.get();
                if (!endedEarly) {
                    state = SubscriptionState.ACTIVE;
                    opened = true;
                }
            }
            if (endedEarly) {
                Throwable error = streamError() != null ? streamError()
                    : new NotificationConnectionException("Connection for channel " + channel + " closed during subscribe");
                return termination.future()
                    .transform(v -> Future.<NotificationSubscription<E>>failedFuture(error));
            }

            metrics.subscriptionOpened(channel.value());
            readiness.tryComplete();
            logger.info("Listening on channel {} (backend {})", channel, conn.processId());
            return Future.succeededFuture(this);
        });
    }

    private void failBeforeConnection(Throwable error) {
        cleanupStarted.set(true);
        synchronized (this) {
            state = SubscriptionState.FAILED;
            inputEnded = true;
            terminalError = error;
        }
        readiness.tryFail(error);
        termination.tryComplete();
        logger.warn("Could not acquire a dedicated connection for channel {}: {}", channel, error.getMessage());
    }

    /**
     * Takes the next element, waiting for one if the buffer is empty.
     *
     * @return a future completing with the element, with {@code null} once the subscription
     *         ended normally, or failing with the error that ended it. Fails with
     *         {@link IllegalStateException} if another call is still outstanding or the
     *         subscription is consumed as a stream.
     */
    public Future<E> next() {
        Promise<E> promise = Promise.promise();
        synchronized (this) {
            if (mode == Mode.PUSH) {
                return Future.failedFuture(new IllegalStateException(
                    "Subscription on channel " + channel + " is consumed through a handler"));
            }
            if (pendingNext != null) {
                return Future.failedFuture(new IllegalStateException(
                    "A next() call is already outstanding on channel " + channel));
            }
            mode = Mode.PULL;
            pendingNext = promise;
        }
        drain();
        return promise.future();
    }

    @Override
    public NotificationSubscription<E> handler(Handler<E> handler) {
        synchronized (this) {
            if (handler != null && mode == Mode.PULL) {
                throw new IllegalStateException("Subscription on channel " + channel + " is consumed through next()");
            }
            dataHandler = handler;
            if (handler != null) {
                mode = Mode.PUSH;
            }
        }
        drain();
        return this;
    }

    @Override
    public NotificationSubscription<E> exceptionHandler(Handler<Throwable> handler) {
        synchronized (this) {
            exceptionHandler = handler;
        }
        drain();
        return this;
    }

    @Override
    public NotificationSubscription<E> endHandler(Handler<Void> handler) {
        synchronized (this) {
            endHandler = handler;
        }
        drain();
        return this;
    }

    @Override
    public NotificationSubscription<E> pause() {
        synchronized (this) {
            demand = 0L;
        }
        return this;
    }

    @Override
    public NotificationSubscription<E> resume() {
        return fetch(Long.MAX_VALUE);
    }

    @Override
    public NotificationSubscription<E> fetch(long amount) {
        if (amount < 0L) {
            throw new IllegalArgumentException("Negative fetch amount: " + amount);
        }
        synchronized (this) {
            demand += amount;
            if (demand < 0L) {
                demand = Long.MAX_VALUE;
            }
        }
        drain();
        return this;
    }

    /**
     * Ends the subscription, discarding buffered notifications.
     *
     * @return a future completing once the dedicated connection has been released
     */
    public Future<Void> cancel() {
        logger.debug("Cancelling subscription on channel {}", channel);
        return terminate(null, false, true);
    }

    /**
     * Fire-once readiness signal, completed when LISTEN was acknowledged.
     */
    public Future<Void> ready() {
        return readiness.future();
    }

    /**
     * Completes after cleanup has released the connection, however the subscription ended.
     */
    public Future<Void> termination() {
        return termination.future();
    }

    public SubscriptionState state() {
        return state;
    }

    public ChannelName channel() {
        return channel;
    }

    /**
     * Notifications discarded because the buffer was full.
     */
    public long droppedCount() {
        return dropped.get();
    }

    public synchronized int bufferedCount() {
        return buffer.size();
    }

    private void onNotification(RawNotification raw) {
        boolean overflow;
        synchronized (this) {
            if (inputEnded) {
                return;
            }
            overflow = buffer.size() >= capacity;
            if (overflow) {
                buffer.pollFirst();
            }
            buffer.addLast(raw);
        }
        metrics.notificationReceived(channel.value());
        if (overflow) {
            long total = dropped.incrementAndGet();
            metrics.notificationDropped(channel.value());
            if (total == 1 || total % 100 == 0) {
                logger.warn("Buffer for channel {} is full ({} entries), {} notifications dropped so far",
                    channel, capacity, total);
            }
        }
        drain();
    }

    private void onConnectionClosed() {
        if (cleanupStarted.get()) {
            // closed by our own release
            logger.debug("Connection for channel {} closed after cleanup", channel);
            return;
        }
        logger.info("Connection for channel {} closed, ending subscription", channel);
        terminate(null, true, false);
    }

    private void onConnectionError(Throwable error) {
        terminate(new NotificationConnectionException(
            "Listener connection for channel " + channel + " failed: " + error.getMessage(), error), false, false);
    }

    private Future<Void> terminate(Throwable error, boolean skipUnlisten, boolean discardBuffered) {
        if (!cleanupStarted.compareAndSet(false, true)) {
            return termination.future();
        }

        ListenerConnection conn;
        NotificationRegistration reg;
        boolean wasOpened;
        Throwable streamError;
        synchronized (this) {
            state = SubscriptionState.DRAINING;
            inputEnded = true;
            if (error != null && terminalError == null) {
                terminalError = error;
            }
            if (discardBuffered) {
                buffer.clear();
            }
            conn = connection;
            reg = registration;
            wasOpened = opened;
            streamError = terminalError;
        }

        readiness.tryFail(streamError != null ? streamError
            : new NotificationConnectionException("Subscription on channel " + channel + " ended before it was active"));
        drain();

        if (reg != null) {
            reg.stop();
        }

        Future<Void> unlisten = (conn == null || skipUnlisten || conn.isClosed())
            ? Future.succeededFuture()
            : conn.execute("UNLISTEN " + channel.quoted());

        unlisten
            .transform(ar -> {
                Throwable cleanupError = ar.failed() ? new NotificationCleanupException(channel.value(), ar.cause()) : null;
                Future<Void> released = conn == null ? Future.succeededFuture() : connectionSource.release(conn);
                return released.transform(r -> {
                    if (r.failed()) {
                        logger.warn("Releasing connection for channel {} failed: {}", channel, r.cause().getMessage());
                    }
                    return Future.succeededFuture(cleanupError);
                });
            })
            .onComplete(ar -> finishTermination(streamError, ar.result(), wasOpened));

        return termination.future();
    }

    private void finishTermination(Throwable streamError, Throwable cleanupError, boolean wasOpened) {
        state = streamError != null ? SubscriptionState.FAILED : SubscriptionState.TERMINATED;
        if (wasOpened) {
            metrics.subscriptionClosed(channel.value());
        }
        if (cleanupError != null) {
            metrics.cleanupFailed(channel.value());
            logger.warn("UNLISTEN on channel {} failed: {}", channel, cleanupError.getCause().getMessage());
            if (streamError != null) {
                streamError.addSuppressed(cleanupError);
            }
            termination.tryFail(cleanupError);
        } else {
            termination.tryComplete();
        }
        logger.debug("Subscription on channel {} {}", channel, state);
    }

    private synchronized Throwable streamError() {
        return terminalError;
    }

    private void drain() {
        synchronized (this) {
            if (draining) {
                return;
            }
            draining = true;
        }
        for (;;) {
            Runnable action;
            synchronized (this) {
                action = nextAction();
                if (action == null) {
                    draining = false;
                    return;
                }
            }
            try {
                action.run();
            } catch (RuntimeException e) {
                logger.error("Unexpected error delivering on channel {}", channel, e);
            }
        }
    }

    /**
     * Decides the next delivery step. Called with the lock held; the returned action runs
     * without it.
     */
    private Runnable nextAction() {
        if (mode == Mode.PULL) {
            if (pendingNext == null) {
                return null;
            }
            Promise<E> promise = pendingNext;
            while (!buffer.isEmpty()) {
                RawNotification raw = buffer.pollFirst();
                E value;
                try {
                    value = decode(raw);
                } catch (PayloadDecodingException e) {
                    if (decodeFailurePolicy == DecodeFailurePolicy.SKIP) {
                        continue;
                    }
                    pendingNext = null;
                    endOnDecodeFailure(e);
                    return () -> {
                        promise.fail(e);
                        terminate(e, false, true);
                    };
                }
                pendingNext = null;
                return () -> promise.complete(value);
            }
            if (inputEnded) {
                pendingNext = null;
                Throwable error = terminalError;
                return error != null ? () -> promise.fail(error) : () -> promise.complete(null);
            }
            return null;
        }

        if (mode == Mode.PUSH) {
            Handler<E> handler = dataHandler;
            while (handler != null && demand > 0L && !buffer.isEmpty()) {
                RawNotification raw = buffer.pollFirst();
                E value;
                try {
                    value = decode(raw);
                } catch (PayloadDecodingException e) {
                    if (decodeFailurePolicy == DecodeFailurePolicy.SKIP) {
                        continue;
                    }
                    endOnDecodeFailure(e);
                    return () -> terminate(e, false, true);
                }
                if (demand != Long.MAX_VALUE) {
                    demand--;
                }
                return () -> emit(handler, value);
            }
            if (buffer.isEmpty() && inputEnded && !endEmitted) {
                Throwable error = terminalError;
                if (error != null && exceptionHandler != null) {
                    endEmitted = true;
                    Handler<Throwable> onError = exceptionHandler;
                    return () -> onError.handle(error);
                }
                if (error == null && endHandler != null) {
                    endEmitted = true;
                    Handler<Void> onEnd = endHandler;
                    return () -> onEnd.handle(null);
                }
            }
        }
        return null;
    }

    private void endOnDecodeFailure(PayloadDecodingException error) {
        if (terminalError == null) {
            terminalError = error;
        }
        inputEnded = true;
        buffer.clear();
    }

    private E decode(RawNotification raw) {
        E value;
        try {
            value = decoder.apply(raw);
        } catch (PayloadDecodingException e) {
            onDecodeFailure(e);
            throw e;
        } catch (RuntimeException e) {
            PayloadDecodingException wrapped = new PayloadDecodingException(elementTypeName, raw.payload(), e);
            onDecodeFailure(wrapped);
            throw wrapped;
        }
        if (value == null) {
            // null is reserved for the end of the stream
            PayloadDecodingException nullPayload = new PayloadDecodingException(elementTypeName, raw.payload(),
                new IllegalArgumentException("null payload"));
            onDecodeFailure(nullPayload);
            throw nullPayload;
        }
        return value;
    }

    private void onDecodeFailure(PayloadDecodingException error) {
        metrics.decodeFailed(channel.value());
        if (decodeFailurePolicy == DecodeFailurePolicy.SKIP) {
            logger.warn("Skipping undecodable notification on channel {}: {}", channel, error.getMessage());
        } else {
            logger.error("Undecodable notification on channel {}, ending subscription: {}", channel, error.getMessage());
        }
    }

    private void emit(Handler<E> handler, E value) {
        try {
            handler.handle(value);
        } catch (RuntimeException e) {
            logger.error("Handler for channel {} threw, ending subscription", channel, e);
            terminate(e, false, true);
        }
    }

    @Override
    public String toString() {
        return "NotificationSubscription{channel=" + channel + ", state=" + state + ", dropped=" + dropped.get() + '}';
    }
}

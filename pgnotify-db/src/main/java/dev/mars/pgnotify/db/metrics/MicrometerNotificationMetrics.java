package dev.mars.pgnotify.db.metrics;

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

import dev.mars.pgnotify.api.metrics.NotificationMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of NotificationMetrics.
 *
 * <p>Counters are tagged by channel; the two gauges track live subscriptions and the
 * dedicated connections currently checked out.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class MicrometerNotificationMetrics implements NotificationMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger activeSubscriptions = new AtomicInteger();
    private final AtomicInteger heldConnections = new AtomicInteger();

    public MicrometerNotificationMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        Gauge.builder("pgnotify.subscriptions.active", activeSubscriptions, AtomicInteger::get)
            .description("Number of live notification subscriptions")
            .register(registry);
        Gauge.builder("pgnotify.connections.dedicated", heldConnections, AtomicInteger::get)
            .description("Number of dedicated listener connections currently held")
            .register(registry);
    }

    @Override
    public void notificationReceived(String channel) {
        counter("pgnotify.notifications.received", "Notifications delivered by the database", channel).increment();
    }

    @Override
    public void notificationDropped(String channel) {
        counter("pgnotify.notifications.dropped", "Notifications dropped on buffer overflow", channel).increment();
    }

    @Override
    public void decodeFailed(String channel) {
        counter("pgnotify.notifications.decode.failed", "Payloads that failed to decode", channel).increment();
    }

    @Override
    public void notificationPublished(String channel) {
        counter("pgnotify.notifications.published", "Notifications published", channel).increment();
    }

    @Override
    public void cleanupFailed(String channel) {
        counter("pgnotify.subscriptions.cleanup.failed", "UNLISTEN failures during teardown", channel).increment();
    }

    @Override
    public void subscriptionOpened(String channel) {
        activeSubscriptions.incrementAndGet();
        counter("pgnotify.subscriptions.opened", "Subscriptions that reached the active state", channel).increment();
    }

    @Override
    public void subscriptionClosed(String channel) {
        activeSubscriptions.decrementAndGet();
    }

    @Override
    public void dedicatedConnectionAcquired() {
        heldConnections.incrementAndGet();
    }

    @Override
    public void dedicatedConnectionReleased() {
        heldConnections.decrementAndGet();
    }

    private Counter counter(String name, String description, String channel) {
        return Counter.builder(name)
            .description(description)
            .tag("channel", channel != null ? channel : "unknown")
            .register(registry);
    }
}

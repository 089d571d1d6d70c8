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

/**
 * No-op implementation of NotificationMetrics, used when no MeterRegistry is configured.
 */
public final class NoOpNotificationMetrics implements NotificationMetrics {

    public static final NoOpNotificationMetrics INSTANCE = new NoOpNotificationMetrics();

    private NoOpNotificationMetrics() {
    }

    @Override
    public void notificationReceived(String channel) {
    }

    @Override
    public void notificationDropped(String channel) {
    }

    @Override
    public void decodeFailed(String channel) {
    }

    @Override
    public void notificationPublished(String channel) {
    }

    @Override
    public void cleanupFailed(String channel) {
    }

    @Override
    public void subscriptionOpened(String channel) {
    }

    @Override
    public void subscriptionClosed(String channel) {
    }

    @Override
    public void dedicatedConnectionAcquired() {
    }

    @Override
    public void dedicatedConnectionReleased() {
    }
}

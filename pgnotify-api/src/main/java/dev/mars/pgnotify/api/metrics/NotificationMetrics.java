package dev.mars.pgnotify.api.metrics;

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

/**
 * Metrics hooks for the notification layer.
 *
 * <p>Implementations must be cheap and non-blocking; they are invoked from the
 * connection's delivery callback.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface NotificationMetrics {

    void notificationReceived(String channel);

    void notificationDropped(String channel);

    void decodeFailed(String channel);

    void notificationPublished(String channel);

    void cleanupFailed(String channel);

    void subscriptionOpened(String channel);

    void subscriptionClosed(String channel);

    void dedicatedConnectionAcquired();

    void dedicatedConnectionReleased();
}

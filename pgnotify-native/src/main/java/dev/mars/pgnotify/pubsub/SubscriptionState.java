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

/**
 * Lifecycle of a {@link NotificationSubscription}.
 *
 * <pre>
 * REQUESTED -> CONNECTION_ACQUIRED -> ACTIVE -> DRAINING -> TERMINATED
 *      \______________\______________________________________-> FAILED
 * </pre>
 */
public enum SubscriptionState {
    /** Created, no connection yet. */
    REQUESTED,
    /** Dedicated connection held, callback registered, LISTEN not yet acknowledged. */
    CONNECTION_ACQUIRED,
    /** LISTEN acknowledged; notifications are buffered for the consumer. */
    ACTIVE,
    /** Termination started; cleanup is running. */
    DRAINING,
    /** Cleanup finished after cancellation or connection closure. */
    TERMINATED,
    /** Subscribe failed, or the subscription ended because of an error. */
    FAILED;

    public boolean isTerminal() {
        return this == TERMINATED || this == FAILED;
    }
}

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

/**
 * A dedicated, long-lived connection able to receive notifications.
 *
 * <p>Delivery is push based: callbacks registered with {@link #onNotification} are invoked
 * on the connection's event loop for every notification received on that channel.
 * Callbacks must return immediately; a blocking callback stalls delivery for every
 * channel on the connection.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface ListenerConnection extends SqlExecutor {

    /**
     * Registers a delivery callback for a channel. Register before issuing LISTEN so a
     * notification arriving right after LISTEN is acknowledged has somewhere to go.
     */
    NotificationRegistration onNotification(ChannelName channel, Handler<RawNotification> handler);

    /**
     * Sets the handler invoked once when the connection is closed, by either side.
     */
    ListenerConnection closeHandler(Handler<Void> handler);

    /**
     * Sets the handler invoked when the connection reports an error.
     */
    ListenerConnection exceptionHandler(Handler<Throwable> handler);

    boolean isClosed();

    /**
     * @return the backend process id serving this connection
     */
    int processId();

    /**
     * Physically closes the connection. Callers normally go through
     * {@link DedicatedConnectionSource#release(ListenerConnection)} instead.
     */
    Future<Void> close();
}

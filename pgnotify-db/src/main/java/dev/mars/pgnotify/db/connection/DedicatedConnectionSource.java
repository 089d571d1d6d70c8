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

import dev.mars.pgnotify.api.error.NotificationsNotSupportedException;
import io.vertx.core.Future;

/**
 * Source of dedicated listener connections, distinct from the query pool.
 *
 * <p>A connection checked out here belongs to exactly one subscription for that
 * subscription's whole lifetime and is handed back through {@link #release}.
 * Instances are constructed explicitly and passed to whoever needs them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface DedicatedConnectionSource extends AutoCloseable {

    /**
     * Checks out a dedicated connection.
     *
     * @return a future failing with a NotificationConnectionException when the source is
     *         exhausted, closed or cannot connect
     */
    Future<ListenerConnection> acquire();

    /**
     * Gives a connection back. Releasing a connection that is not checked out is a no-op.
     */
    Future<Void> release(ListenerConnection connection);

    /**
     * @return number of connections currently checked out
     */
    int activeConnections();

    /**
     * @return false when this source cannot provide long-lived connections at all
     */
    default boolean supportsDedicatedConnections() {
        return true;
    }

    Future<Void> start();

    @Override
    void close();

    /**
     * A source that refuses every request, for deployments where only pooled
     * connections are available.
     *
     * @param reason explanation carried by the NotificationsNotSupportedException
     */
    static DedicatedConnectionSource unsupported(String reason) {
        return new DedicatedConnectionSource() {
            @Override
            public Future<ListenerConnection> acquire() {
                return Future.failedFuture(new NotificationsNotSupportedException(reason));
            }

            @Override
            public Future<Void> release(ListenerConnection connection) {
                return Future.succeededFuture();
            }

            @Override
            public int activeConnections() {
                return 0;
            }

            @Override
            public boolean supportsDedicatedConnections() {
                return false;
            }

            @Override
            public Future<Void> start() {
                return Future.succeededFuture();
            }

            @Override
            public void close() {
            }
        };
    }
}

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

import io.vertx.pgclient.PgConnectOptions;

/**
 * Supplies the options used to open each listener connection.
 *
 * <p>Queried on every acquire, so an implementation may rotate credentials or hosts.
 * A {@code null} result means the backing store cannot open standalone connections,
 * which makes subscribing fail with
 * {@link dev.mars.pgnotify.api.error.NotificationsNotSupportedException}.
 */
@FunctionalInterface
public interface ConnectOptionsProvider {

    PgConnectOptions getConnectOptions();
}

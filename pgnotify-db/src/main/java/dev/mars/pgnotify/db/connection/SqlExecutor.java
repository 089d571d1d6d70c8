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

import io.vertx.core.Future;
import io.vertx.sqlclient.SqlClient;

import java.util.Objects;

/**
 * Fire-and-forget statement execution.
 *
 * <p>Used for LISTEN / UNLISTEN / NOTIFY and for provisioning DDL. Any Vert.x
 * {@link SqlClient} can be adapted, which includes a pool (autocommit) and a
 * connection taken inside {@code Pool.withTransaction} (statement joins the transaction).
 */
@FunctionalInterface
public interface SqlExecutor {

    /**
     * Executes a single statement.
     *
     * @param sql statement text; identifiers must already be validated and quoted
     * @return a future completing when the database acknowledged the statement
     */
    Future<Void> execute(String sql);

    static SqlExecutor of(SqlClient client) {
        Objects.requireNonNull(client, "client");
        return sql -> client.query(sql).execute().mapEmpty();
    }
}

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

import dev.mars.pgnotify.db.config.PgConnectionConfig;
import dev.mars.pgnotify.db.config.PgPoolConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgBuilder;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Owns the general-purpose query pools used for publishing and provisioning.
 *
 * <p>Pools are keyed by a service id so that several databases can be addressed from one
 * process; a null or blank id means {@link #DEFAULT_POOL_ID}. Listener connections never
 * come from these pools, see {@link PgDedicatedConnectionSource}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgConnectionManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgConnectionManager.class);

    public static final String DEFAULT_POOL_ID = "default";

    private final Vertx vertx;
    private final MeterRegistry meter;
    private final Map<String, Pool> pools = new ConcurrentHashMap<>();

    public PgConnectionManager(Vertx vertx) {
        this(vertx, null);
    }

    public PgConnectionManager(Vertx vertx, MeterRegistry meter) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.meter = meter;
        logger.info("Initialized PgConnectionManager");
    }

    /**
     * Creates or retrieves the pool for a service.
     *
     * @param serviceId service id, or null for the default pool
     * @param connectionConfig PostgreSQL connection configuration
     * @param poolConfig pool sizing
     * @return the pool registered under the id
     */
    public Pool getOrCreatePool(String serviceId, PgConnectionConfig connectionConfig, PgPoolConfig poolConfig) {
        Objects.requireNonNull(connectionConfig, "connectionConfig");
        Objects.requireNonNull(poolConfig, "poolConfig");
        String resolvedId = resolveServiceId(serviceId);

        return pools.computeIfAbsent(resolvedId, id -> {
            try {
                Pool pool = createPool(connectionConfig, poolConfig);
                logger.info("Created query pool for service '{}' ({}:{}/{})", id,
                    connectionConfig.getHost(), connectionConfig.getPort(), connectionConfig.getDatabase());
                increment("pgnotify.db.pool.created", id);
                return pool;
            } catch (RuntimeException e) {
                logger.error("Failed to create pool for {}: {}", id, e.getMessage());
                increment("pgnotify.db.pool.create.failed", id);
                throw e;
            }
        });
    }

    /**
     * @return the existing pool, or null when none was created for the id
     */
    public Pool getExistingPool(String serviceId) {
        return pools.get(resolveServiceId(serviceId));
    }

    public <T> Future<T> withConnection(String serviceId, Function<SqlConnection, Future<T>> operation) {
        Pool pool = pools.get(resolveServiceId(serviceId));
        if (pool == null) {
            return Future.failedFuture(new IllegalStateException("No pool found for service: " + resolveServiceId(serviceId)));
        }
        return pool.withConnection(operation);
    }

    /**
     * Runs the operation inside a transaction. Notifications issued through the supplied
     * connection are delivered only if the transaction commits.
     */
    public <T> Future<T> withTransaction(String serviceId, Function<SqlConnection, Future<T>> operation) {
        Pool pool = pools.get(resolveServiceId(serviceId));
        if (pool == null) {
            return Future.failedFuture(new IllegalStateException("No pool found for service: " + resolveServiceId(serviceId)));
        }
        return pool.withTransaction(operation);
    }

    /**
     * Performs a {@code SELECT 1} round trip on the service's pool.
     *
     * @return a future completing with false when the pool is missing or unreachable
     */
    public Future<Boolean> checkHealth(String serviceId) {
        String resolvedId = resolveServiceId(serviceId);
        if (!pools.containsKey(resolvedId)) {
            return Future.succeededFuture(false);
        }
        return withConnection(resolvedId, conn -> conn.query("SELECT 1").execute().map(rs -> true))
            .recover(err -> {
                logger.warn("Health check failed for {}: {}", resolvedId, err.getMessage());
                return Future.succeededFuture(false);
            });
    }

    public Future<Void> closePoolAsync(String serviceId) {
        String resolvedId = resolveServiceId(serviceId);
        Pool pool = pools.remove(resolvedId);
        if (pool == null) {
            logger.debug("No pool found for service: {}", resolvedId);
            return Future.succeededFuture();
        }
        return pool.close()
            .onSuccess(v -> {
                logger.debug("Closed pool for service: {}", resolvedId);
                increment("pgnotify.db.pool.closed", resolvedId);
            })
            .onFailure(err -> logger.warn("Error closing pool for service {}: {}", resolvedId, err.getMessage()));
    }

    public Future<Void> closeAsync() {
        List<Future<Void>> closing = new ArrayList<>();
        for (String id : new ArrayList<>(pools.keySet())) {
            closing.add(closePoolAsync(id));
        }
        return Future.all(closing).mapEmpty();
    }

    @Override
    public void close() {
        closeAsync();
    }

    private Pool createPool(PgConnectionConfig connectionConfig, PgPoolConfig poolConfig) {
        Objects.requireNonNull(connectionConfig.getHost(), "host");
        Objects.requireNonNull(connectionConfig.getDatabase(), "database");
        Objects.requireNonNull(connectionConfig.getUsername(), "username");

        PoolOptions poolOptions = new PoolOptions()
            .setMaxSize(poolConfig.getMaxSize())
            .setMaxWaitQueueSize(poolConfig.getMaxWaitQueueSize())
            .setConnectionTimeout((int) poolConfig.getConnectionTimeout().toSeconds())
            .setConnectionTimeoutUnit(TimeUnit.SECONDS)
            .setIdleTimeout((int) poolConfig.getIdleTimeout().toSeconds())
            .setIdleTimeoutUnit(TimeUnit.SECONDS)
            .setShared(poolConfig.isShared());

        return PgBuilder.pool()
            .with(poolOptions)
            .connectingTo(connectionConfig.toConnectOptions())
            .using(vertx)
            .build();
    }

    private String resolveServiceId(String serviceId) {
        return (serviceId == null || serviceId.isBlank()) ? DEFAULT_POOL_ID : serviceId;
    }

    private void increment(String name, String serviceId) {
        if (meter != null) {
            Counter.builder(name).tag("service", serviceId).register(meter).increment();
        }
    }
}

package dev.mars.pgnotify.db.setup;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.pgnotify.api.RawNotification;
import dev.mars.pgnotify.api.identifier.ChannelName;
import dev.mars.pgnotify.api.identifier.TableName;
import dev.mars.pgnotify.db.config.NotificationPoolConfig;
import dev.mars.pgnotify.db.config.PgConnectionConfig;
import dev.mars.pgnotify.db.config.PgPoolConfig;
import dev.mars.pgnotify.db.connection.ListenerConnection;
import dev.mars.pgnotify.db.connection.PgConnectionManager;
import dev.mars.pgnotify.db.connection.PgDedicatedConnectionSource;
import dev.mars.pgnotify.db.connection.SqlExecutor;
import dev.mars.pgnotify.test.PostgreSQLTestConstants;
import dev.mars.pgnotify.test.categories.TestCategories;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Pool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.EnumSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Provisioned triggers emitting real notifications on row changes.
 */
@Tag(TestCategories.INTEGRATION)
@Testcontainers
class NotificationSetupServiceIntegrationTest {
    private static final Logger logger = LoggerFactory.getLogger(NotificationSetupServiceIntegrationTest.class);

    @Container
    static PostgreSQLContainer<?> postgres = PostgreSQLTestConstants.createStandardContainer();

    private final ObjectMapper mapper = new ObjectMapper();

    private Vertx vertx;
    private PgConnectionManager connectionManager;
    private PgDedicatedConnectionSource source;
    private Pool pool;
    private NotificationSetupService setup;

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        PgConnectionConfig connectionConfig = new PgConnectionConfig.Builder()
            .host(postgres.getHost())
            .port(postgres.getFirstMappedPort())
            .database(postgres.getDatabaseName())
            .username(postgres.getUsername())
            .password(postgres.getPassword())
            .build();
        connectionManager = new PgConnectionManager(vertx);
        pool = connectionManager.getOrCreatePool(null, connectionConfig, PgPoolConfig.defaults());
        source = new PgDedicatedConnectionSource(vertx, connectionConfig::toConnectOptions, NotificationPoolConfig.defaults());
        setup = new NotificationSetupService(SqlExecutor.of(pool));

        await(pool.query("DROP TABLE IF EXISTS orders").execute());
        await(pool.query("CREATE TABLE orders (id INT PRIMARY KEY, status TEXT NOT NULL)").execute());
    }

    @AfterEach
    void tearDown() throws Exception {
        source.close();
        await(connectionManager.closeAsync());
        await(vertx.close());
    }

    @Test
    void testInsertUpdateDeleteEmitOperationAndRows() throws Exception {
        TableName orders = TableName.of("orders");
        ChannelName channel = await(setup.setupChannel(orders, ChannelName.forTable(orders)));
        BlockingQueue<RawNotification> received = listen(channel);

        await(pool.query("INSERT INTO orders VALUES (1, 'new')").execute());
        await(pool.query("UPDATE orders SET status = 'shipped' WHERE id = 1").execute());
        await(pool.query("DELETE FROM orders WHERE id = 1").execute());

        JsonNode insert = next(received);
        assertEquals("INSERT", insert.get("operation").asText());
        assertEquals("new", insert.get("new").get("status").asText());
        assertFalse(insert.has("old"));

        JsonNode update = next(received);
        assertEquals("UPDATE", update.get("operation").asText());
        assertEquals("shipped", update.get("new").get("status").asText());

        JsonNode delete = next(received);
        assertEquals("DELETE", delete.get("operation").asText());
        assertTrue(delete.get("new").isNull());
    }

    @Test
    void testOldValuesAreIncludedOnRequest() throws Exception {
        TableName orders = TableName.of("orders");
        ChannelName channel = ChannelName.of("orders-audit");
        await(setup.setupChannel(orders, channel, EnumSet.of(TriggerEvent.UPDATE), true, TriggerTiming.AFTER));
        BlockingQueue<RawNotification> received = listen(channel);

        await(pool.query("INSERT INTO orders VALUES (2, 'new')").execute());
        await(pool.query("UPDATE orders SET status = 'paid' WHERE id = 2").execute());

        JsonNode update = next(received);
        assertEquals("UPDATE", update.get("operation").asText());
        assertEquals("new", update.get("old").get("status").asText());
        assertEquals("paid", update.get("new").get("status").asText());
        assertNull(received.poll(300, TimeUnit.MILLISECONDS), "insert is not a configured event");
    }

    @Test
    void testSetupIsRepeatableAndRemoveStopsNotifications() throws Exception {
        TableName orders = TableName.of("orders");
        ChannelName channel = ChannelName.of("repeat");
        await(setup.setupChannel(orders, channel));
        await(setup.setupChannel(orders, channel));
        BlockingQueue<RawNotification> received = listen(channel);

        await(pool.query("INSERT INTO orders VALUES (3, 'x')").execute());
        assertNotNull(received.poll(10, TimeUnit.SECONDS));
        assertNull(received.poll(300, TimeUnit.MILLISECONDS), "re-running setup must not leave two triggers");

        await(setup.removeChannel(orders, channel));
        await(setup.removeChannel(orders, channel));
        await(pool.query("INSERT INTO orders VALUES (4, 'y')").execute());
        assertNull(received.poll(500, TimeUnit.MILLISECONDS));
    }

    private BlockingQueue<RawNotification> listen(ChannelName channel) throws Exception {
        BlockingQueue<RawNotification> received = new LinkedBlockingQueue<>();
        ListenerConnection listener = await(source.acquire());
        listener.onNotification(channel, received::add);
        await(listener.execute("LISTEN " + channel.quoted()));
        return received;
    }

    private JsonNode next(BlockingQueue<RawNotification> received) throws Exception {
        RawNotification notification = received.poll(10, TimeUnit.SECONDS);
        assertNotNull(notification, "expected a notification");
        logger.debug("Received {}", notification.payload());
        return mapper.readTree(notification.payload());
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
    }
}

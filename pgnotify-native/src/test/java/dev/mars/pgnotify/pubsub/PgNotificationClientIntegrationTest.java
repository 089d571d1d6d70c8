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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.pgnotify.api.ChannelDescriptor;
import dev.mars.pgnotify.api.NotificationEvent;
import dev.mars.pgnotify.api.RawNotification;
import dev.mars.pgnotify.api.codec.JacksonPayloadCodec;
import dev.mars.pgnotify.api.error.PayloadDecodingException;
import dev.mars.pgnotify.api.error.PayloadTooLargeException;
import dev.mars.pgnotify.api.identifier.ChannelName;
import dev.mars.pgnotify.api.identifier.TableName;
import dev.mars.pgnotify.db.config.NotificationPoolConfig;
import dev.mars.pgnotify.db.config.PgConnectionConfig;
import dev.mars.pgnotify.db.config.PgNotifyConfiguration;
import dev.mars.pgnotify.db.config.PgPoolConfig;
import dev.mars.pgnotify.db.connection.PgConnectionManager;
import dev.mars.pgnotify.db.connection.PgDedicatedConnectionSource;
import dev.mars.pgnotify.db.connection.SqlExecutor;
import dev.mars.pgnotify.db.metrics.MicrometerNotificationMetrics;
import dev.mars.pgnotify.db.setup.NotificationSetupService;
import dev.mars.pgnotify.db.setup.TriggerTiming;
import dev.mars.pgnotify.test.PostgreSQLTestConstants;
import dev.mars.pgnotify.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.sqlclient.Pool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Publish and subscribe end to end against a real PostgreSQL.
 */
@Tag(TestCategories.INTEGRATION)
@Testcontainers
@ExtendWith(VertxExtension.class)
class PgNotificationClientIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = PostgreSQLTestConstants.createStandardContainer();

    public static class Order {
        public int id;
        public String status;

        public Order() {
        }

        Order(int id, String status) {
            this.id = id;
            this.status = status;
        }
    }

    public static class RowChange {
        public String operation;
        @JsonProperty("new")
        public JsonNode newRow;
    }

    private static final ChannelDescriptor<Order> ORDERS = ChannelDescriptor.of("orders", Order.class);

    private Vertx vertx;
    private PgConnectionManager connectionManager;
    private Pool pool;
    private PgDedicatedConnectionSource source;
    private SimpleMeterRegistry registry;
    private PgNotificationClient client;

    @BeforeEach
    void setUp(Vertx vertx) {
        this.vertx = vertx;
        PgConnectionConfig connectionConfig = new PgConnectionConfig.Builder()
            .host(postgres.getHost())
            .port(postgres.getFirstMappedPort())
            .database(postgres.getDatabaseName())
            .username(postgres.getUsername())
            .password(postgres.getPassword())
            .applicationName("pgnotify-native-it")
            .build();
        registry = new SimpleMeterRegistry();
        MicrometerNotificationMetrics metrics = new MicrometerNotificationMetrics(registry);
        NotificationPoolConfig notificationConfig = new NotificationPoolConfig.Builder().maxConnections(8).build();

        connectionManager = new PgConnectionManager(vertx, registry);
        pool = connectionManager.getOrCreatePool(null, connectionConfig, PgPoolConfig.defaults());
        source = new PgDedicatedConnectionSource(vertx, connectionConfig::toConnectOptions, notificationConfig, metrics);
        source.start();
        client = new PgNotificationClient(source, pool, new JacksonPayloadCodec(), notificationConfig, metrics);
    }

    @AfterEach
    void tearDown() {
        source.close();
        connectionManager.close();
    }

    @Test
    void testPublishedOrderIsReceived() throws Exception {
        NotificationSubscription<Order> subscription = await(client.subscribe(ORDERS));

        await(client.publish(ORDERS, new Order(1, "shipped")));

        Order received = await(subscription.next());
        assertEquals(1, received.id);
        assertEquals("shipped", received.status);
        await(subscription.cancel());
    }

    @Test
    void testEverySubscriberReceivesBroadcast() throws Exception {
        NotificationSubscription<Order> first = await(client.subscribe(ORDERS));
        NotificationSubscription<Order> second = await(client.subscribe(ORDERS));
        NotificationSubscription<Order> third = await(client.subscribe(ORDERS));

        await(client.publish(ORDERS, new Order(2, "paid")));

        for (NotificationSubscription<Order> subscription : List.of(first, second, third)) {
            assertEquals(2, await(subscription.next()).id);
            await(subscription.cancel());
        }
    }

    @Test
    void testPublishAfterReadinessIsNeverLost() throws Exception {
        for (int trial = 0; trial < 20; trial++) {
            NotificationSubscription<Order> subscription = await(client.subscribe(ORDERS));
            await(subscription.ready());

            await(client.publish(ORDERS, new Order(trial, "ready")));

            assertEquals(trial, await(subscription.next()).id, "trial " + trial);
            await(subscription.cancel());
        }
    }

    @Test
    void testNotificationsArriveInPublishOrder() throws Exception {
        NotificationSubscription<Order> subscription = await(client.subscribe(ORDERS));

        for (int i = 0; i < 50; i++) {
            await(client.publish(ORDERS, new Order(i, "queued")));
        }

        for (int i = 0; i < 50; i++) {
            assertEquals(i, await(subscription.next()).id);
        }
        await(subscription.cancel());
    }

    @Test
    void testChannelsAreIsolated() throws Exception {
        ChannelDescriptor<Order> invoices = ChannelDescriptor.of("invoices", Order.class);
        NotificationSubscription<Order> orders = await(client.subscribe(ORDERS));
        NotificationSubscription<Order> invoiceSubscription = await(client.subscribe(invoices));

        await(client.publish(invoices, new Order(10, "invoiced")));
        await(client.publish(ORDERS, new Order(11, "ordered")));

        assertEquals(11, await(orders.next()).id, "orders must not see the invoice");
        assertEquals(10, await(invoiceSubscription.next()).id);
        await(orders.cancel());
        await(invoiceSubscription.cancel());
    }

    @Test
    void testSubscribeCancelCyclesReturnToBaseline() throws Exception {
        int baseline = client.activeSubscriptions();

        for (int i = 0; i < 30; i++) {
            NotificationSubscription<Order> subscription = await(client.subscribe(ORDERS));
            assertEquals(baseline + 1, client.activeSubscriptions());
            await(subscription.cancel());
        }

        assertEquals(baseline, client.activeSubscriptions());
        assertEquals(0.0, registry.get("pgnotify.subscriptions.active").gauge().value());
    }

    @Test
    void testOnlyCommittedNotificationsAreDelivered() throws Exception {
        NotificationSubscription<Order> subscription = await(client.subscribe(ORDERS));
        NotificationPublisher publisher = client.publisher();

        Future<Void> rolledBack = connectionManager.withTransaction(null, conn ->
            publisher.publish(conn, ORDERS, new Order(1, "rolled back"))
                .compose(v -> Future.<Void>failedFuture(new IllegalStateException("abort"))));
        assertThrows(ExecutionException.class, () -> await(rolledBack));

        await(connectionManager.withTransaction(null, conn ->
            publisher.publish(conn, ORDERS, new Order(2, "committed"))));

        // the committed notification is the first and only one
        assertEquals(2, await(subscription.next()).id);
        assertThrows(TimeoutException.class, () -> awaitWithin(subscription.next(), 500));
        await(subscription.cancel());
    }

    @Test
    void testMalformedPayloadEndsOnlyThatSubscription() throws Exception {
        NotificationSubscription<Order> typed = await(client.subscribe(ORDERS));
        NotificationSubscription<RawNotification> raw = await(client.subscribeRaw(ORDERS.name()));
        ChannelDescriptor<Order> other = ChannelDescriptor.of("other_orders", Order.class);
        NotificationSubscription<Order> unrelated = await(client.subscribe(other));

        await(client.publisher().publishRaw(ORDERS.name(), "{\"id\": \"not a number\""));

        ExecutionException error = assertThrows(ExecutionException.class, () -> await(typed.next()));
        assertInstanceOf(PayloadDecodingException.class, error.getCause());
        await(typed.termination());
        assertEquals(SubscriptionState.FAILED, typed.state());

        assertEquals("{\"id\": \"not a number\"", await(raw.next()).payload());
        await(client.publish(other, new Order(5, "fine")));
        assertEquals(5, await(unrelated.next()).id);
        assertEquals(SubscriptionState.ACTIVE, unrelated.state());

        await(raw.cancel());
        await(unrelated.cancel());
    }

    @Test
    void testEventCarriesPublisherBackend() throws Exception {
        NotificationSubscription<NotificationEvent<Order>> subscription = await(client.subscribeEvents(ORDERS));

        int publisherPid = await(connectionManager.withConnection(null, conn ->
            conn.query("SELECT pg_backend_pid() AS pid").execute()
                .compose(rows -> client.publisher().publish(conn, ORDERS, new Order(3, "traced"))
                    .map(v -> rows.iterator().next().getInteger("pid")))));

        NotificationEvent<Order> event = await(subscription.next());
        assertEquals(3, event.payload().id);
        assertEquals(ORDERS.name(), event.channel());
        assertEquals(publisherPid, event.senderBackendId());
        await(subscription.cancel());
    }

    @Test
    void testEmptyAndQuotedPayloads() throws Exception {
        NotificationSubscription<RawNotification> raw = await(client.subscribeRaw(ChannelName.of("plain")));

        await(client.publisher().publishEmpty(ChannelName.of("plain")));
        await(client.publish(ChannelName.of("plain"), "it's été ✓"));

        assertEquals("", await(raw.next()).payload());
        assertEquals("\"it's été ✓\"", await(raw.next()).payload());
        await(raw.cancel());
    }

    @Test
    void testLargestAcceptedPayloadIsDeliveredAndLimitIsRejectedLocally() throws Exception {
        ChannelName channel = ChannelName.of("large");
        NotificationSubscription<RawNotification> raw = await(client.subscribeRaw(channel));
        String largest = "y".repeat(7999);

        await(client.publisher().publishRaw(channel, largest));
        ExecutionException rejected = assertThrows(ExecutionException.class,
            () -> await(client.publisher().publishRaw(channel, "y".repeat(8000))));
        PayloadTooLargeException error = assertInstanceOf(PayloadTooLargeException.class, rejected.getCause());
        assertEquals(8000, error.getSize());
        assertEquals(8000, error.getLimit());
        await(client.publisher().publishRaw(channel, "after"));

        assertEquals(largest, await(raw.next()).payload());
        assertEquals("after", await(raw.next()).payload(), "the rejected payload never reached the server");
        await(raw.cancel());
    }

    @Test
    void testTableChangesReachTypedSubscriber() throws Exception {
        TableName table = TableName.of("shipments");
        ChannelDescriptor<RowChange> changes = ChannelDescriptor.of("shipment_changes", RowChange.class);
        SqlExecutor sql = SqlExecutor.of(pool);
        await(sql.execute("CREATE TABLE IF NOT EXISTS shipments (id INT PRIMARY KEY, status TEXT)"));
        await(new NotificationSetupService(sql).setupChannel(table, changes, NotificationSetupService.DEFAULT_EVENTS,
            false, TriggerTiming.AFTER));

        List<RowChange> received = new ArrayList<>();
        await(client.withSubscription(changes, subscription ->
            sql.execute("INSERT INTO shipments VALUES (1, 'packed')")
                .compose(v -> subscription.next())
                .map(received::add)));

        assertEquals(1, received.size());
        assertEquals("INSERT", received.get(0).operation);
        assertEquals("packed", received.get(0).newRow.get("status").asText());
        assertEquals(0, client.activeSubscriptions());
    }

    @Test
    void testTerminatedBackendEndsSubscription() throws Exception {
        NotificationSubscription<Order> subscription = await(client.subscribe(ORDERS));
        await(SqlExecutor.of(pool).execute(
            "SELECT pg_terminate_backend(pid) FROM pg_stat_activity " +
                "WHERE application_name = 'pgnotify-native-it' AND query LIKE 'LISTEN%'"));

        // the backend may report an error before the socket closes; either way the stream ends
        await(subscription.termination().transform(ar -> Future.<Void>succeededFuture()));
        assertTrue(subscription.state().isTerminal());
        assertEquals(0, client.activeSubscriptions());
    }

    @Test
    void testClientBuiltFromConfiguration() throws Exception {
        Properties overrides = new Properties();
        overrides.setProperty("pgnotify.database.host", postgres.getHost());
        overrides.setProperty("pgnotify.database.port", String.valueOf(postgres.getFirstMappedPort()));
        overrides.setProperty("pgnotify.database.name", postgres.getDatabaseName());
        overrides.setProperty("pgnotify.database.username", postgres.getUsername());
        overrides.setProperty("pgnotify.database.password", postgres.getPassword());
        overrides.setProperty("pgnotify.notifications.max-connections", "2");

        try (PgNotificationClient configured = PgNotificationClient.create(vertx,
            new PgNotifyConfiguration("default", overrides), new SimpleMeterRegistry())) {
            NotificationSubscription<Order> subscription = await(configured.subscribe(ORDERS));
            await(configured.publish(ORDERS, new Order(8, "configured")));
            assertEquals(8, await(subscription.next()).id);
            await(subscription.cancel());
            assertEquals(0, configured.activeSubscriptions());
        }
    }

    private static <T> T await(Future<T> future) throws Exception {
        return awaitWithin(future, 30_000);
    }

    private static <T> T awaitWithin(Future<T> future, long millis) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(millis, TimeUnit.MILLISECONDS);
    }
}

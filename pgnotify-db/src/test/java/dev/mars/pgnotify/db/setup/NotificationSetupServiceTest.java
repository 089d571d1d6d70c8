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

import dev.mars.pgnotify.api.ChannelDescriptor;
import dev.mars.pgnotify.api.error.InvalidIdentifierException;
import dev.mars.pgnotify.api.identifier.ChannelName;
import dev.mars.pgnotify.api.identifier.TableName;
import dev.mars.pgnotify.db.connection.SqlExecutor;
import dev.mars.pgnotify.test.categories.TestCategories;
import io.vertx.core.Future;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class NotificationSetupServiceTest {

    private final List<String> executed = new ArrayList<>();
    private final SqlExecutor recording = sql -> {
        executed.add(sql);
        return Future.succeededFuture();
    };

    @Test
    void testSetupChannelRunsThreeStatementsInOrder() {
        NotificationSetupService service = new NotificationSetupService(recording);

        Future<ChannelName> result = service.setupChannel(TableName.of("orders"), ChannelName.of("orders_notifications"));

        assertTrue(result.succeeded());
        assertEquals(ChannelName.of("orders_notifications"), result.result());
        assertEquals(3, executed.size());
        assertTrue(executed.get(0).startsWith("CREATE OR REPLACE FUNCTION \"orders_orders_notifications_notify\""));
        assertEquals("DROP TRIGGER IF EXISTS \"orders_orders_notifications_trigger\" ON \"orders\"", executed.get(1));
        assertTrue(executed.get(2).contains("AFTER DELETE OR INSERT OR UPDATE ON \"orders\""));
    }

    @Test
    void testSetupStopsAtFirstFailure() {
        SqlExecutor failingDrop = sql -> {
            executed.add(sql);
            return sql.startsWith("DROP TRIGGER") ? Future.failedFuture(new RuntimeException("boom")) : Future.succeededFuture();
        };
        NotificationSetupService service = new NotificationSetupService(failingDrop);

        Future<ChannelName> result = service.setupChannel(TableName.of("orders"), ChannelName.of("c"));

        assertTrue(result.failed());
        assertEquals("boom", result.cause().getMessage());
        assertEquals(2, executed.size());
    }

    @Test
    void testTypedSetupReturnsDescriptor() {
        NotificationSetupService service = new NotificationSetupService(recording);
        ChannelDescriptor<String> descriptor = ChannelDescriptor.of("names", String.class);

        Future<ChannelDescriptor<String>> result = service.setupChannel(TableName.of("people"), descriptor,
            Set.of(TriggerEvent.INSERT), true, TriggerTiming.BEFORE);

        assertSame(descriptor, result.result());
        assertTrue(executed.get(0).contains("'old'"));
        assertTrue(executed.get(2).contains("BEFORE INSERT ON \"people\""));
    }

    @Test
    void testEmptyEventsFailWithoutExecuting() {
        NotificationSetupService service = new NotificationSetupService(recording);

        Future<ChannelName> result = service.setupChannel(TableName.of("orders"), ChannelName.of("c"), Set.of(),
            false, TriggerTiming.AFTER);

        assertTrue(result.failed());
        assertInstanceOf(IllegalArgumentException.class, result.cause());
        assertTrue(executed.isEmpty());
    }

    @Test
    void testOverlongDerivedNameFailsWithoutExecuting() {
        NotificationSetupService service = new NotificationSetupService(recording);

        Future<ChannelName> result = service.setupChannel(TableName.of("t".repeat(40)), ChannelName.of("c".repeat(30)));

        assertInstanceOf(InvalidIdentifierException.class, result.cause());
        assertTrue(executed.isEmpty());
    }

    @Test
    void testRemoveChannelDropsTriggerThenFunction() {
        NotificationSetupService service = new NotificationSetupService(recording);

        assertTrue(service.removeChannel(TableName.of("orders"), ChannelName.of("c")).succeeded());

        assertEquals(List.of(
            "DROP TRIGGER IF EXISTS \"orders_c_trigger\" ON \"orders\"",
            "DROP FUNCTION IF EXISTS \"orders_c_notify\"()"), executed);
    }
}

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

import dev.mars.pgnotify.api.error.InvalidIdentifierException;
import dev.mars.pgnotify.api.identifier.ChannelName;
import dev.mars.pgnotify.api.identifier.FunctionName;
import dev.mars.pgnotify.api.identifier.TableName;
import dev.mars.pgnotify.api.identifier.TriggerName;
import dev.mars.pgnotify.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class NotificationSqlTemplatesTest {

    private static final TableName ORDERS = TableName.of("orders");
    private static final ChannelName CHANNEL = ChannelName.of("order-events");

    @Test
    void testTriggerFunctionWithoutOldValues() {
        String sql = NotificationSqlTemplates.createTriggerFunction(FunctionName.of("orders_notify"), CHANNEL, false);

        assertTrue(sql.startsWith("CREATE OR REPLACE FUNCTION \"orders_notify\"() RETURNS trigger AS $$"));
        assertTrue(sql.contains("'operation', TG_OP"));
        assertTrue(sql.contains("row_to_json(NEW)"));
        assertFalse(sql.contains("'old'"));
        assertTrue(sql.contains("PERFORM pg_notify('order-events', payload);"));
        assertTrue(sql.contains("RETURN CASE WHEN TG_OP = 'DELETE' THEN OLD ELSE NEW END;"));
        assertTrue(sql.endsWith("$$ LANGUAGE plpgsql"));
    }

    @Test
    void testTriggerFunctionWithOldValues() {
        String sql = NotificationSqlTemplates.createTriggerFunction(FunctionName.of("f"), CHANNEL, true);
        assertTrue(sql.contains("'old', CASE WHEN TG_OP IN ('UPDATE', 'DELETE') THEN row_to_json(OLD) ELSE NULL END"));
    }

    @Test
    void testEventsAreSortedAndJoined() {
        String sql = NotificationSqlTemplates.createTrigger(ORDERS, TriggerName.of("t"), FunctionName.of("f"),
            EnumSet.of(TriggerEvent.UPDATE, TriggerEvent.INSERT, TriggerEvent.DELETE), TriggerTiming.AFTER);

        assertEquals("CREATE TRIGGER \"t\"\nAFTER DELETE OR INSERT OR UPDATE ON \"orders\"\n" +
            "FOR EACH ROW EXECUTE FUNCTION \"f\"()", sql);
    }

    @Test
    void testInsteadOfTiming() {
        String sql = NotificationSqlTemplates.createTrigger(TableName.of("orders_view"), TriggerName.of("t"),
            FunctionName.of("f"), Set.of(TriggerEvent.INSERT), TriggerTiming.INSTEAD_OF);
        assertTrue(sql.contains("INSTEAD OF INSERT ON \"orders_view\""));
    }

    @Test
    void testTriggerNeedsAnEvent() {
        assertThrows(IllegalArgumentException.class, () -> NotificationSqlTemplates.createTrigger(ORDERS,
            TriggerName.of("t"), FunctionName.of("f"), Set.of(), TriggerTiming.AFTER));
    }

    @Test
    void testDropStatements() {
        assertEquals("DROP FUNCTION IF EXISTS \"f\"()", NotificationSqlTemplates.dropTriggerFunction(FunctionName.of("f"), true));
        assertEquals("DROP FUNCTION \"f\"()", NotificationSqlTemplates.dropTriggerFunction(FunctionName.of("f"), false));
        assertEquals("DROP TRIGGER IF EXISTS \"t\" ON \"orders\"",
            NotificationSqlTemplates.dropTrigger(TriggerName.of("t"), ORDERS, true));
    }

    @Test
    void testDerivedNames() {
        assertEquals("orders_order-events_notify", NotificationSqlTemplates.functionNameFor(ORDERS, CHANNEL).value());
        assertEquals("orders_order-events_trigger", NotificationSqlTemplates.triggerNameFor(ORDERS, CHANNEL).value());
    }

    @Test
    void testDerivedNamesAreValidated() {
        TableName longTable = TableName.of("t".repeat(50));
        assertThrows(InvalidIdentifierException.class,
            () -> NotificationSqlTemplates.triggerNameFor(longTable, ChannelName.of("c".repeat(10))));
    }
}

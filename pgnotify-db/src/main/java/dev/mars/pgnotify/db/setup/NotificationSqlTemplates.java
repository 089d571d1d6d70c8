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

import dev.mars.pgnotify.api.identifier.ChannelName;
import dev.mars.pgnotify.api.identifier.FunctionName;
import dev.mars.pgnotify.api.identifier.TableName;
import dev.mars.pgnotify.api.identifier.TriggerName;

import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Statement text for notification triggers.
 *
 * <p>Every identifier arrives as a validated {@code SqlIdentifier} and is rendered
 * double-quoted; the channel is additionally rendered as a text literal for
 * {@code pg_notify}, which is safe because validated names cannot contain quotes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class NotificationSqlTemplates {

    private static final String NEW_ROW =
        "'new', CASE WHEN TG_OP IN ('INSERT', 'UPDATE') THEN row_to_json(NEW) ELSE NULL END";
    private static final String OLD_ROW =
        "'old', CASE WHEN TG_OP IN ('UPDATE', 'DELETE') THEN row_to_json(OLD) ELSE NULL END";

    private NotificationSqlTemplates() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Trigger function publishing {@code {"operation": TG_OP, "new": ..., "old": ...}} on the channel.
     * The {@code old} member is present only when {@code includeOldValues} is set.
     */
    public static String createTriggerFunction(FunctionName function, ChannelName channel, boolean includeOldValues) {
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(channel, "channel");

        StringBuilder payload = new StringBuilder("json_build_object(\n")
            .append("      'operation', TG_OP,\n")
            .append("      ").append(NEW_ROW);
        if (includeOldValues) {
            payload.append(",\n      ").append(OLD_ROW);
        }
        payload.append("\n    )");

        return "CREATE OR REPLACE FUNCTION " + function.quoted() + "() RETURNS trigger AS $$\n" +
            "DECLARE\n" +
            "  payload text;\n" +
            "BEGIN\n" +
            "  payload := " + payload + "::text;\n" +
            "  PERFORM pg_notify('" + channel.value() + "', payload);\n" +
            "  RETURN CASE WHEN TG_OP = 'DELETE' THEN OLD ELSE NEW END;\n" +
            "END;\n" +
            "$$ LANGUAGE plpgsql";
    }

    public static String dropTriggerFunction(FunctionName function, boolean ifExists) {
        Objects.requireNonNull(function, "function");
        return "DROP FUNCTION " + (ifExists ? "IF EXISTS " : "") + function.quoted() + "()";
    }

    /**
     * Row-level trigger. Events are rendered in alphabetical order joined by {@code OR}.
     *
     * @throws IllegalArgumentException if no event is given
     */
    public static String createTrigger(TableName table, TriggerName trigger, FunctionName function,
                                       Set<TriggerEvent> events, TriggerTiming timing) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(timing, "timing");
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("At least one trigger event required");
        }

        String eventList = events.stream()
            .map(TriggerEvent::keyword)
            .sorted()
            .collect(Collectors.joining(" OR "));

        return "CREATE TRIGGER " + trigger.quoted() + "\n" +
            timing.keyword() + " " + eventList + " ON " + table.quoted() + "\n" +
            "FOR EACH ROW EXECUTE FUNCTION " + function.quoted() + "()";
    }

    public static String dropTrigger(TriggerName trigger, TableName table, boolean ifExists) {
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(table, "table");
        return "DROP TRIGGER " + (ifExists ? "IF EXISTS " : "") + trigger.quoted() + " ON " + table.quoted();
    }

    public static FunctionName functionNameFor(TableName table, ChannelName channel) {
        return FunctionName.of(table.value() + "_" + channel.value() + "_notify");
    }

    public static TriggerName triggerNameFor(TableName table, ChannelName channel) {
        return TriggerName.of(table.value() + "_" + channel.value() + "_trigger");
    }
}

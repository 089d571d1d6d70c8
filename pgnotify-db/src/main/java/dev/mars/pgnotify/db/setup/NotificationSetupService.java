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
import dev.mars.pgnotify.api.identifier.ChannelName;
import dev.mars.pgnotify.api.identifier.FunctionName;
import dev.mars.pgnotify.api.identifier.TableName;
import dev.mars.pgnotify.api.identifier.TriggerName;
import dev.mars.pgnotify.db.connection.SqlExecutor;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Provisions the database objects that turn row changes into notifications.
 *
 * <p>{@link #setupChannel} runs create-or-replace function, drop-if-exists trigger and
 * create trigger as three separate statements. The sequence is not transactional; it is
 * safe to re-run after a partial failure.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class NotificationSetupService {
    private static final Logger logger = LoggerFactory.getLogger(NotificationSetupService.class);

    public static final Set<TriggerEvent> DEFAULT_EVENTS =
        EnumSet.of(TriggerEvent.INSERT, TriggerEvent.UPDATE, TriggerEvent.DELETE);

    private final SqlExecutor executor;

    public NotificationSetupService(SqlExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public Future<Void> createTriggerFunction(FunctionName function, ChannelName channel, boolean includeOldValues) {
        String sql = NotificationSqlTemplates.createTriggerFunction(function, channel, includeOldValues);
        logger.info("Creating notification trigger function '{}' for channel '{}'", function, channel);
        return run(sql, "create trigger function " + function);
    }

    public Future<Void> dropTriggerFunction(FunctionName function, boolean ifExists) {
        logger.info("Dropping notification trigger function '{}'", function);
        return run(NotificationSqlTemplates.dropTriggerFunction(function, ifExists), "drop trigger function " + function);
    }

    public Future<Void> createTrigger(TableName table, TriggerName trigger, FunctionName function,
                                      Set<TriggerEvent> events, TriggerTiming timing) {
        String sql;
        try {
            sql = NotificationSqlTemplates.createTrigger(table, trigger, function, events, timing);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        logger.info("Creating notification trigger '{}' on table '{}'", trigger, table);
        return run(sql, "create trigger " + trigger);
    }

    public Future<Void> dropTrigger(TriggerName trigger, TableName table, boolean ifExists) {
        logger.info("Dropping notification trigger '{}' from table '{}'", trigger, table);
        return run(NotificationSqlTemplates.dropTrigger(trigger, table, ifExists), "drop trigger " + trigger);
    }

    /**
     * Sets up a channel with the default events (insert, update, delete), no old values, AFTER timing.
     */
    public Future<ChannelName> setupChannel(TableName table, ChannelName channel) {
        return setupChannel(table, channel, DEFAULT_EVENTS, false, TriggerTiming.AFTER);
    }

    /**
     * Creates the trigger function {@code <table>_<channel>_notify} and the trigger
     * {@code <table>_<channel>_trigger}, replacing any earlier versions.
     *
     * @return a future completing with the channel once all three statements ran
     */
    public Future<ChannelName> setupChannel(TableName table, ChannelName channel, Set<TriggerEvent> events,
                                            boolean includeOldValues, TriggerTiming timing) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(channel, "channel");
        FunctionName function;
        TriggerName trigger;
        try {
            function = NotificationSqlTemplates.functionNameFor(table, channel);
            trigger = NotificationSqlTemplates.triggerNameFor(table, channel);
            if (events == null || events.isEmpty()) {
                throw new IllegalArgumentException("At least one trigger event required");
            }
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }

        logger.info("Setting up notification channel '{}' for table '{}'", channel, table);
        return createTriggerFunction(function, channel, includeOldValues)
            .compose(v -> dropTrigger(trigger, table, true))
            .compose(v -> createTrigger(table, trigger, function, events, timing))
            .map(v -> channel)
            .onSuccess(c -> logger.info("Notification channel '{}' ready on table '{}'", channel, table));
    }

    public <T> Future<ChannelDescriptor<T>> setupChannel(TableName table, ChannelDescriptor<T> descriptor,
                                                         Set<TriggerEvent> events, boolean includeOldValues,
                                                         TriggerTiming timing) {
        Objects.requireNonNull(descriptor, "descriptor");
        return setupChannel(table, descriptor.name(), events, includeOldValues, timing).map(c -> descriptor);
    }

    /**
     * Drops the trigger and then the trigger function created by {@link #setupChannel}.
     */
    public Future<Void> removeChannel(TableName table, ChannelName channel) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(channel, "channel");
        FunctionName function;
        TriggerName trigger;
        try {
            function = NotificationSqlTemplates.functionNameFor(table, channel);
            trigger = NotificationSqlTemplates.triggerNameFor(table, channel);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
        logger.info("Removing notification channel '{}' from table '{}'", channel, table);
        return dropTrigger(trigger, table, true)
            .compose(v -> dropTriggerFunction(function, true));
    }

    private Future<Void> run(String sql, String description) {
        logger.debug("Executing: {}", sql);
        return executor.execute(sql)
            .onFailure(err -> logger.error("Failed to {}: {}", description, err.getMessage()));
    }
}

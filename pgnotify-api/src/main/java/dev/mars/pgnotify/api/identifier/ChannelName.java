package dev.mars.pgnotify.api.identifier;

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

/**
 * Name of a LISTEN / NOTIFY channel.
 */
public final class ChannelName extends SqlIdentifier {

    /** Suffix used when a channel is derived from a table name. */
    public static final String TABLE_CHANNEL_SUFFIX = "_notifications";

    private ChannelName(String value) {
        super(value, "channel");
    }

    /**
     * @throws dev.mars.pgnotify.api.error.InvalidIdentifierException if the name is invalid
     */
    public static ChannelName of(String value) {
        return new ChannelName(value);
    }

    /**
     * Derives the conventional change-notification channel for a table: {@code <table>_notifications}.
     */
    public static ChannelName forTable(TableName table) {
        return new ChannelName(table.value() + TABLE_CHANNEL_SUFFIX);
    }
}

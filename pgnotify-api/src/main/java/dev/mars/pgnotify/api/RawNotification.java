package dev.mars.pgnotify.api;

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

import java.util.Objects;

/**
 * A notification exactly as delivered by the listening connection, before decoding.
 *
 * @param channel         channel the notification was published on
 * @param payload         payload text, empty when NOTIFY was issued without one
 * @param senderBackendId process id of the backend that issued the NOTIFY
 */
public record RawNotification(ChannelName channel, String payload, int senderBackendId) {

    public RawNotification {
        Objects.requireNonNull(channel, "channel");
        payload = payload != null ? payload : "";
    }
}

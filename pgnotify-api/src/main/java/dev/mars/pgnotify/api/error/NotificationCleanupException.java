package dev.mars.pgnotify.api.error;

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
 * Raised when UNLISTEN fails while a subscription is torn down. The dedicated
 * connection is still released; this failure is reported, never swallowed.
 */
public class NotificationCleanupException extends NotificationException {

    private final String channel;

    public NotificationCleanupException(String channel, Throwable cause) {
        super("Failed to UNLISTEN channel '" + channel + "': " + cause.getMessage(), cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}

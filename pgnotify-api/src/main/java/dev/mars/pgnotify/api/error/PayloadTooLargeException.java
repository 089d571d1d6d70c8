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
 * Raised on publish when the encoded payload exceeds the NOTIFY payload limit.
 * Detected before any statement is sent to the database.
 */
public class PayloadTooLargeException extends NotificationException {

    private final int size;
    private final int limit;

    public PayloadTooLargeException(int size, int limit) {
        super(String.format("Notification payload of %d bytes does not fit below the limit of %d bytes. " +
            "Consider sending a reference id and fetching the full row instead", size, limit));
        this.size = size;
        this.limit = limit;
    }

    public int getSize() {
        return size;
    }

    public int getLimit() {
        return limit;
    }
}

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
 * Raised when a delivered payload cannot be decoded into the subscriber's payload type.
 *
 * <p>Carries the offending raw text and the target type name so the failure can be
 * diagnosed without a retry. On a subscription this failure is terminal by default.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PayloadDecodingException extends NotificationException {

    private final String typeName;
    private final String rawPayload;

    public PayloadDecodingException(String typeName, String rawPayload, Throwable cause) {
        super(String.format("Failed to decode notification payload as %s. Payload: '%s'. Error: %s",
            typeName, rawPayload, cause != null ? cause.getMessage() : "unknown"), cause);
        this.typeName = typeName;
        this.rawPayload = rawPayload;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getRawPayload() {
        return rawPayload;
    }
}

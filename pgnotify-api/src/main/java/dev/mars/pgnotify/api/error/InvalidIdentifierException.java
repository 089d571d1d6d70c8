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
 * Raised when a channel, function, trigger or table name fails local validation.
 * Never reaches the database.
 */
public class InvalidIdentifierException extends NotificationException {

    private final String identifierKind;
    private final String identifier;

    public InvalidIdentifierException(String identifierKind, String identifier, String message) {
        super(message);
        this.identifierKind = identifierKind;
        this.identifier = identifier;
    }

    public String getIdentifierKind() {
        return identifierKind;
    }

    /**
     * @return the rejected value, possibly null
     */
    public String getIdentifier() {
        return identifier;
    }
}

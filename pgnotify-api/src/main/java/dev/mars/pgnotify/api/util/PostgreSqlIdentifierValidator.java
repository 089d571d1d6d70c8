package dev.mars.pgnotify.api.util;

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

/**
 * Utility class for validating identifiers that are spliced into generated
 * LISTEN / NOTIFY / trigger statements.
 *
 * <p>The PostgreSQL protocol does not parameterize identifiers, so this check is the
 * only gate between caller supplied names and statement text. The accepted form is:
 * <ul>
 *   <li>Length between 1 and 63 characters</li>
 *   <li>ASCII letters, digits, underscore ({@code _}) and hyphen ({@code -}) only</li>
 * </ul>
 *
 * <p>Validated identifiers are always rendered double-quoted, which is what makes the
 * hyphen legal and preserves case.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class PostgreSqlIdentifierValidator {

    /**
     * PostgreSQL maximum identifier length.
     * @see <a href="https://www.postgresql.org/docs/current/sql-syntax-lexical.html#SQL-SYNTAX-IDENTIFIERS">PostgreSQL Documentation</a>
     */
    public static final int MAX_IDENTIFIER_LENGTH = 63;

    private PostgreSqlIdentifierValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Validates an identifier.
     *
     * @param identifier The identifier to validate
     * @param identifierKind Kind of identifier for error messages (e.g. "channel", "trigger")
     * @throws InvalidIdentifierException if validation fails
     */
    public static void validate(String identifier, String identifierKind) {
        if (identifier == null || identifier.isEmpty()) {
            throw new InvalidIdentifierException(identifierKind, identifier,
                identifierKind + " name cannot be null or empty");
        }

        if (identifier.length() > MAX_IDENTIFIER_LENGTH) {
            throw new InvalidIdentifierException(identifierKind, identifier,
                String.format("%s name '%s' exceeds PostgreSQL maximum length of %d characters (length: %d)",
                    identifierKind, identifier, MAX_IDENTIFIER_LENGTH, identifier.length()));
        }

        for (int i = 0; i < identifier.length(); i++) {
            if (!isAllowed(identifier.charAt(i))) {
                throw new InvalidIdentifierException(identifierKind, identifier,
                    String.format("Invalid %s name '%s': must contain only alphanumeric characters, " +
                        "underscores, and hyphens (invalid character at index %d)",
                        identifierKind, identifier, i));
            }
        }
    }

    /**
     * Checks if an identifier is valid without throwing an exception.
     *
     * @param identifier The identifier to check
     * @return true if valid, false otherwise
     */
    public static boolean isValid(String identifier) {
        if (identifier == null || identifier.isEmpty() || identifier.length() > MAX_IDENTIFIER_LENGTH) {
            return false;
        }
        for (int i = 0; i < identifier.length(); i++) {
            if (!isAllowed(identifier.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Renders an identifier as a quoted SQL identifier after validating it.
     *
     * @param identifier The identifier to quote
     * @param identifierKind Kind of identifier for error messages
     * @return The identifier wrapped in double quotes
     */
    public static String quote(String identifier, String identifierKind) {
        validate(identifier, identifierKind);
        return "\"" + identifier + "\"";
    }

    private static boolean isAllowed(char c) {
        return (c >= 'a' && c <= 'z')
            || (c >= 'A' && c <= 'Z')
            || (c >= '0' && c <= '9')
            || c == '_'
            || c == '-';
    }
}

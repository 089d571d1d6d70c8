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

import dev.mars.pgnotify.api.util.PostgreSqlIdentifierValidator;

import java.util.Objects;

/**
 * Base class for validated SQL identifiers.
 *
 * <p>Construction is the only validation point; an instance always holds a value that
 * satisfies {@link PostgreSqlIdentifierValidator}. Each identifier kind is its own final
 * subclass so that, for example, a {@link TriggerName} cannot be passed where a
 * {@link ChannelName} is expected. Two identifiers are equal only if they are of the same
 * kind and hold the same value.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public abstract class SqlIdentifier {

    private final String value;

    protected SqlIdentifier(String value, String identifierKind) {
        PostgreSqlIdentifierValidator.validate(value, identifierKind);
        this.value = value;
    }

    /**
     * @return the raw identifier text
     */
    public String value() {
        return value;
    }

    /**
     * @return the identifier wrapped in double quotes, ready to splice into a statement
     */
    public String quoted() {
        return "\"" + value + "\"";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((SqlIdentifier) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), value);
    }

    @Override
    public String toString() {
        return value;
    }
}

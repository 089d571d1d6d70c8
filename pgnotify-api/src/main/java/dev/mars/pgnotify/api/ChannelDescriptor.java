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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import dev.mars.pgnotify.api.identifier.ChannelName;
import dev.mars.pgnotify.api.identifier.TableName;

import java.util.Objects;

/**
 * Pairs a channel with the type of the payloads published on it.
 *
 * <p>Subscribing and publishing through a descriptor keeps both sides agreeing on the
 * payload type, so channel A's bytes are never decoded as channel B's type by accident.
 * The descriptor carries a {@link JavaType} because generic type arguments are erased at
 * runtime; it is used for decoding only. Equality and hashing are by channel name alone.
 *
 * <pre>{@code
 * ChannelDescriptor<OrderChange> orders = ChannelDescriptor.of("orders", OrderChange.class);
 * client.subscribe(orders);
 * publisher.publish(orders, new OrderChange(1, "shipped"));
 * }</pre>
 *
 * @param <T> payload type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class ChannelDescriptor<T> {

    private final ChannelName name;
    private final JavaType payloadType;

    private ChannelDescriptor(ChannelName name, JavaType payloadType) {
        this.name = Objects.requireNonNull(name, "name");
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
    }

    public static <T> ChannelDescriptor<T> of(ChannelName name, Class<T> payloadType) {
        return new ChannelDescriptor<>(name, TypeFactory.defaultInstance().constructType(payloadType));
    }

    /**
     * @throws dev.mars.pgnotify.api.error.InvalidIdentifierException if {@code name} is not a valid channel name
     */
    public static <T> ChannelDescriptor<T> of(String name, Class<T> payloadType) {
        return of(ChannelName.of(name), payloadType);
    }

    /**
     * Descriptor for a generic payload type, e.g. {@code new TypeReference<List<OrderChange>>() {}}.
     */
    public static <T> ChannelDescriptor<T> of(String name, TypeReference<T> payloadType) {
        return new ChannelDescriptor<>(ChannelName.of(name),
            TypeFactory.defaultInstance().constructType(payloadType));
    }

    /**
     * Descriptor for the change-notification channel of a table ({@code <table>_notifications}).
     */
    public static <T> ChannelDescriptor<T> forTable(TableName table, Class<T> payloadType) {
        return of(ChannelName.forTable(table), payloadType);
    }

    public ChannelName name() {
        return name;
    }

    public JavaType payloadType() {
        return payloadType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelDescriptor)) return false;
        return name.equals(((ChannelDescriptor<?>) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "ChannelDescriptor{" + name + " -> " + payloadType.toCanonical() + '}';
    }
}

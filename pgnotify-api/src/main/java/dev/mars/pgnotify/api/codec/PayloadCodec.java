package dev.mars.pgnotify.api.codec;

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

import com.fasterxml.jackson.databind.JavaType;
import dev.mars.pgnotify.api.error.PayloadDecodingException;
import dev.mars.pgnotify.api.error.PayloadEncodingException;
import dev.mars.pgnotify.api.error.PayloadTooLargeException;

/**
 * Encodes typed payload values to the size-bounded text carried by NOTIFY and decodes
 * delivered text back into values.
 *
 * <p>Size-exceeded, encode and decode failures are reported as distinct exception types.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface PayloadCodec {

    /**
     * Ceiling PostgreSQL places on a NOTIFY payload, in bytes. The server rejects a payload
     * whose length reaches this value, so the largest accepted payload is one byte shorter.
     */
    int MAX_PAYLOAD_BYTES = 8000;

    /**
     * Serializes a value to its canonical text form.
     *
     * @throws PayloadEncodingException if the value cannot be serialized
     */
    EncodedPayload encode(Object value);

    /**
     * Decodes delivered text into the requested type.
     *
     * @throws PayloadDecodingException if the text does not decode as {@code type}
     */
    <T> T decode(String raw, JavaType type);

    /**
     * Builds the decode target for a plain class.
     */
    JavaType typeOf(Class<?> type);

    /**
     * Verifies an encoded payload fits the NOTIFY limit.
     *
     * @throws PayloadTooLargeException if {@code byteLength} is {@link #MAX_PAYLOAD_BYTES} or more
     */
    default void checkSize(EncodedPayload payload) {
        if (payload.byteLength() >= MAX_PAYLOAD_BYTES) {
            throw new PayloadTooLargeException(payload.byteLength(), MAX_PAYLOAD_BYTES);
        }
    }

    /**
     * Convenience for {@code decode(raw, typeOf(type))}.
     */
    default <T> T decode(String raw, Class<T> type) {
        return decode(raw, typeOf(type));
    }
}

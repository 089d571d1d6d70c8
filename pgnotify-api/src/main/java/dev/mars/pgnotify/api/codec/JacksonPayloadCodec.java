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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.pgnotify.api.error.PayloadDecodingException;
import dev.mars.pgnotify.api.error.PayloadEncodingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * JSON payload codec backed by Jackson.
 *
 * <p>Payloads are written as compact JSON. Strings are therefore quoted on the wire;
 * use the raw publish path to send unstructured text.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class JacksonPayloadCodec implements PayloadCodec {
    private static final Logger logger = LoggerFactory.getLogger(JacksonPayloadCodec.class);

    private final ObjectMapper objectMapper;

    /**
     * Creates a codec with the default mapper: Java time support, ISO-8601 dates and
     * tolerance for unknown properties.
     */
    public JacksonPayloadCodec() {
        this(defaultObjectMapper());
    }

    public JacksonPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public EncodedPayload encode(Object value) {
        try {
            return EncodedPayload.of(objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            String typeName = value != null ? value.getClass().getName() : "null";
            logger.debug("Failed to encode payload of type {}: {}", typeName, e.getMessage());
            throw new PayloadEncodingException(typeName, e);
        }
    }

    @Override
    public <T> T decode(String raw, JavaType type) {
        if (raw == null || raw.isEmpty()) {
            throw new PayloadDecodingException(type.toCanonical(), raw,
                new IllegalArgumentException("empty payload"));
        }
        try {
            return objectMapper.readValue(raw, type);
        } catch (JsonProcessingException e) {
            throw new PayloadDecodingException(type.toCanonical(), raw, e);
        }
    }

    @Override
    public JavaType typeOf(Class<?> type) {
        return objectMapper.getTypeFactory().constructType(type);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}

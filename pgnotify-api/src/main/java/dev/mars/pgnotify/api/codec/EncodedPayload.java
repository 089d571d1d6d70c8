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

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Canonical text form of a payload together with the length of its UTF-8 encoding.
 *
 * @param text       the payload text as it will appear in the NOTIFY literal (before quoting)
 * @param byteLength number of bytes of {@code text} encoded as UTF-8
 */
public record EncodedPayload(String text, int byteLength) {

    public EncodedPayload {
        Objects.requireNonNull(text, "text");
    }

    /**
     * Wraps already-encoded text, measuring its UTF-8 length.
     */
    public static EncodedPayload of(String text) {
        Objects.requireNonNull(text, "text");
        return new EncodedPayload(text, text.getBytes(StandardCharsets.UTF_8).length);
    }
}

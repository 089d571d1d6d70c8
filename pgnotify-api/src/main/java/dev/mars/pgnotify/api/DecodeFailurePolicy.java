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

/**
 * What a subscription does when a delivered payload fails to decode.
 */
public enum DecodeFailurePolicy {

    /**
     * The decode failure ends the subscription; the consumer observes the
     * {@link dev.mars.pgnotify.api.error.PayloadDecodingException} as the terminal event.
     */
    TERMINATE,

    /**
     * The offending message is logged and dropped, delivery continues with the next one.
     */
    SKIP
}

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

/**
 * Name of a trigger function created by the provisioning helpers.
 */
public final class FunctionName extends SqlIdentifier {

    private FunctionName(String value) {
        super(value, "function");
    }

    public static FunctionName of(String value) {
        return new FunctionName(value);
    }
}

package dev.mars.pgnotify.test;

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

import dev.mars.pgnotify.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PostgreSQLTestConstants. Containers are configured but never started.
 */
@Tag(TestCategories.CORE)
class PostgreSQLTestConstantsTest {

    @Test
    void testImageIsPinned() {
        // parsing the name needs no Docker daemon
        DockerImageName image = DockerImageName.parse(PostgreSQLTestConstants.POSTGRES_IMAGE);
        assertEquals("postgres", image.getRepository());
        assertTrue(image.getVersionPart().startsWith("15."));
        assertTrue(image.isCompatibleWith(DockerImageName.parse("postgres")));
    }

    @Test
    void testCreateStandardContainer() {
        PostgreSQLContainer<?> container = PostgreSQLTestConstants.createStandardContainer();

        assertEquals(PostgreSQLTestConstants.DEFAULT_DATABASE_NAME, container.getDatabaseName());
        assertEquals(PostgreSQLTestConstants.DEFAULT_USERNAME, container.getUsername());
        assertEquals(PostgreSQLTestConstants.DEFAULT_PASSWORD, container.getPassword());
    }

    @Test
    void testCreateCustomContainer() {
        PostgreSQLContainer<?> container = PostgreSQLTestConstants.createContainer("custom_db", "custom_user", "secret");

        assertEquals("custom_db", container.getDatabaseName());
        assertEquals("custom_user", container.getUsername());
        assertEquals("secret", container.getPassword());
    }
}

package dev.mars.journal.test;

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
 * Test category constants used with JUnit 5 {@code @Tag} annotations.
 *
 * <ul>
 *   <li><strong>CORE</strong> - fast tests without external infrastructure</li>
 *   <li><strong>INTEGRATION</strong> - tests against a real PostgreSQL started by Testcontainers</li>
 * </ul>
 */
public final class TestCategories {

    /** Fast unit tests, no external dependencies. */
    public static final String CORE = "core";

    /** Tests that need Docker and a PostgreSQL container. */
    public static final String INTEGRATION = "integration";

    private TestCategories() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}

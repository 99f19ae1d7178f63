package dev.mars.syncore.test.categories;

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
 * Test categories for organizing Syncore tests by execution time and importance.
 *
 * Usage:
 * - @Tag(TestCategories.CORE) - Fast unit tests, critical functionality
 * - @Tag(TestCategories.INTEGRATION) - Tests that run the coordinator on a live Vert.x instance
 *
 * Maven execution examples:
 * - mvn test -Dgroups="core" (fast core tests only)
 * - mvn test -Dgroups="core,integration" (core + integration)
 * - mvn test -DexcludedGroups="integration" (skip the event-bus tests)
 */
public final class TestCategories {

    /**
     * CORE - Fast unit tests that validate critical functionality:
     * - Value type validation
     * - Routing, risk and strategy decisions
     * - Scheduler ordering, aging and quotas
     * - Configuration loading
     * - Event publication and decoding
     *
     * Target: < 30 seconds total execution time
     */
    public static final String CORE = "core";

    /**
     * INTEGRATION - Tests that exercise the coordinator end to end on the event bus:
     * - Registration, messaging and health checks
     * - Operation dispatch and completion
     * - Timer lifecycle
     *
     * Target: 1-3 minutes total execution time
     */
    public static final String INTEGRATION = "integration";

    private TestCategories() {
        // Utility class - no instantiation
    }
}

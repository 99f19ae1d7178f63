package dev.mars.syncore.registry;

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

import dev.mars.syncore.api.component.ComponentState;
import dev.mars.syncore.api.component.ComponentStatus;
import dev.mars.syncore.api.component.StartCheck;
import dev.mars.syncore.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class DependencyRulesTest {

    private static Map<String, ComponentStatus> components(ComponentStatus... statuses) {
        Map<String, ComponentStatus> map = new LinkedHashMap<>();
        for (ComponentStatus status : statuses) {
            map.put(status.id(), status);
        }
        return map;
    }

    @Test
    void testMissingDependencyIsUnsatisfied() {
        ComponentStatus api = ComponentStatus.of("api", ComponentState.HEALTHY, "db");
        Map<String, ComponentStatus> all = components(api);

        assertFalse(DependencyRules.areDependenciesSatisfied(api, all));
        assertEquals(List.of("db"), DependencyRules.failedDependencies(api, all));
    }

    @Test
    void testUnhealthyDependencyBlocksStart() {
        ComponentStatus db = ComponentStatus.of("db", ComponentState.DEGRADED);
        ComponentStatus cache = ComponentStatus.of("cache", ComponentState.HEALTHY);
        ComponentStatus api = ComponentStatus.of("api", ComponentState.STARTING, "db", "cache");

        StartCheck check = DependencyRules.canStart(api, components(db, cache, api));

        assertFalse(check.canStart());
        assertEquals(List.of("db"), check.blockedBy());
    }

    @Test
    void testHealthyDependenciesAllowStart() {
        ComponentStatus db = ComponentStatus.of("db", ComponentState.HEALTHY);
        ComponentStatus api = ComponentStatus.of("api", ComponentState.STARTING, "db");

        assertTrue(DependencyRules.canStart(api, components(db, api)).canStart());
    }

    @Test
    void testDependentCount() {
        Map<String, ComponentStatus> all = components(
            ComponentStatus.of("db", ComponentState.HEALTHY),
            ComponentStatus.of("a", ComponentState.HEALTHY, "db"),
            ComponentStatus.of("b", ComponentState.HEALTHY, "db"),
            ComponentStatus.of("c", ComponentState.HEALTHY, "a"));

        assertEquals(2, DependencyRules.dependentCount("db", all));
        assertEquals(1, DependencyRules.dependentCount("a", all));
        assertEquals(0, DependencyRules.dependentCount("c", all));
    }

    @Test
    void testStartupOrderPutsDependenciesFirst() {
        List<String> order = DependencyRules.startupOrder(List.of(
            ComponentStatus.of("api", ComponentState.HEALTHY, "service"),
            ComponentStatus.of("service", ComponentState.HEALTHY, "db", "external"),
            ComponentStatus.of("db", ComponentState.HEALTHY)));

        assertEquals(List.of("db", "service", "api"), order);
    }

    @Test
    void testStartupOrderBreaksCycles() {
        List<String> order = DependencyRules.startupOrder(List.of(
            ComponentStatus.of("a", ComponentState.HEALTHY, "b"),
            ComponentStatus.of("b", ComponentState.HEALTHY, "a"),
            ComponentStatus.of("c", ComponentState.HEALTHY)));

        assertEquals(3, order.size());
        assertEquals("c", order.get(0));
        assertEquals(List.of("a", "b"), order.subList(1, 3));
    }
}

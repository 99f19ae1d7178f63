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
import dev.mars.syncore.test.categories.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class ComponentRegistryTest {

    private ComponentRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ComponentRegistry();
    }

    @Test
    @DisplayName("Registering the same id twice keeps one entry with the latest status")
    void testIdempotentRegistration() {
        assertNull(registry.register(ComponentStatus.of("a", ComponentState.STARTING)));
        ComponentStatus previous = registry.register(ComponentStatus.of("a", ComponentState.HEALTHY));

        assertEquals(ComponentState.STARTING, previous.state());
        assertEquals(1, registry.size());
        assertEquals(ComponentState.HEALTHY, registry.get("a").orElseThrow().state());
    }

    @Test
    void testUnregisterUnknownIsNoOp() {
        registry.register(ComponentStatus.of("a", ComponentState.HEALTHY));

        assertFalse(registry.unregister("b"));
        assertTrue(registry.unregister("a"));
        assertFalse(registry.contains("a"));
        assertFalse(registry.unregister("a"));
    }

    @Test
    void testSnapshotIsStableAcrossWrites() {
        registry.register(ComponentStatus.of("a", ComponentState.HEALTHY));
        Map<String, ComponentStatus> before = registry.snapshot();

        registry.register(ComponentStatus.of("b", ComponentState.HEALTHY));

        assertEquals(1, before.size());
        assertEquals(2, registry.snapshot().size());
        assertThrows(UnsupportedOperationException.class, () -> before.remove("a"));
    }

    @Test
    void testSnapshotKeepsRegistrationOrder() {
        registry.register(ComponentStatus.of("z", ComponentState.HEALTHY));
        registry.register(ComponentStatus.of("a", ComponentState.HEALTHY));
        registry.register(ComponentStatus.of("m", ComponentState.HEALTHY));

        assertEquals(List.of("z", "a", "m"), List.copyOf(registry.snapshot().keySet()));
    }

    @Test
    void testApplyStatusesSkipsUnregistered() {
        ComponentStatus a = ComponentStatus.of("a", ComponentState.HEALTHY);
        registry.register(a);
        Map<String, ComponentStatus> expected = registry.snapshot();

        List<String> skipped = registry.applyStatuses(Map.of(
            "a", ComponentStatus.of("a", ComponentState.FAILED),
            "ghost", ComponentStatus.of("ghost", ComponentState.HEALTHY)), expected);

        assertEquals(ComponentState.FAILED, registry.get("a").orElseThrow().state());
        assertFalse(registry.contains("ghost"));
        assertEquals(List.of("ghost"), skipped);
    }

    @Test
    void testApplyStatusesKeepsNewerRegistration() {
        registry.register(ComponentStatus.of("a", ComponentState.HEALTHY));
        Map<String, ComponentStatus> expected = registry.snapshot();
        registry.register(ComponentStatus.of("a", ComponentState.FAILED));

        List<String> skipped = registry.applyStatuses(
            Map.of("a", ComponentStatus.of("a", ComponentState.DEGRADED)), expected);

        assertEquals(List.of("a"), skipped);
        assertEquals(ComponentState.FAILED, registry.get("a").orElseThrow().state());
    }

    @Test
    void testUpdateState() {
        registry.register(ComponentStatus.of("a", ComponentState.STARTING, "db"));

        ComponentStatus updated = registry.updateState("a", ComponentState.DEGRADED).orElseThrow();

        assertEquals(ComponentState.DEGRADED, updated.state());
        assertEquals(List.of("db"), updated.dependencies());
        assertTrue(registry.updateState("missing", ComponentState.HEALTHY).isEmpty());
    }
}

package dev.mars.syncore.test;

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
import dev.mars.syncore.api.state.SystemMetrics;
import dev.mars.syncore.api.state.SystemState;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builders for system state snapshots used across tests.
 */
public final class StateFixtures {

    private StateFixtures() {
        // Utility class - no instantiation
    }

    public static SystemState withComponents(ComponentStatus... components) {
        Map<String, ComponentStatus> map = new LinkedHashMap<>();
        for (ComponentStatus component : components) {
            map.put(component.id(), component);
        }
        return SystemState.initial().withComponents(map);
    }

    public static SystemState healthy(String... ids) {
        ComponentStatus[] components = new ComponentStatus[ids.length];
        for (int i = 0; i < ids.length; i++) {
            components[i] = ComponentStatus.of(ids[i], ComponentState.HEALTHY);
        }
        return withComponents(components);
    }

    public static SystemState withLoad(SystemState state, double operationsPerHour) {
        return state.withMetrics(SystemMetrics.initial().withOperationsPerHour(operationsPerHour));
    }
}

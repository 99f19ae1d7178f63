package dev.mars.syncore.health;

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

import dev.mars.syncore.api.component.ComponentStatus;
import dev.mars.syncore.api.health.ComponentTransition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of evaluating component checks against a snapshot: the transitioned components, the
 * recomputed health and what changed.
 *
 * <p>{@code evaluated} holds the snapshot instances that received a check result. Only those
 * entries are written back, and only while the registry still holds the same instance.</p>
 */
public record HealthEvaluation(
    Map<String, ComponentStatus> components,
    Map<String, ComponentStatus> evaluated,
    int health,
    List<ComponentTransition> transitions,
    List<String> warnings
) {
    public HealthEvaluation {
        components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
        evaluated = Collections.unmodifiableMap(new LinkedHashMap<>(evaluated));
        transitions = List.copyOf(transitions);
        warnings = List.copyOf(warnings);
    }

    /**
     * Transitioned statuses for the components that received a check result.
     */
    public Map<String, ComponentStatus> updates() {
        Map<String, ComponentStatus> updates = new LinkedHashMap<>();
        evaluated.keySet().forEach(id -> updates.put(id, components.get(id)));
        return updates;
    }
}

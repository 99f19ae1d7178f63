package dev.mars.syncore.api.state;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of the coordinated system. Every mutation produces a new instance that the
 * coordinator swaps in atomically; holders of an older snapshot keep a consistent view.
 *
 * @param health            aggregate health 0-100, derived from components and error rate
 * @param components        registered components by id, in registration order
 * @param activeOperations  admitted operations by id
 * @param metrics           operational counters
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public record SystemState(
    int health,
    Map<String, ComponentStatus> components,
    Map<String, ActiveOperation> activeOperations,
    SystemMetrics metrics
) {
    public SystemState {
        if (health < 0 || health > 100) {
            throw new IllegalArgumentException("health must be between 0 and 100: " + health);
        }
        components = components == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(components));
        activeOperations = activeOperations == null
            ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(activeOperations));
        metrics = Objects.requireNonNullElse(metrics, SystemMetrics.initial());
    }

    public static SystemState initial() {
        return new SystemState(100, Map.of(), Map.of(), SystemMetrics.initial());
    }

    public Optional<ComponentStatus> component(String id) {
        return Optional.ofNullable(components.get(id));
    }

    public boolean isComponentHealthy(String id) {
        ComponentStatus status = components.get(id);
        return status != null && status.isHealthy();
    }

    public List<String> healthyComponentIds() {
        return components.values().stream()
            .filter(ComponentStatus::isHealthy)
            .map(ComponentStatus::id)
            .toList();
    }

    public long countHealthy() {
        return components.values().stream().filter(ComponentStatus::isHealthy).count();
    }

    /**
     * Number of active operations that have assigned work to the given component.
     */
    public long activeLoadOf(String componentId) {
        return activeOperations.values().stream()
            .filter(op -> op.assignees().contains(componentId))
            .count();
    }

    public SystemState withHealth(int newHealth) {
        return new SystemState(newHealth, components, activeOperations, metrics);
    }

    public SystemState withComponents(Map<String, ComponentStatus> newComponents) {
        return new SystemState(health, newComponents, activeOperations, metrics);
    }

    public SystemState withActiveOperations(Map<String, ActiveOperation> newActiveOperations) {
        return new SystemState(health, components, newActiveOperations, metrics);
    }

    public SystemState withMetrics(SystemMetrics newMetrics) {
        return new SystemState(health, components, activeOperations, newMetrics);
    }
}

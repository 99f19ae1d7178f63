package dev.mars.syncore.api.component;

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

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Registry entry for a component: identity, current state and the component ids it depends on.
 *
 * <p>Dependencies may reference ids that are not registered. Such dependencies are treated as
 * permanently unsatisfied by the dependency rules.</p>
 *
 * @param id             stable component identity
 * @param state          current state
 * @param dependencies   ids of components this component requires
 * @param capabilities   operation types or features this component can handle
 * @param version        component version string
 * @param lastHeartbeat  when the component last reported or was checked
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public record ComponentStatus(
    String id,
    ComponentState state,
    List<String> dependencies,
    Set<String> capabilities,
    String version,
    Instant lastHeartbeat
) {
    public ComponentStatus {
        Objects.requireNonNull(id, "Component id cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Component id cannot be blank");
        }
        Objects.requireNonNull(state, "Component state cannot be null");
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        version = version == null ? "1.0.0" : version;
        lastHeartbeat = lastHeartbeat == null ? Instant.now() : lastHeartbeat;
    }

    public static ComponentStatus of(String id, ComponentState state, String... dependencies) {
        return new ComponentStatus(id, state, List.of(dependencies), Set.of(), null, null);
    }

    public ComponentStatus withState(ComponentState newState) {
        return new ComponentStatus(id, newState, dependencies, capabilities, version, lastHeartbeat);
    }

    public ComponentStatus withState(ComponentState newState, Instant heartbeat) {
        return new ComponentStatus(id, newState, dependencies, capabilities, version, heartbeat);
    }

    public ComponentStatus withCapabilities(Collection<String> newCapabilities) {
        return new ComponentStatus(id, state, dependencies, Set.copyOf(newCapabilities), version, lastHeartbeat);
    }

    public boolean isHealthy() {
        return state.isHealthy();
    }

    public boolean hasCapabilities(Collection<String> required) {
        return capabilities.containsAll(required);
    }
}

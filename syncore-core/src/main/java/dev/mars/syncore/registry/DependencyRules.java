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

import dev.mars.syncore.api.component.ComponentStatus;
import dev.mars.syncore.api.component.StartCheck;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency checks over a component map. A dependency is satisfied only if it is registered and
 * healthy; unknown ids stay unsatisfied.
 */
public final class DependencyRules {

    private DependencyRules() {
        // Utility class - no instantiation
    }

    public static boolean areDependenciesSatisfied(ComponentStatus component, Map<String, ComponentStatus> components) {
        return component.dependencies().stream().allMatch(dep -> isSatisfied(dep, components));
    }

    public static List<String> failedDependencies(ComponentStatus component, Map<String, ComponentStatus> components) {
        return component.dependencies().stream()
            .filter(dep -> !isSatisfied(dep, components))
            .toList();
    }

    public static StartCheck canStart(ComponentStatus component, Map<String, ComponentStatus> components) {
        List<String> failed = failedDependencies(component, components);
        return failed.isEmpty() ? StartCheck.ready() : StartCheck.blocked(failed);
    }

    /**
     * Number of registered components that list {@code componentId} as a dependency.
     */
    public static long dependentCount(String componentId, Map<String, ComponentStatus> components) {
        return components.values().stream()
            .filter(c -> c.dependencies().contains(componentId))
            .count();
    }

    /**
     * Orders components so that each appears after the dependencies it shares with the input.
     * Dependencies outside the input are ignored. When a cycle leaves no component ready, the
     * earliest remaining one is emitted to break it.
     */
    public static List<String> startupOrder(Collection<ComponentStatus> components) {
        Map<String, ComponentStatus> byId = new LinkedHashMap<>();
        components.forEach(c -> byId.put(c.id(), c));
        Set<String> remaining = new LinkedHashSet<>(byId.keySet());
        List<String> order = new ArrayList<>(byId.size());

        while (!remaining.isEmpty()) {
            boolean addedAny = false;
            Iterator<String> it = remaining.iterator();
            while (it.hasNext()) {
                String id = it.next();
                boolean blocked = byId.get(id).dependencies().stream().anyMatch(remaining::contains);
                if (!blocked) {
                    order.add(id);
                    it.remove();
                    addedAny = true;
                }
            }
            if (!addedAny) {
                // cycle
                String next = remaining.iterator().next();
                order.add(next);
                remaining.remove(next);
            }
        }
        return order;
    }

    private static boolean isSatisfied(String dependencyId, Map<String, ComponentStatus> components) {
        ComponentStatus dependency = components.get(dependencyId);
        return dependency != null && dependency.isHealthy();
    }
}

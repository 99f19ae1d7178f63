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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Authoritative map of component id to {@link ComponentStatus}.
 *
 * <p>Writers are serialized and replace the whole map on every change; readers get the current
 * immutable map without locking.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class ComponentRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ComponentRegistry.class);

    private final Object writeLock = new Object();
    private volatile Map<String, ComponentStatus> components = Map.of();

    /**
     * Inserts or replaces the entry for {@code status.id()}.
     *
     * @return the previous status, or null if the id was not registered
     */
    public ComponentStatus register(ComponentStatus status) {
        Objects.requireNonNull(status, "Component status cannot be null");
        synchronized (writeLock) {
            Map<String, ComponentStatus> next = new LinkedHashMap<>(components);
            ComponentStatus previous = next.put(status.id(), status);
            components = Collections.unmodifiableMap(next);
            if (previous == null) {
                logger.info("Registered component: {} ({})", status.id(), status.state());
            } else {
                logger.info("Replaced component: {} ({} -> {})", status.id(), previous.state(), status.state());
            }
            return previous;
        }
    }

    /**
     * Removes a component. No-op if the id is not registered.
     *
     * @return true if an entry was removed
     */
    public boolean unregister(String componentId) {
        synchronized (writeLock) {
            if (!components.containsKey(componentId)) {
                logger.debug("Ignoring unregister for unknown component: {}", componentId);
                return false;
            }
            Map<String, ComponentStatus> next = new LinkedHashMap<>(components);
            next.remove(componentId);
            components = Collections.unmodifiableMap(next);
            logger.info("Unregistered component: {}", componentId);
            return true;
        }
    }

    /**
     * Replaces an entry only while it is still the instance in {@code expected}. Entries
     * re-registered or removed since {@code expected} was read are left alone.
     *
     * @return the ids that were skipped
     */
    public List<String> applyStatuses(Map<String, ComponentStatus> updated, Map<String, ComponentStatus> expected) {
        synchronized (writeLock) {
            Map<String, ComponentStatus> next = new LinkedHashMap<>(components);
            List<String> skipped = new ArrayList<>();
            updated.forEach((id, status) -> {
                ComponentStatus current = next.get(id);
                if (current != null && current == expected.get(id)) {
                    next.put(id, status);
                } else {
                    skipped.add(id);
                }
            });
            components = Collections.unmodifiableMap(next);
            if (!skipped.isEmpty()) {
                logger.debug("Skipped stale status updates for components: {}", skipped);
            }
            return skipped;
        }
    }

    /**
     * Sets the state of one component.
     *
     * @return the updated status, empty if the id is unknown
     */
    public Optional<ComponentStatus> updateState(String componentId, ComponentState state) {
        synchronized (writeLock) {
            ComponentStatus current = components.get(componentId);
            if (current == null) {
                return Optional.empty();
            }
            ComponentStatus updated = current.withState(state);
            Map<String, ComponentStatus> next = new LinkedHashMap<>(components);
            next.put(componentId, updated);
            components = Collections.unmodifiableMap(next);
            return Optional.of(updated);
        }
    }

    public Optional<ComponentStatus> get(String componentId) {
        return Optional.ofNullable(components.get(componentId));
    }

    public boolean contains(String componentId) {
        return components.containsKey(componentId);
    }

    /**
     * Current immutable view, in registration order.
     */
    public Map<String, ComponentStatus> snapshot() {
        return components;
    }

    public int size() {
        return components.size();
    }
}

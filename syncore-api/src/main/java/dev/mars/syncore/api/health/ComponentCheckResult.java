package dev.mars.syncore.api.health;

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

import java.util.Objects;

/**
 * Externally supplied health check outcome for one component.
 *
 * @param componentId  checked component
 * @param newState     state reported by the check
 * @param message      optional detail
 */
public record ComponentCheckResult(String componentId, ComponentState newState, String message) {

    public ComponentCheckResult {
        Objects.requireNonNull(componentId, "Component id cannot be null");
        Objects.requireNonNull(newState, "New state cannot be null");
    }

    public static ComponentCheckResult of(String componentId, ComponentState newState) {
        return new ComponentCheckResult(componentId, newState, null);
    }
}

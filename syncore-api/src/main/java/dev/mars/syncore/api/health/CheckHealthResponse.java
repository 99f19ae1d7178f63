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

import java.time.Instant;
import java.util.List;

/**
 * Result of a health check pass.
 *
 * @param success         false only if the pass could not be evaluated at all
 * @param health          aggregate health after the pass
 * @param previousHealth  aggregate health before the pass
 * @param transitions     component state changes applied
 * @param warnings        non-fatal problems, such as results for unknown components
 * @param checkedAt       when the pass ran
 */
public record CheckHealthResponse(
    boolean success,
    int health,
    int previousHealth,
    List<ComponentTransition> transitions,
    List<String> warnings,
    Instant checkedAt
) {
    public CheckHealthResponse {
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}

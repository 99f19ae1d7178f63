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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated result of a system validation pass. Validation never throws for expected problems;
 * they are reported here as errors and warnings.
 */
public record ValidationResult(
    boolean valid,
    List<String> errors,
    List<String> warnings,
    Map<String, ComponentValidation> componentValidations,
    List<DependencyIssue> dependencyIssues,
    OperationalReadiness operationalReadiness,
    long executionTimeMs
) {
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        componentValidations = componentValidations == null
            ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(componentValidations));
        dependencyIssues = dependencyIssues == null ? List.of() : List.copyOf(dependencyIssues);
    }
}

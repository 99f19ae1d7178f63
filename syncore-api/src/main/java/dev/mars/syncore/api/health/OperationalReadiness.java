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

import dev.mars.syncore.api.operation.RiskLevel;

import java.util.List;

/**
 * Whether the system is ready to take work, and what to do if it is not.
 *
 * @param ready                   at least one healthy component, no critical component down, risk below critical
 * @param healthyComponents       healthy component count
 * @param totalComponents         registered component count
 * @param criticalComponentsDown  failed or degraded components with more than two dependents
 * @param riskLevel               assessed risk
 * @param riskFactors             contributing risk factors
 * @param recommendations         suggested actions
 */
public record OperationalReadiness(
    boolean ready,
    int healthyComponents,
    int totalComponents,
    List<String> criticalComponentsDown,
    RiskLevel riskLevel,
    List<String> riskFactors,
    List<String> recommendations
) {
    public OperationalReadiness {
        criticalComponentsDown = criticalComponentsDown == null ? List.of() : List.copyOf(criticalComponentsDown);
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}

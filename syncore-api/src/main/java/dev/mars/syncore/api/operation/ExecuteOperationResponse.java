package dev.mars.syncore.api.operation;

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

import dev.mars.syncore.api.error.SyncoreError;

/**
 * Outcome of planning an operation. Expected rejections come back as {@code success == false}
 * with a populated {@link #error()}, never as exceptions.
 *
 * @param success           whether the operation was admitted
 * @param operation         the operation, enriched with planning metadata on success
 * @param strategyDecision  chosen strategy
 * @param riskAssessment    assessed risk
 * @param executionPlan     resulting plan
 * @param executionTimeMs   time spent planning
 * @param error             rejection reason, null on success
 */
public record ExecuteOperationResponse(
    boolean success,
    Operation operation,
    StrategyDecision strategyDecision,
    RiskAssessment riskAssessment,
    ExecutionPlan executionPlan,
    long executionTimeMs,
    SyncoreError error
) {
}

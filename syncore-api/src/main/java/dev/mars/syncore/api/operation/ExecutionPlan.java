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

import java.util.List;

/**
 * Concrete plan produced for an operation.
 *
 * @param strategy              chosen strategy
 * @param participants          components that will receive work
 * @param workloadDistribution  shards, empty unless distributed
 * @param delegatedTo           delegate id, null unless delegated
 * @param estimatedDurationMs   strategy-specific duration estimate
 * @param canExecute            false when no participant is available
 * @param shouldProceed         outcome of the risk gate
 */
public record ExecutionPlan(
    ExecutionStrategy strategy,
    List<String> participants,
    List<WorkloadAssignment> workloadDistribution,
    String delegatedTo,
    long estimatedDurationMs,
    boolean canExecute,
    boolean shouldProceed
) {
    public ExecutionPlan {
        participants = participants == null ? List.of() : List.copyOf(participants);
        workloadDistribution = workloadDistribution == null ? List.of() : List.copyOf(workloadDistribution);
    }
}

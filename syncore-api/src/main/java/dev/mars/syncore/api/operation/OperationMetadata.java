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

import dev.mars.syncore.api.messaging.Priority;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Structured metadata attached to an {@link Operation}.
 *
 * <p>Caller-supplied fields are the priority, the required capabilities and free-form attributes.
 * Strategy, risk level and reasoning are filled in by planning; partition fields are set on the
 * per-shard copies produced for distributed execution.</p>
 *
 * @param priority              declared priority, defaults to {@link Priority#P2}
 * @param requiredCapabilities  capabilities a delegate must provide, empty when unconstrained
 * @param strategy              planned execution strategy, null before planning
 * @param riskLevel             assessed risk, null before planning
 * @param reasoning             planner explanation, null before planning
 * @param partition             1-based shard index, null unless distributed
 * @param totalPartitions       number of shards, null unless distributed
 * @param attributes            free-form caller attributes
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public record OperationMetadata(
    Priority priority,
    Set<String> requiredCapabilities,
    ExecutionStrategy strategy,
    RiskLevel riskLevel,
    String reasoning,
    Integer partition,
    Integer totalPartitions,
    Map<String, Object> attributes
) {
    public OperationMetadata {
        priority = priority == null ? Priority.P2 : priority;
        requiredCapabilities = requiredCapabilities == null ? Set.of() : Set.copyOf(requiredCapabilities);
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        if ((partition == null) != (totalPartitions == null)) {
            throw new IllegalArgumentException("partition and totalPartitions must be set together");
        }
        if (partition != null && (totalPartitions < 1 || partition < 1 || partition > totalPartitions)) {
            throw new IllegalArgumentException(
                "Invalid partition " + partition + " of " + totalPartitions);
        }
    }

    public static OperationMetadata empty() {
        return of(Priority.P2);
    }

    public static OperationMetadata of(Priority priority) {
        return new OperationMetadata(priority, Set.of(), null, null, null, null, null, Map.of());
    }

    public static OperationMetadata of(Priority priority, Set<String> requiredCapabilities) {
        return new OperationMetadata(priority, requiredCapabilities, null, null, null, null, null, Map.of());
    }

    public OperationMetadata withPlanning(ExecutionStrategy newStrategy, String newReasoning, RiskLevel newRiskLevel) {
        return new OperationMetadata(priority, requiredCapabilities, newStrategy, newRiskLevel, newReasoning,
            partition, totalPartitions, attributes);
    }

    public OperationMetadata withPartition(int newPartition, int newTotalPartitions) {
        return new OperationMetadata(priority, requiredCapabilities, strategy, riskLevel, reasoning,
            newPartition, newTotalPartitions, attributes);
    }

    public boolean hasRequiredCapabilities() {
        return !requiredCapabilities.isEmpty();
    }
}

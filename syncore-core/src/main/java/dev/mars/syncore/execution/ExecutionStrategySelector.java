package dev.mars.syncore.execution;

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
import dev.mars.syncore.api.messaging.Priority;
import dev.mars.syncore.api.operation.ExecutionStrategy;
import dev.mars.syncore.api.operation.Operation;
import dev.mars.syncore.api.operation.StrategyDecision;
import dev.mars.syncore.api.operation.WorkloadAssignment;
import dev.mars.syncore.api.state.SystemState;
import dev.mars.syncore.config.SyncoreConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Chooses how an operation is carried out. Rules are evaluated in order:
 *
 * <ol>
 *   <li>no healthy participant: queued, with no participants</li>
 *   <li>not P0 and the system is overloaded: queued, with all participants</li>
 *   <li>participant count at or above the distributed threshold: distributed over the healthy participants</li>
 *   <li>every participant healthy: immediate</li>
 *   <li>P0: immediate on the healthy participants</li>
 *   <li>a healthy participant offering the required capabilities exists: delegated to the least loaded one</li>
 *   <li>otherwise: queued</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class ExecutionStrategySelector {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionStrategySelector.class);

    private final int distributedThreshold;
    private final double queueLoadThreshold;
    private final int maxActiveOperations;

    public ExecutionStrategySelector(SyncoreConfiguration.StrategyConfig config) {
        this.distributedThreshold = config.getDistributedThreshold();
        this.queueLoadThreshold = config.getQueueLoadThreshold();
        this.maxActiveOperations = config.getMaxActiveOperations();
    }

    public StrategyDecision decideStrategy(Operation operation, SystemState state) {
        Priority priority = operation.priority();
        List<String> participants = operation.participants();
        List<String> healthy = participants.stream().filter(state::isComponentHealthy).toList();

        StrategyDecision decision;
        if (healthy.isEmpty()) {
            decision = new StrategyDecision(ExecutionStrategy.QUEUED, List.of(), priority,
                "No healthy participants available - queueing until participants recover");
        } else if (!priority.isTopTier() && isOverloaded(state)) {
            decision = new StrategyDecision(ExecutionStrategy.QUEUED, participants, priority,
                "High system load - queueing for later execution");
        } else if (participants.size() >= distributedThreshold) {
            decision = new StrategyDecision(ExecutionStrategy.DISTRIBUTED, healthy, priority,
                "Distributing across " + healthy.size() + " healthy participants");
        } else if (healthy.size() == participants.size()) {
            decision = new StrategyDecision(ExecutionStrategy.IMMEDIATE, healthy, priority,
                "All participants healthy - executing immediately");
        } else if (priority.isTopTier()) {
            decision = new StrategyDecision(ExecutionStrategy.IMMEDIATE, healthy, priority,
                "Critical priority requires immediate execution on healthy participants");
        } else {
            decision = findBestComponentForDelegation(operation, state)
                .map(delegate -> new StrategyDecision(ExecutionStrategy.DELEGATED, List.of(delegate), priority,
                    "Delegating to least loaded capable component " + delegate))
                .orElseGet(() -> new StrategyDecision(ExecutionStrategy.QUEUED, participants, priority,
                    "No healthy participant offers the required capabilities"));
        }

        logger.debug("Operation {} strategy: {} ({})", operation.id(), decision.strategy(), decision.reasoning());
        return decision;
    }

    public boolean canExecuteImmediately(Operation operation, SystemState state) {
        return decideStrategy(operation, state).strategy() == ExecutionStrategy.IMMEDIATE;
    }

    public boolean shouldQueue(Operation operation, SystemState state) {
        return decideStrategy(operation, state).strategy() == ExecutionStrategy.QUEUED;
    }

    /**
     * Least loaded healthy participant that offers the operation's required capabilities.
     * Without explicit requirements, participants offering the operation type are preferred but
     * any healthy participant qualifies.
     */
    public Optional<String> findBestComponentForDelegation(Operation operation, SystemState state) {
        List<ComponentStatus> healthy = operation.participants().stream()
            .map(id -> state.components().get(id))
            .filter(c -> c != null && c.isHealthy())
            .toList();

        Comparator<ComponentStatus> byLoad = Comparator.comparingLong(c -> state.activeLoadOf(c.id()));

        if (operation.metadata().hasRequiredCapabilities()) {
            Set<String> required = operation.metadata().requiredCapabilities();
            return healthy.stream()
                .filter(c -> c.hasCapabilities(required))
                .min(byLoad)
                .map(ComponentStatus::id);
        }

        Optional<String> preferred = healthy.stream()
            .filter(c -> c.capabilities().contains(operation.type()))
            .min(byLoad)
            .map(ComponentStatus::id);
        return preferred.isPresent() ? preferred : healthy.stream().min(byLoad).map(ComponentStatus::id);
    }

    /**
     * One shard per participant, partitions numbered from 1.
     */
    public List<WorkloadAssignment> distributeWorkload(List<String> participants) {
        List<WorkloadAssignment> assignments = new ArrayList<>(participants.size());
        for (int i = 0; i < participants.size(); i++) {
            assignments.add(new WorkloadAssignment(participants.get(i), i + 1, participants.size()));
        }
        return assignments;
    }

    /**
     * Strategy-specific estimate in milliseconds. Distributed grows with participant count.
     */
    public long estimateDuration(ExecutionStrategy strategy, int participantCount) {
        return switch (strategy) {
            case IMMEDIATE -> 1000L;
            case DISTRIBUTED -> 3000L + participantCount * 500L;
            case DELEGATED -> 2000L;
            case QUEUED -> 5000L;
        };
    }

    private boolean isOverloaded(SystemState state) {
        return state.metrics().operationsPerHour() > queueLoadThreshold
            || state.activeOperations().size() >= maxActiveOperations;
    }
}

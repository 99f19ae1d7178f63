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

import dev.mars.syncore.api.error.SyncoreError;
import dev.mars.syncore.api.error.SyncoreErrorCodes;
import dev.mars.syncore.api.operation.ExecuteOperationRequest;
import dev.mars.syncore.api.operation.ExecuteOperationResponse;
import dev.mars.syncore.api.operation.ExecutionPlan;
import dev.mars.syncore.api.operation.ExecutionStrategy;
import dev.mars.syncore.api.operation.Operation;
import dev.mars.syncore.api.operation.RiskAssessment;
import dev.mars.syncore.api.operation.StrategyDecision;
import dev.mars.syncore.api.operation.WorkloadAssignment;
import dev.mars.syncore.api.state.SystemState;
import dev.mars.syncore.risk.RiskAssessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Execute-operation use case: assesses risk, selects a strategy, builds the execution plan and
 * applies the admission gates.
 *
 * <p>An operation is rejected when no participant can execute it (unless forced) or when the
 * risk gate refuses it. Rejections are returned as unsuccessful responses.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class OperationPlanner {
    private static final Logger logger = LoggerFactory.getLogger(OperationPlanner.class);

    private final RiskAssessor riskAssessor;
    private final ExecutionStrategySelector strategySelector;

    public OperationPlanner(RiskAssessor riskAssessor, ExecutionStrategySelector strategySelector) {
        this.riskAssessor = riskAssessor;
        this.strategySelector = strategySelector;
    }

    public ExecuteOperationResponse plan(SystemState state, ExecuteOperationRequest request) {
        long startTime = System.currentTimeMillis();
        Operation operation = request.operation();
        logger.debug("Planning operation {} (type {}, {} participants, dryRun {})",
            operation.id(), operation.type(), operation.participants().size(), request.dryRun());

        try {
            RiskAssessment risk = riskAssessor.assessOperationRisk(operation, state);
            StrategyDecision decision = strategySelector.decideStrategy(operation, state);
            ExecutionPlan plan = createExecutionPlan(operation, decision, risk, request.forceExecution());

            if (!plan.canExecute() && !request.forceExecution()) {
                String message = "Operation cannot be executed - no healthy participants available";
                logger.warn("{}: {}", message, operation.id());
                return new ExecuteOperationResponse(false, operation, decision, risk, plan,
                    System.currentTimeMillis() - startTime,
                    SyncoreError.of(SyncoreErrorCodes.NO_HEALTHY_PARTICIPANTS, message, operation.id()));
            }

            if (!plan.shouldProceed()) {
                String message = "Operation execution not recommended: risk level " + risk.riskLevel();
                logger.warn("{}: {} {}", message, operation.id(), risk.factors());
                return new ExecuteOperationResponse(false, operation, decision, risk, plan,
                    System.currentTimeMillis() - startTime,
                    SyncoreError.of(SyncoreErrorCodes.RISK_TOO_HIGH, message, String.join("; ", risk.factors())));
            }

            if (request.dryRun()) {
                logger.info("Dry run completed for operation {}: {}", operation.id(), decision.strategy());
                return new ExecuteOperationResponse(true, operation, decision, risk, plan,
                    System.currentTimeMillis() - startTime, null);
            }

            // queued operations keep their participants so dispatch can re-check them later
            List<String> participants = decision.strategy() == ExecutionStrategy.QUEUED
                ? operation.participants() : decision.participants();
            Operation planned = operation
                .withParticipants(participants)
                .withMetadata(operation.metadata().withPlanning(decision.strategy(), decision.reasoning(), risk.riskLevel()));

            long executionTime = System.currentTimeMillis() - startTime;
            logger.info("Operation {} planned: {} (risk {}, {}ms)", operation.id(), decision.strategy(),
                risk.riskLevel(), executionTime);
            return new ExecuteOperationResponse(true, planned, decision, risk, plan, executionTime, null);
        } catch (RuntimeException e) {
            logger.error("Operation planning failed for {} after {}ms", operation.id(),
                System.currentTimeMillis() - startTime, e);
            throw e;
        }
    }

    private ExecutionPlan createExecutionPlan(Operation operation, StrategyDecision decision, RiskAssessment risk,
                                              boolean forceExecution) {
        boolean canExecute = !decision.participants().isEmpty();
        boolean shouldProceed = riskAssessor.shouldProceed(risk.riskLevel(), operation.priority(), forceExecution);

        List<WorkloadAssignment> workload = decision.strategy() == ExecutionStrategy.DISTRIBUTED
            ? strategySelector.distributeWorkload(decision.participants())
            : List.of();
        String delegatedTo = decision.strategy() == ExecutionStrategy.DELEGATED
            ? decision.participants().get(0)
            : null;
        long estimatedDuration = strategySelector.estimateDuration(decision.strategy(), decision.participants().size());

        return new ExecutionPlan(decision.strategy(), decision.participants(), workload, delegatedTo,
            estimatedDuration, canExecute, shouldProceed);
    }
}

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

import dev.mars.syncore.api.component.ComponentState;
import dev.mars.syncore.api.component.ComponentStatus;
import dev.mars.syncore.api.error.SyncoreErrorCodes;
import dev.mars.syncore.api.messaging.Priority;
import dev.mars.syncore.api.operation.ExecuteOperationRequest;
import dev.mars.syncore.api.operation.ExecuteOperationResponse;
import dev.mars.syncore.api.operation.ExecutionStrategy;
import dev.mars.syncore.api.operation.Operation;
import dev.mars.syncore.api.operation.RiskLevel;
import dev.mars.syncore.api.state.SystemState;
import dev.mars.syncore.config.SyncoreConfiguration;
import dev.mars.syncore.risk.RiskAssessor;
import dev.mars.syncore.test.StateFixtures;
import dev.mars.syncore.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class OperationPlannerTest {

    private final OperationPlanner planner = new OperationPlanner(new RiskAssessor(),
        new ExecutionStrategySelector(SyncoreConfiguration.StrategyConfig.defaults()));

    @Test
    void testImmediatePlanEnrichesMetadata() {
        Operation operation = Operation.of("op-1", "sync", Priority.P2, "a", "b");

        ExecuteOperationResponse response = planner.plan(StateFixtures.healthy("a", "b"),
            ExecuteOperationRequest.of(operation));

        assertTrue(response.success());
        assertNull(response.error());
        assertEquals(ExecutionStrategy.IMMEDIATE, response.executionPlan().strategy());
        assertEquals(1000L, response.executionPlan().estimatedDurationMs());
        assertEquals(ExecutionStrategy.IMMEDIATE, response.operation().metadata().strategy());
        assertEquals(RiskLevel.LOW, response.operation().metadata().riskLevel());
        assertNotNull(response.operation().metadata().reasoning());
        assertEquals(List.of("a", "b"), response.operation().participants());
    }

    @Test
    void testDistributedPlanHasOneShardPerParticipant() {
        Operation operation = Operation.of("op-2", "index", Priority.P2, "a", "b", "c", "d");

        ExecuteOperationResponse response = planner.plan(StateFixtures.healthy("a", "b", "c", "d"),
            ExecuteOperationRequest.of(operation));

        assertTrue(response.success());
        assertEquals(ExecutionStrategy.DISTRIBUTED, response.executionPlan().strategy());
        assertEquals(4, response.executionPlan().workloadDistribution().size());
        assertEquals(5000L, response.executionPlan().estimatedDurationMs());
    }

    @Test
    void testDelegatedPlanNamesDelegate() {
        SystemState state = StateFixtures.withComponents(
            ComponentStatus.of("a", ComponentState.HEALTHY),
            ComponentStatus.of("b", ComponentState.FAILED));

        ExecuteOperationResponse response = planner.plan(state,
            ExecuteOperationRequest.of(Operation.of("op-3", "t", Priority.P2, "a", "b")));

        assertTrue(response.success());
        assertEquals(ExecutionStrategy.DELEGATED, response.executionPlan().strategy());
        assertEquals("a", response.executionPlan().delegatedTo());
        assertEquals(List.of("a"), response.operation().participants());
    }

    @Test
    void testNoHealthyParticipantsIsRejected() {
        SystemState state = StateFixtures.withComponents(ComponentStatus.of("a", ComponentState.FAILED));

        ExecuteOperationResponse response = planner.plan(state,
            ExecuteOperationRequest.of(Operation.of("op-4", "t", Priority.P1, "a")));

        assertFalse(response.success());
        assertEquals(SyncoreErrorCodes.NO_HEALTHY_PARTICIPANTS, response.error().code());
        assertFalse(response.executionPlan().canExecute());
    }

    @Test
    @DisplayName("Forcing skips the availability gate but not the risk gate")
    void testForceExecutionBypassesAvailabilityGate() {
        SystemState state = StateFixtures.withComponents(ComponentStatus.of("a", ComponentState.FAILED));
        Operation operation = Operation.of("op-5", "t", Priority.P1, "a");

        ExecuteOperationResponse response = planner.plan(state, new ExecuteOperationRequest(operation, false, true));

        assertTrue(response.success());
        assertEquals(ExecutionStrategy.QUEUED, response.executionPlan().strategy());
        assertEquals(List.of("a"), response.operation().participants());
    }

    @Test
    void testCriticalRiskRejectedUnlessForcedTopTier() {
        SystemState state = StateFixtures.healthy("a").withHealth(40);

        ExecuteOperationResponse normal = planner.plan(state,
            ExecuteOperationRequest.of(Operation.of("op-6", "t", Priority.P2, "a")));
        assertFalse(normal.success());
        assertEquals(SyncoreErrorCodes.RISK_TOO_HIGH, normal.error().code());
        assertEquals(RiskLevel.CRITICAL, normal.riskAssessment().riskLevel());

        ExecuteOperationResponse topTierUnforced = planner.plan(state,
            ExecuteOperationRequest.of(Operation.of("op-7", "t", Priority.P0, "a")));
        assertFalse(topTierUnforced.success());

        ExecuteOperationResponse topTierForced = planner.plan(state,
            new ExecuteOperationRequest(Operation.of("op-8", "t", Priority.P0, "a"), false, true));
        assertTrue(topTierForced.success());

        ExecuteOperationResponse forcedLowPriority = planner.plan(state,
            new ExecuteOperationRequest(Operation.of("op-9", "t", Priority.P1, "a"), false, true));
        assertFalse(forcedLowPriority.success());
    }

    @Test
    void testDryRunLeavesOperationUntouched() {
        Operation operation = Operation.of("op-10", "t", Priority.P2, "a");

        ExecuteOperationResponse response = planner.plan(StateFixtures.healthy("a"),
            new ExecuteOperationRequest(operation, true, false));

        assertTrue(response.success());
        assertSame(operation, response.operation());
        assertNull(response.operation().metadata().strategy());
        assertEquals(ExecutionStrategy.IMMEDIATE, response.strategyDecision().strategy());
    }

    @Test
    void testQueuedPlanKeepsParticipants() {
        SystemState state = StateFixtures.withLoad(StateFixtures.healthy("a", "b"), 60.0);

        ExecuteOperationResponse response = planner.plan(state,
            ExecuteOperationRequest.of(Operation.of("op-11", "t", Priority.P2, "a", "b")));

        assertTrue(response.success());
        assertEquals(ExecutionStrategy.QUEUED, response.executionPlan().strategy());
        assertEquals(List.of("a", "b"), response.operation().participants());
        assertEquals(ExecutionStrategy.QUEUED, response.operation().metadata().strategy());
        assertEquals(5000L, response.executionPlan().estimatedDurationMs());
    }
}

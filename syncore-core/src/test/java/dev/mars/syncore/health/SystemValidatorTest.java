package dev.mars.syncore.health;

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
import dev.mars.syncore.api.health.ComponentValidation;
import dev.mars.syncore.api.health.DependencyIssue;
import dev.mars.syncore.api.health.ValidateSystemRequest;
import dev.mars.syncore.api.health.ValidationResult;
import dev.mars.syncore.api.messaging.Priority;
import dev.mars.syncore.api.operation.Operation;
import dev.mars.syncore.api.operation.OperationValidation;
import dev.mars.syncore.api.operation.RiskLevel;
import dev.mars.syncore.api.state.SystemMetrics;
import dev.mars.syncore.api.state.SystemState;
import dev.mars.syncore.config.SyncoreConfiguration;
import dev.mars.syncore.execution.ExecutionStrategySelector;
import dev.mars.syncore.risk.RiskAssessor;
import dev.mars.syncore.test.StateFixtures;
import dev.mars.syncore.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for system validation: component checks, dependency issues and operational readiness.
 */
@Tag(TestCategories.CORE)
class SystemValidatorTest {

    private final SystemValidator validator = new SystemValidator(new RiskAssessor(),
        new ExecutionStrategySelector(SyncoreConfiguration.StrategyConfig.defaults()));

    @Test
    void testHealthySystemIsValidAndReady() {
        SystemState state = StateFixtures.withComponents(
            ComponentStatus.of("db", ComponentState.HEALTHY),
            ComponentStatus.of("api", ComponentState.HEALTHY, "db"));

        ValidationResult result = validator.validate(state, ValidateSystemRequest.defaults());

        assertTrue(result.valid());
        assertTrue(result.errors().isEmpty());
        assertTrue(result.dependencyIssues().isEmpty());
        assertTrue(result.operationalReadiness().ready());
        assertEquals(2, result.operationalReadiness().healthyComponents());
        assertEquals(RiskLevel.LOW, result.operationalReadiness().riskLevel());
        assertTrue(result.operationalReadiness().recommendations().isEmpty());
    }

    @Test
    void testFailedDependencyReportsComponentErrorsAndWarning() {
        SystemState state = StateFixtures.withComponents(
            ComponentStatus.of("db", ComponentState.FAILED),
            ComponentStatus.of("api", ComponentState.HEALTHY, "db"));

        ValidationResult result = validator.validate(state, ValidateSystemRequest.defaults());

        assertFalse(result.valid());
        assertTrue(result.errors().contains("db: Component is failed"));
        assertTrue(result.errors().contains("api: Dependencies not satisfied: db"));

        ComponentValidation api = result.componentValidations().get("api");
        assertTrue(api.healthy());
        assertFalse(api.dependenciesSatisfied());
        assertFalse(api.canStart());

        assertEquals(1, result.dependencyIssues().size());
        DependencyIssue issue = result.dependencyIssues().get(0);
        assertEquals("api", issue.componentId());
        assertEquals(DependencyIssue.Severity.WARNING, issue.severity());
        assertEquals(List.of("db"), issue.blockedBy());
        assertTrue(result.warnings().contains(issue.message()));
    }

    @Test
    @DisplayName("A failed component with unsatisfied dependencies is an error, not a warning")
    void testFailedBlockedComponentIsError() {
        SystemState state = StateFixtures.withComponents(
            ComponentStatus.of("worker", ComponentState.FAILED, "queue"));

        ValidationResult result = validator.validate(state, ValidateSystemRequest.defaults());

        DependencyIssue issue = result.dependencyIssues().get(0);
        assertEquals(DependencyIssue.Severity.ERROR, issue.severity());
        assertTrue(issue.message().startsWith("worker cannot start"));
        assertTrue(result.errors().contains(issue.message()));
    }

    @Test
    void testDependencyChecksCanBeSkipped() {
        SystemState state = StateFixtures.withComponents(
            ComponentStatus.of("api", ComponentState.HEALTHY, "missing"));

        ValidationResult result = validator.validate(state,
            new ValidateSystemRequest(false, true, null, false));

        assertTrue(result.valid());
        assertTrue(result.dependencyIssues().isEmpty());
        assertTrue(result.componentValidations().get("api").dependenciesSatisfied());
    }

    @Test
    void testCriticalComponentDownBlocksReadiness() {
        SystemState state = StateFixtures.withComponents(
            ComponentStatus.of("db", ComponentState.DEGRADED),
            ComponentStatus.of("a", ComponentState.HEALTHY, "db"),
            ComponentStatus.of("b", ComponentState.HEALTHY, "db"),
            ComponentStatus.of("c", ComponentState.HEALTHY, "db"));

        ValidationResult result = validator.validate(state, ValidateSystemRequest.defaults());

        assertFalse(result.operationalReadiness().ready());
        assertEquals(List.of("db"), result.operationalReadiness().criticalComponentsDown());
        assertEquals(RiskLevel.MEDIUM, result.operationalReadiness().riskLevel());
        assertTrue(result.operationalReadiness().recommendations().contains("Restore critical components: db"));
    }

    @Test
    void testTwoDependentsIsNotCritical() {
        SystemState state = StateFixtures.withComponents(
            ComponentStatus.of("db", ComponentState.FAILED),
            ComponentStatus.of("a", ComponentState.HEALTHY, "db"),
            ComponentStatus.of("b", ComponentState.HEALTHY, "db"));

        ValidationResult result = validator.validate(state, ValidateSystemRequest.defaults());

        assertTrue(result.operationalReadiness().criticalComponentsDown().isEmpty());
        assertTrue(result.operationalReadiness().ready());
    }

    @Test
    void testStrictModeRequiresReadiness() {
        SystemState empty = SystemState.initial();

        ValidationResult lenient = validator.validate(empty, ValidateSystemRequest.defaults());
        assertTrue(lenient.valid());
        assertFalse(lenient.operationalReadiness().ready());

        ValidationResult strict = validator.validate(empty, ValidateSystemRequest.strict());
        assertFalse(strict.valid());
        assertTrue(strict.errors().contains("System is not operationally ready"));
    }

    @Test
    void testLowHealthRecommendations() {
        SystemState state = StateFixtures.healthy("a").withHealth(40);

        ValidationResult result = validator.validate(state, ValidateSystemRequest.defaults());

        assertEquals(RiskLevel.CRITICAL, result.operationalReadiness().riskLevel());
        assertFalse(result.operationalReadiness().ready());
        List<String> recommendations = result.operationalReadiness().recommendations();
        assertTrue(recommendations.contains("System health critical - perform full system check"));
        assertTrue(recommendations.contains("High risk level detected - defer non-critical operations"));
    }

    @Test
    void testHighErrorRateRecommendation() {
        SystemState state = StateFixtures.healthy("a")
            .withMetrics(new SystemMetrics(8, 6, 2, 0, 8.0, 100.0, 0.25));

        ValidationResult result = validator.validate(state, ValidateSystemRequest.defaults());

        assertTrue(result.operationalReadiness().recommendations()
            .contains("High error rate (25.0%) - review error logs"));
    }

    @Test
    void testReadinessUsesTargetOperationRisk() {
        SystemState state = StateFixtures.withComponents(
            ComponentStatus.of("a", ComponentState.HEALTHY),
            ComponentStatus.of("b", ComponentState.FAILED));
        Operation operation = Operation.of("op", "sync", Priority.P2, "b");

        ValidationResult result = validator.validate(state, ValidateSystemRequest.defaults().forOperation(operation));

        assertEquals(RiskLevel.MEDIUM, result.operationalReadiness().riskLevel());
        assertTrue(result.operationalReadiness().riskFactors().contains("No healthy participants available"));
    }

    @Test
    void testValidateOperationRecommendations() {
        SystemState state = StateFixtures.withComponents(
            ComponentStatus.of("a", ComponentState.HEALTHY),
            ComponentStatus.of("b", ComponentState.FAILED));

        OperationValidation queued = validator.validateOperation(Operation.of("op-1", "t", Priority.P2, "b"), state);
        assertFalse(queued.canExecute());
        assertEquals("Operation cannot be executed now - will be queued", queued.recommendation());

        OperationValidation safe = validator.validateOperation(Operation.of("op-2", "t", Priority.P2, "a"), state);
        assertTrue(safe.canExecute());
        assertTrue(safe.shouldProceed());
        assertEquals("Operation can proceed safely", safe.recommendation());

        OperationValidation risky = validator.validateOperation(
            Operation.of("op-3", "t", Priority.P2, "a"), state.withHealth(60));
        assertTrue(risky.canExecute());
        assertFalse(risky.shouldProceed());
        assertEquals("Operation execution not recommended due to high risk", risky.recommendation());
    }
}

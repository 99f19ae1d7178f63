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
import dev.mars.syncore.api.component.StartCheck;
import dev.mars.syncore.api.health.ComponentValidation;
import dev.mars.syncore.api.health.DependencyIssue;
import dev.mars.syncore.api.health.OperationalReadiness;
import dev.mars.syncore.api.health.ValidateSystemRequest;
import dev.mars.syncore.api.health.ValidationResult;
import dev.mars.syncore.api.operation.ExecutionStrategy;
import dev.mars.syncore.api.operation.Operation;
import dev.mars.syncore.api.operation.OperationValidation;
import dev.mars.syncore.api.operation.RiskAssessment;
import dev.mars.syncore.api.operation.RiskLevel;
import dev.mars.syncore.api.operation.StrategyDecision;
import dev.mars.syncore.api.state.SystemState;
import dev.mars.syncore.execution.ExecutionStrategySelector;
import dev.mars.syncore.registry.DependencyRules;
import dev.mars.syncore.risk.RiskAssessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Validate-system use case: checks every component and its dependencies, then assesses
 * operational readiness. Problems are reported in the result; validation itself does not throw
 * for them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class SystemValidator {
    private static final Logger logger = LoggerFactory.getLogger(SystemValidator.class);

    private static final int CRITICAL_DEPENDENT_COUNT = 2;
    private static final double HIGH_ERROR_RATE = 0.1;
    private static final int HIGH_ACTIVE_OPERATIONS = 10;

    private final RiskAssessor riskAssessor;
    private final ExecutionStrategySelector strategySelector;

    public SystemValidator(RiskAssessor riskAssessor, ExecutionStrategySelector strategySelector) {
        this.riskAssessor = riskAssessor;
        this.strategySelector = strategySelector;
    }

    public ValidationResult validate(SystemState state, ValidateSystemRequest request) {
        long startTime = System.currentTimeMillis();
        logger.debug("Executing system validation for {} components (dependencies {}, readiness {})",
            state.components().size(), request.checkDependencies(), request.checkOperationalReadiness());

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Map<String, ComponentValidation> componentValidations = validateAllComponents(state, request.checkDependencies());
        for (ComponentValidation validation : componentValidations.values()) {
            if (!validation.valid()) {
                validation.issues().forEach(issue -> errors.add(validation.componentId() + ": " + issue));
            }
        }

        List<DependencyIssue> dependencyIssues = request.checkDependencies() ? checkDependencies(state) : List.of();
        for (DependencyIssue issue : dependencyIssues) {
            if (issue.severity() == DependencyIssue.Severity.ERROR) {
                errors.add(issue.message());
            } else {
                warnings.add(issue.message());
            }
        }

        OperationalReadiness readiness = request.checkOperationalReadiness()
            ? assessOperationalReadiness(state, request.targetOperation())
            : defaultReadiness(state);

        if (!readiness.ready() && request.strictMode()) {
            errors.add("System is not operationally ready");
        }

        boolean valid = errors.isEmpty() && (!request.strictMode() || readiness.ready());
        long executionTime = System.currentTimeMillis() - startTime;

        logger.info("System validation completed: valid={}, errors={}, warnings={}, dependencyIssues={}, {}ms",
            valid, errors.size(), warnings.size(), dependencyIssues.size(), executionTime);

        return new ValidationResult(valid, errors, warnings, componentValidations, dependencyIssues, readiness, executionTime);
    }

    /**
     * Side-effect free recommendation for a single operation.
     */
    public OperationValidation validateOperation(Operation operation, SystemState state) {
        RiskAssessment risk = riskAssessor.assessOperationRisk(operation, state);
        StrategyDecision decision = strategySelector.decideStrategy(operation, state);
        boolean canExecute = decision.strategy() != ExecutionStrategy.QUEUED;
        boolean shouldProceed = riskAssessor.shouldProceed(risk.riskLevel(), operation.priority());

        String recommendation;
        if (!canExecute) {
            recommendation = "Operation cannot be executed now - will be queued";
        } else if (!shouldProceed) {
            recommendation = "Operation execution not recommended due to high risk";
        } else {
            recommendation = "Operation can proceed safely";
        }
        return new OperationValidation(canExecute, shouldProceed, risk, recommendation);
    }

    private Map<String, ComponentValidation> validateAllComponents(SystemState state, boolean checkDependencies) {
        Map<String, ComponentValidation> validations = new LinkedHashMap<>();
        for (ComponentStatus component : state.components().values()) {
            List<String> issues = new ArrayList<>();
            boolean healthy = component.isHealthy();
            if (!healthy) {
                issues.add("Component is " + component.state().name().toLowerCase(Locale.ROOT));
            }

            boolean dependenciesSatisfied = true;
            boolean canStart = true;
            if (checkDependencies) {
                StartCheck startCheck = DependencyRules.canStart(component, state.components());
                dependenciesSatisfied = startCheck.canStart();
                canStart = startCheck.canStart();
                if (!startCheck.canStart()) {
                    issues.add("Dependencies not satisfied: " + String.join(", ", startCheck.blockedBy()));
                    issues.add(startCheck.reason());
                }
            }

            validations.put(component.id(), new ComponentValidation(
                component.id(), issues.isEmpty(), healthy, dependenciesSatisfied, canStart, issues));
        }
        return validations;
    }

    private List<DependencyIssue> checkDependencies(SystemState state) {
        List<DependencyIssue> issues = new ArrayList<>();
        for (ComponentStatus component : state.components().values()) {
            StartCheck startCheck = DependencyRules.canStart(component, state.components());
            if (!startCheck.canStart()) {
                DependencyIssue.Severity severity = component.state() == ComponentState.FAILED
                    ? DependencyIssue.Severity.ERROR
                    : DependencyIssue.Severity.WARNING;
                issues.add(new DependencyIssue(component.id(), startCheck.blockedBy(), severity,
                    component.id() + " cannot start: " + startCheck.reason()));
            }
        }
        return issues;
    }

    private OperationalReadiness assessOperationalReadiness(SystemState state, Operation targetOperation) {
        int healthyComponents = (int) state.countHealthy();
        int totalComponents = state.components().size();

        List<String> criticalComponentsDown = state.components().values().stream()
            .filter(c -> c.state().isDown())
            .filter(c -> DependencyRules.dependentCount(c.id(), state.components()) > CRITICAL_DEPENDENT_COUNT)
            .map(ComponentStatus::id)
            .toList();

        RiskLevel riskLevel = RiskLevel.LOW;
        List<String> riskFactors = new ArrayList<>();
        if (targetOperation != null) {
            RiskAssessment assessment = riskAssessor.assessOperationRisk(targetOperation, state);
            riskLevel = assessment.riskLevel();
            riskFactors.addAll(assessment.factors());
        } else if (state.health() < RiskAssessor.CRITICAL_HEALTH) {
            riskLevel = RiskLevel.CRITICAL;
            riskFactors.add("System health below 50%");
        } else if (state.health() < RiskAssessor.DEGRADED_HEALTH) {
            riskLevel = RiskLevel.HIGH;
            riskFactors.add("System health below 70%");
        } else if (!criticalComponentsDown.isEmpty()) {
            riskLevel = RiskLevel.MEDIUM;
            riskFactors.add(criticalComponentsDown.size() + " critical components down");
        }

        List<String> recommendations = recommendations(state, criticalComponentsDown, riskLevel);
        boolean ready = healthyComponents > 0 && criticalComponentsDown.isEmpty() && riskLevel != RiskLevel.CRITICAL;

        return new OperationalReadiness(ready, healthyComponents, totalComponents, criticalComponentsDown,
            riskLevel, riskFactors, recommendations);
    }

    private List<String> recommendations(SystemState state, List<String> criticalComponentsDown, RiskLevel riskLevel) {
        List<String> recommendations = new ArrayList<>();
        if (!criticalComponentsDown.isEmpty()) {
            recommendations.add("Restore critical components: " + String.join(", ", criticalComponentsDown));
        }
        if (state.health() < RiskAssessor.CRITICAL_HEALTH) {
            recommendations.add("System health critical - perform full system check");
        } else if (state.health() < RiskAssessor.DEGRADED_HEALTH) {
            recommendations.add("System health degraded - investigate component issues");
        }
        double errorRate = state.metrics().errorRate();
        if (errorRate > HIGH_ERROR_RATE) {
            recommendations.add(String.format(Locale.ROOT, "High error rate (%.1f%%) - review error logs", errorRate * 100.0));
        }
        if (state.activeOperations().size() > HIGH_ACTIVE_OPERATIONS) {
            recommendations.add("High number of active operations - consider reducing load");
        }
        if (riskLevel.isAtLeast(RiskLevel.HIGH)) {
            recommendations.add("High risk level detected - defer non-critical operations");
        }
        return recommendations;
    }

    private OperationalReadiness defaultReadiness(SystemState state) {
        int healthyComponents = (int) state.countHealthy();
        return new OperationalReadiness(healthyComponents > 0, healthyComponents, state.components().size(),
            List.of(), RiskLevel.LOW, List.of(), List.of());
    }
}

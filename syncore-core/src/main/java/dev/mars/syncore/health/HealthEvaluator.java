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
import dev.mars.syncore.api.health.ComponentCheckResult;
import dev.mars.syncore.api.health.ComponentTransition;
import dev.mars.syncore.api.state.SystemState;
import dev.mars.syncore.config.SyncoreConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes component state transitions and aggregate system health.
 *
 * <p>Health is {@code round(100 * (w * componentScore + (1 - w) * (1 - errorRate)))} where
 * {@code componentScore} counts healthy components fully and degraded or starting components at
 * half weight, and {@code w} is the configured component weight. A failed component contributes
 * nothing, so adding failures never raises health.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class HealthEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(HealthEvaluator.class);

    private final double componentWeight;
    private final Clock clock;
    private final Map<String, ComponentHealthCheck> healthChecks = new ConcurrentHashMap<>();

    public HealthEvaluator(SyncoreConfiguration.HealthConfig config, Clock clock) {
        this.componentWeight = config.getComponentWeight();
        this.clock = clock;
    }

    public void registerHealthCheck(String componentId, ComponentHealthCheck healthCheck) {
        healthChecks.put(componentId, healthCheck);
        logger.info("Registered health check for component: {}", componentId);
    }

    public void removeHealthCheck(String componentId) {
        if (healthChecks.remove(componentId) != null) {
            logger.debug("Removed health check for component: {}", componentId);
        }
    }

    /**
     * Runs every registered check against the snapshot. Components without a check keep their state.
     */
    public HealthEvaluation evaluate(SystemState state) {
        List<ComponentCheckResult> results = new ArrayList<>();
        for (ComponentStatus component : state.components().values()) {
            ComponentHealthCheck healthCheck = healthChecks.get(component.id());
            if (healthCheck != null) {
                results.add(runCheck(component, healthCheck));
            }
        }
        return evaluate(state, results);
    }

    /**
     * Applies externally supplied results. Results for unknown components are reported as warnings.
     */
    public HealthEvaluation evaluate(SystemState state, Collection<ComponentCheckResult> results) {
        Instant now = clock.instant();
        Map<String, ComponentStatus> components = new LinkedHashMap<>(state.components());
        Map<String, ComponentStatus> evaluated = new LinkedHashMap<>();
        List<ComponentTransition> transitions = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (ComponentCheckResult result : results) {
            ComponentStatus current = components.get(result.componentId());
            if (current == null) {
                warnings.add("Health result for unknown component: " + result.componentId());
                continue;
            }
            if (current.state() != result.newState()) {
                transitions.add(new ComponentTransition(
                    current.id(), current.state(), result.newState(), result.message()));
                logger.info("Component {} transitioned {} -> {}", current.id(), current.state(), result.newState());
            }
            evaluated.putIfAbsent(current.id(), state.components().get(current.id()));
            components.put(current.id(), current.withState(result.newState(), now));
        }

        int health = calculateHealth(components.values(), state.metrics().errorRate());
        return new HealthEvaluation(components, evaluated, health, transitions, warnings);
    }

    public int calculateHealth(Collection<ComponentStatus> components, double errorRate) {
        double componentScore;
        if (components.isEmpty()) {
            componentScore = 1.0;
        } else {
            double score = 0.0;
            for (ComponentStatus component : components) {
                score += switch (component.state()) {
                    case HEALTHY -> 1.0;
                    case DEGRADED, STARTING -> 0.5;
                    case FAILED -> 0.0;
                };
            }
            componentScore = score / components.size();
        }
        double clampedErrorRate = Math.min(1.0, Math.max(0.0, errorRate));
        double health = 100.0 * (componentWeight * componentScore + (1.0 - componentWeight) * (1.0 - clampedErrorRate));
        return (int) Math.round(Math.min(100.0, Math.max(0.0, health)));
    }

    private ComponentCheckResult runCheck(ComponentStatus component, ComponentHealthCheck healthCheck) {
        try {
            ComponentState observed = healthCheck.check(component);
            if (observed == null) {
                logger.warn("Health check returned no state: {}", component.id());
                return new ComponentCheckResult(component.id(), ComponentState.FAILED, "Health check returned no state");
            }
            return new ComponentCheckResult(component.id(), observed, null);
        } catch (Exception e) {
            logger.warn("Health check error: {}", component.id(), e);
            return new ComponentCheckResult(component.id(), ComponentState.FAILED,
                "Health check threw: " + e.getMessage());
        }
    }
}

package dev.mars.syncore.risk;

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
import dev.mars.syncore.api.operation.Operation;
import dev.mars.syncore.api.operation.RiskAssessment;
import dev.mars.syncore.api.operation.RiskLevel;
import dev.mars.syncore.api.state.SystemState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores the risk of executing an operation against a system snapshot and gates admission.
 *
 * <p>Score contributions:</p>
 * <ul>
 *   <li>participants: +1 if any is not healthy, +2 if at least half are not, +4 if none is
 *       healthy (only the highest applicable tier counts)</li>
 *   <li>load: +3 above 80 operations per hour, +2 above 50</li>
 *   <li>topmost priority tier: +1</li>
 * </ul>
 * <p>A score of 7 or more is critical, 5 high, 3 medium, otherwise low. System health below 70
 * raises the level to at least high, below 50 to critical.</p>
 *
 * <p>Every input can only add to the score, so degrading a participant never lowers the level.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class RiskAssessor {
    private static final Logger logger = LoggerFactory.getLogger(RiskAssessor.class);

    public static final int CRITICAL_HEALTH = 50;
    public static final int DEGRADED_HEALTH = 70;
    public static final double VERY_HIGH_LOAD = 80.0;
    public static final double HIGH_LOAD = 50.0;

    public RiskAssessment assessOperationRisk(Operation operation, SystemState state) {
        List<String> factors = new ArrayList<>();
        int score = 0;

        List<String> participants = operation.participants();
        long unhealthy = participants.stream().filter(p -> !state.isComponentHealthy(p)).count();
        if (participants.isEmpty() || unhealthy == participants.size()) {
            score += 4;
            factors.add("No healthy participants available");
        } else if (unhealthy * 2 >= participants.size()) {
            score += 2;
            factors.add("At least 50% of participants unhealthy");
        } else if (unhealthy > 0) {
            score += 1;
            factors.add(unhealthy + " participant(s) not healthy");
        }

        double load = state.metrics().operationsPerHour();
        if (load > VERY_HIGH_LOAD) {
            score += 3;
            factors.add("Very high system load (>80 ops/hour)");
        } else if (load > HIGH_LOAD) {
            score += 2;
            factors.add("High system load (>50 ops/hour)");
        }

        if (operation.priority().isTopTier()) {
            score += 1;
            factors.add("Critical priority operation");
        }

        RiskLevel level = levelForScore(score);

        if (state.health() < CRITICAL_HEALTH) {
            level = RiskLevel.CRITICAL;
            factors.add("System health below 50%");
        } else if (state.health() < DEGRADED_HEALTH) {
            level = RiskLevel.max(level, RiskLevel.HIGH);
            factors.add("System health below 70%");
        }

        logger.debug("Assessed operation {} risk: {} (score {}, factors {})", operation.id(), level, score, factors);
        return new RiskAssessment(level, factors);
    }

    /**
     * Admission gate without an explicit override.
     */
    public boolean shouldProceed(RiskLevel riskLevel, Priority priority) {
        return shouldProceed(riskLevel, priority, false);
    }

    /**
     * Admission gate. Low and medium risk always proceed; high risk proceeds for P0 and P1;
     * critical risk proceeds only for P0 with an explicit override.
     */
    public boolean shouldProceed(RiskLevel riskLevel, Priority priority, boolean override) {
        return switch (riskLevel) {
            case LOW, MEDIUM -> true;
            case HIGH -> priority == Priority.P0 || priority == Priority.P1;
            case CRITICAL -> priority.isTopTier() && override;
        };
    }

    static RiskLevel levelForScore(int score) {
        if (score >= 7) {
            return RiskLevel.CRITICAL;
        } else if (score >= 5) {
            return RiskLevel.HIGH;
        } else if (score >= 3) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}

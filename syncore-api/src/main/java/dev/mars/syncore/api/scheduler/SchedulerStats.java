package dev.mars.syncore.api.scheduler;

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

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Snapshot of fairness scheduler statistics.
 */
public record SchedulerStats(
    long totalSubmitted,
    long totalRejected,
    long totalCompleted,
    long totalFailed,
    double avgWaitTimeMs,
    double avgDurationMs,
    int queueLength,
    int activeTasksCount,
    Map<String, AgentStats> agentBreakdown
) {
    public SchedulerStats {
        agentBreakdown = agentBreakdown == null
            ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(agentBreakdown));
    }
}

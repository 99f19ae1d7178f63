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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A unit of work admitted and ordered by the fairness scheduler.
 *
 * @param taskId             unique task id
 * @param agentId            agent the task is accounted to for quotas and fairness
 * @param priority           base priority, 1 (highest) to 5 (lowest)
 * @param submittedAt        submission time, stamped by the scheduler when null
 * @param estimatedDuration  optional duration estimate
 * @param description        optional description
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public record ScheduledTask(
    String taskId,
    String agentId,
    int priority,
    Instant submittedAt,
    Duration estimatedDuration,
    String description
) {
    public static final int HIGHEST_PRIORITY = 1;
    public static final int LOWEST_PRIORITY = 5;

    public ScheduledTask {
        Objects.requireNonNull(taskId, "Task id cannot be null");
        Objects.requireNonNull(agentId, "Agent id cannot be null");
        if (priority < HIGHEST_PRIORITY || priority > LOWEST_PRIORITY) {
            throw new IllegalArgumentException("Task priority must be between 1 and 5: " + priority);
        }
    }

    public static ScheduledTask of(String taskId, String agentId, int priority) {
        return new ScheduledTask(taskId, agentId, priority, null, null, null);
    }

    public ScheduledTask withSubmittedAt(Instant instant) {
        return new ScheduledTask(taskId, agentId, priority, instant, estimatedDuration, description);
    }
}

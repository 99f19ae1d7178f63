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
import java.util.Objects;

/**
 * Completion report for a scheduled task.
 *
 * @param duration  actual run time, measured by the scheduler when null
 */
public record TaskResult(String taskId, String agentId, boolean success, Duration duration, String error) {

    public TaskResult {
        Objects.requireNonNull(taskId, "Task id cannot be null");
    }

    public static TaskResult success(String taskId, String agentId, Duration duration) {
        return new TaskResult(taskId, agentId, true, duration, null);
    }

    public static TaskResult failure(String taskId, String agentId, String error) {
        return new TaskResult(taskId, agentId, false, null, error);
    }
}

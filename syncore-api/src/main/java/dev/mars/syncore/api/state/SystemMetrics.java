package dev.mars.syncore.api.state;

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

/**
 * Operational counters carried in {@link SystemState}.
 *
 * @param operationsStarted       operations admitted since start
 * @param operationsCompleted     operations that reported success
 * @param operationsFailed        operations that reported failure or timed out
 * @param operationsTimedOut      operations evicted after their deadline
 * @param operationsPerHour       operations started in the trailing hour
 * @param averageOperationTimeMs  mean duration of completed operations
 * @param errorRate               failed / (completed + failed), 0 when nothing finished
 */
public record SystemMetrics(
    long operationsStarted,
    long operationsCompleted,
    long operationsFailed,
    long operationsTimedOut,
    double operationsPerHour,
    double averageOperationTimeMs,
    double errorRate
) {
    public SystemMetrics {
        if (errorRate < 0.0 || errorRate > 1.0) {
            throw new IllegalArgumentException("errorRate must be between 0 and 1: " + errorRate);
        }
    }

    public static SystemMetrics initial() {
        return new SystemMetrics(0, 0, 0, 0, 0.0, 0.0, 0.0);
    }

    public SystemMetrics withOperationsPerHour(double value) {
        return new SystemMetrics(operationsStarted, operationsCompleted, operationsFailed, operationsTimedOut,
            value, averageOperationTimeMs, errorRate);
    }
}

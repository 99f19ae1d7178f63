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

import dev.mars.syncore.api.operation.ExecutionStrategy;
import dev.mars.syncore.api.operation.Operation;

import java.time.Instant;
import java.util.List;

/**
 * An admitted operation tracked until it completes, fails or passes its deadline.
 *
 * @param operation  the planned operation
 * @param strategy   chosen execution strategy
 * @param assignees  components that received work, empty while queued
 * @param startedAt  admission time
 * @param deadline   time after which the operation is evicted
 * @param queued     true while the operation is held by the scheduler
 */
public record ActiveOperation(
    Operation operation,
    ExecutionStrategy strategy,
    List<String> assignees,
    Instant startedAt,
    Instant deadline,
    boolean queued
) {
    public ActiveOperation {
        assignees = assignees == null ? List.of() : List.copyOf(assignees);
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(deadline);
    }

    public ActiveOperation dispatched(List<String> newAssignees) {
        return new ActiveOperation(operation, strategy, newAssignees, startedAt, deadline, queued);
    }
}

package dev.mars.syncore.api.events;

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
 * Payload of operation lifecycle events (started, queued, rejected, completed, failed, timed out).
 *
 * @param operation     the operation
 * @param strategy      execution strategy, null when rejected before planning completed
 * @param participants  components involved
 * @param detail        error or reason text, null when not applicable
 * @param timestamp     event time
 */
public record OperationEvent(
    Operation operation,
    ExecutionStrategy strategy,
    List<String> participants,
    String detail,
    Instant timestamp
) {
    public OperationEvent {
        participants = participants == null ? List.of() : List.copyOf(participants);
    }
}

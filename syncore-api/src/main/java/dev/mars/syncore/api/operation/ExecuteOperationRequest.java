package dev.mars.syncore.api.operation;

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

import java.util.Objects;

/**
 * Request to plan (and optionally admit) an operation.
 *
 * @param operation       the operation
 * @param dryRun          plan only, do not enrich or admit
 * @param forceExecution  bypass the participant-availability gate and act as the explicit risk override
 */
public record ExecuteOperationRequest(Operation operation, boolean dryRun, boolean forceExecution) {

    public ExecuteOperationRequest {
        Objects.requireNonNull(operation, "Operation cannot be null");
    }

    public static ExecuteOperationRequest of(Operation operation) {
        return new ExecuteOperationRequest(operation, false, false);
    }
}

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
 * Completion report for an active operation.
 */
public record OperationResult(String operationId, boolean success, long durationMs, String error) {

    public OperationResult {
        Objects.requireNonNull(operationId, "Operation id cannot be null");
    }

    public static OperationResult success(String operationId, long durationMs) {
        return new OperationResult(operationId, true, durationMs, null);
    }

    public static OperationResult failure(String operationId, long durationMs, String error) {
        return new OperationResult(operationId, false, durationMs, error);
    }
}

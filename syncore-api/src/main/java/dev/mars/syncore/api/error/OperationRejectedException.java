package dev.mars.syncore.api.error;

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

import dev.mars.syncore.api.operation.ExecuteOperationResponse;

/**
 * Signals that the coordinator refused to admit an operation. The planning response, when one was
 * produced, is attached for inspection.
 */
public class OperationRejectedException extends CoordinationException {

    private final String operationId;
    private final transient ExecuteOperationResponse response;

    public OperationRejectedException(String operationId, SyncoreError error, ExecuteOperationResponse response) {
        super(error);
        this.operationId = operationId;
        this.response = response;
    }

    public String getOperationId() {
        return operationId;
    }

    public ExecuteOperationResponse getResponse() {
        return response;
    }
}

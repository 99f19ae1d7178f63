package dev.mars.syncore.execution;

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

import dev.mars.syncore.api.error.SyncoreError;
import dev.mars.syncore.api.error.SyncoreErrorCodes;
import dev.mars.syncore.api.operation.ExecuteOperationRequest;
import dev.mars.syncore.api.operation.ExecuteOperationResponse;
import dev.mars.syncore.api.operation.ExecutionPlan;
import dev.mars.syncore.api.operation.ExecutionStrategy;
import dev.mars.syncore.api.operation.RiskAssessment;
import dev.mars.syncore.api.operation.RiskLevel;
import dev.mars.syncore.api.operation.StrategyDecision;
import dev.mars.syncore.api.state.SystemState;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Plans a batch of operations with settle-all semantics. A request that throws is turned into an
 * unsuccessful response of the same shape; the remaining requests are unaffected.
 */
public class BatchOperationPlanner {
    private static final Logger logger = LoggerFactory.getLogger(BatchOperationPlanner.class);

    private final OperationPlanner planner;

    public BatchOperationPlanner(OperationPlanner planner) {
        this.planner = planner;
    }

    public Future<List<ExecuteOperationResponse>> planAll(SystemState state, List<ExecuteOperationRequest> requests) {
        logger.info("Executing batch operation planning for {} operations", requests.size());

        List<Future<ExecuteOperationResponse>> futures = new ArrayList<>(requests.size());
        for (ExecuteOperationRequest request : requests) {
            futures.add(planOne(state, request)
                .recover(error -> {
                    logger.warn("Batch planning failed for operation {}: {}", request.operation().id(), error.getMessage());
                    return Future.succeededFuture(errorResponse(request, error));
                }));
        }

        return Future.all(futures)
            .map(composite -> futures.stream().map(Future::result).toList());
    }

    private Future<ExecuteOperationResponse> planOne(SystemState state, ExecuteOperationRequest request) {
        try {
            return Future.succeededFuture(planner.plan(state, request));
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    private static ExecuteOperationResponse errorResponse(ExecuteOperationRequest request, Throwable error) {
        return new ExecuteOperationResponse(
            false,
            request.operation(),
            new StrategyDecision(ExecutionStrategy.QUEUED, List.of(), request.operation().priority(), "Batch execution error"),
            new RiskAssessment(RiskLevel.CRITICAL, List.of("Batch execution error")),
            new ExecutionPlan(ExecutionStrategy.QUEUED, List.of(), List.of(), null, 0L, false, false),
            0L,
            SyncoreError.of(SyncoreErrorCodes.BATCH_EXECUTION_FAILED, String.valueOf(error.getMessage())));
    }
}

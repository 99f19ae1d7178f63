package dev.mars.syncore.api;

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

import dev.mars.syncore.api.component.ComponentStatus;
import dev.mars.syncore.api.health.CheckHealthResponse;
import dev.mars.syncore.api.health.ComponentCheckResult;
import dev.mars.syncore.api.health.ValidateSystemRequest;
import dev.mars.syncore.api.health.ValidationResult;
import dev.mars.syncore.api.messaging.RouteMessageResponse;
import dev.mars.syncore.api.messaging.RoutingStatus;
import dev.mars.syncore.api.messaging.UnifiedMessage;
import dev.mars.syncore.api.operation.Operation;
import dev.mars.syncore.api.operation.OperationResult;
import dev.mars.syncore.api.scheduler.AgentQuota;
import dev.mars.syncore.api.scheduler.SchedulerStats;
import dev.mars.syncore.api.state.SystemState;
import dev.mars.syncore.api.state.SystemStatusSummary;
import io.vertx.core.Future;

import java.util.List;

/**
 * Entry point for application code driving the coordination core.
 *
 * <p>Asynchronous methods never throw for expected failures. Rejections surface as failed
 * futures carrying a {@link dev.mars.syncore.api.error.CoordinationException}; validation and
 * health problems are reported inside the returned results.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public interface CoordinationService {

    /**
     * Inserts or replaces a component. Registering the same id twice keeps only the latest status.
     */
    void registerComponent(ComponentStatus status);

    /**
     * Removes a component. Unknown ids are ignored.
     */
    void unregisterComponent(String componentId);

    /**
     * Routes a message and places it on the queue for the chosen mode.
     * Fails with {@code QUEUE_FULL} when that queue is at capacity.
     */
    Future<RouteMessageResponse> sendMessage(UnifiedMessage message);

    /**
     * Plans and admits an operation, returning its id.
     * Fails with an {@link dev.mars.syncore.api.error.OperationRejectedException} when refused.
     */
    Future<String> startOperation(Operation operation);

    /**
     * As {@link #startOperation(Operation)}, with an explicit override of the availability and risk gates.
     */
    Future<String> startOperation(Operation operation, boolean forceExecution);

    /**
     * Reports completion of an active operation.
     *
     * @return true if the operation was active
     */
    boolean completeOperation(OperationResult result);

    Future<CheckHealthResponse> checkHealth();

    Future<CheckHealthResponse> checkHealth(List<ComponentCheckResult> results);

    Future<ValidationResult> validateSystem();

    Future<ValidationResult> validateSystem(ValidateSystemRequest request);

    void setAgentQuota(AgentQuota quota);

    SystemState getSystemState();

    SystemStatusSummary getSystemStatus();

    RoutingStatus getRoutingStatus();

    SchedulerStats getSchedulerStats();

    /**
     * Cancels background timers and stops the scheduler. Safe to call more than once.
     */
    Future<Void> shutdown();
}

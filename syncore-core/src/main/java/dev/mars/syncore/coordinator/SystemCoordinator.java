package dev.mars.syncore.coordinator;

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

import dev.mars.syncore.api.CoordinationService;
import dev.mars.syncore.api.component.ComponentStatus;
import dev.mars.syncore.api.error.CoordinationException;
import dev.mars.syncore.api.error.OperationRejectedException;
import dev.mars.syncore.api.error.SyncoreError;
import dev.mars.syncore.api.error.SyncoreErrorCodes;
import dev.mars.syncore.api.events.ComponentEvent;
import dev.mars.syncore.api.events.CoordinationEvents;
import dev.mars.syncore.api.events.HealthUpdatedEvent;
import dev.mars.syncore.api.events.MessageRoutedEvent;
import dev.mars.syncore.api.events.MetricsSnapshot;
import dev.mars.syncore.api.events.OperationDispatch;
import dev.mars.syncore.api.events.OperationEvent;
import dev.mars.syncore.api.health.CheckHealthResponse;
import dev.mars.syncore.api.health.ComponentCheckResult;
import dev.mars.syncore.api.health.ValidateSystemRequest;
import dev.mars.syncore.api.health.ValidationResult;
import dev.mars.syncore.api.messaging.RouteMessageRequest;
import dev.mars.syncore.api.messaging.RouteMessageResponse;
import dev.mars.syncore.api.messaging.RoutingMetrics;
import dev.mars.syncore.api.messaging.RoutingMode;
import dev.mars.syncore.api.messaging.RoutingStatus;
import dev.mars.syncore.api.messaging.UnifiedMessage;
import dev.mars.syncore.api.operation.ExecuteOperationRequest;
import dev.mars.syncore.api.operation.ExecuteOperationResponse;
import dev.mars.syncore.api.operation.ExecutionPlan;
import dev.mars.syncore.api.operation.ExecutionStrategy;
import dev.mars.syncore.api.operation.Operation;
import dev.mars.syncore.api.operation.OperationResult;
import dev.mars.syncore.api.operation.OperationValidation;
import dev.mars.syncore.api.operation.WorkloadAssignment;
import dev.mars.syncore.api.scheduler.AgentQuota;
import dev.mars.syncore.api.scheduler.ScheduledTask;
import dev.mars.syncore.api.scheduler.SchedulerStats;
import dev.mars.syncore.api.scheduler.TaskResult;
import dev.mars.syncore.api.state.ActiveOperation;
import dev.mars.syncore.api.state.SystemMetrics;
import dev.mars.syncore.api.state.SystemState;
import dev.mars.syncore.api.state.SystemStatusSummary;
import dev.mars.syncore.config.SyncoreConfiguration;
import dev.mars.syncore.events.CoordinationEventPublisher;
import dev.mars.syncore.execution.BatchOperationPlanner;
import dev.mars.syncore.execution.ExecutionStrategySelector;
import dev.mars.syncore.execution.OperationPlanner;
import dev.mars.syncore.health.ComponentHealthCheck;
import dev.mars.syncore.health.HealthEvaluation;
import dev.mars.syncore.health.HealthEvaluator;
import dev.mars.syncore.health.SystemValidator;
import dev.mars.syncore.metrics.CoordinationMetrics;
import dev.mars.syncore.registry.ComponentRegistry;
import dev.mars.syncore.risk.RiskAssessor;
import dev.mars.syncore.routing.BatchMessageRouter;
import dev.mars.syncore.routing.MessageRouter;
import dev.mars.syncore.routing.RoutingDecider;
import dev.mars.syncore.scheduler.FairnessScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrator owning the {@link SystemState} and the message and operation lifecycle.
 *
 * <p>State is an immutable snapshot replaced atomically. All mutations go through
 * {@code stateLock}, so there is exactly one writer at a time while readers use the current
 * snapshot without locking. Collaborators receive snapshots and return decisions.</p>
 *
 * <p>Routed messages are appended to one bounded queue per {@link RoutingMode}. Operations are
 * planned by {@link OperationPlanner}, recorded in {@code activeOperations} with a deadline and
 * dispatched on the event bus as {@code operation:execute:<componentId>}. Queued operations are
 * admitted to the {@link FairnessScheduler} and dispatched by a periodic timer.</p>
 *
 * <p>Background timers (health re-check with deadline eviction, queued dispatch, metrics export)
 * are Vert.x periodic timers started by {@link #start()} and cancelled by {@link #shutdown()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class SystemCoordinator implements CoordinationService, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SystemCoordinator.class);

    private static final Duration ONE_HOUR = Duration.ofHours(1);

    private final Vertx vertx;
    private final Clock clock;
    private final SyncoreConfiguration.RoutingConfig routingConfig;
    private final SyncoreConfiguration.HealthConfig healthConfig;
    private final SyncoreConfiguration.CoordinatorConfig coordinatorConfig;
    private final SyncoreConfiguration.MetricsConfig metricsConfig;

    private final ComponentRegistry registry = new ComponentRegistry();
    private final HealthEvaluator healthEvaluator;
    private final RiskAssessor riskAssessor;
    private final OperationPlanner operationPlanner;
    private final BatchOperationPlanner batchOperationPlanner;
    private final SystemValidator systemValidator;
    private final MessageRouter messageRouter;
    private final BatchMessageRouter batchMessageRouter;
    private final FairnessScheduler scheduler;
    private final CoordinationEventPublisher eventPublisher;
    private final CoordinationMetrics metrics;

    private final Map<RoutingMode, BlockingQueue<UnifiedMessage>> messageQueues = new EnumMap<>(RoutingMode.class);

    private final ReentrantLock stateLock = new ReentrantLock();
    private volatile SystemState state = SystemState.initial();
    // guarded by stateLock
    private final Deque<Instant> recentStarts = new ArrayDeque<>();
    private long totalOperationTimeMs;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private volatile long healthTimerId = -1;
    private volatile long dispatchTimerId = -1;
    private volatile long metricsTimerId = -1;

    public SystemCoordinator(Vertx vertx, SyncoreConfiguration configuration) {
        this(vertx, configuration, new FairnessScheduler(configuration.getSchedulerConfig()),
            new SimpleMeterRegistry(), Clock.systemUTC());
    }

    public SystemCoordinator(Vertx vertx, SyncoreConfiguration configuration, FairnessScheduler scheduler,
                             MeterRegistry meterRegistry, Clock clock) {
        this.vertx = vertx;
        this.clock = clock;
        this.scheduler = scheduler;
        this.routingConfig = configuration.getRoutingConfig();
        this.healthConfig = configuration.getHealthConfig();
        this.coordinatorConfig = configuration.getCoordinatorConfig();
        this.metricsConfig = configuration.getMetricsConfig();

        this.healthEvaluator = new HealthEvaluator(healthConfig, clock);
        this.riskAssessor = new RiskAssessor();
        ExecutionStrategySelector strategySelector = new ExecutionStrategySelector(configuration.getStrategyConfig());
        this.operationPlanner = new OperationPlanner(riskAssessor, strategySelector);
        this.batchOperationPlanner = new BatchOperationPlanner(operationPlanner);
        this.systemValidator = new SystemValidator(riskAssessor, strategySelector);
        this.messageRouter = new MessageRouter(new RoutingDecider(routingConfig), routingConfig, clock);
        this.batchMessageRouter = new BatchMessageRouter(messageRouter);
        this.eventPublisher = new CoordinationEventPublisher(vertx, coordinatorConfig.getEventBufferSize());

        for (RoutingMode mode : RoutingMode.values()) {
            messageQueues.put(mode, new ArrayBlockingQueue<>(coordinatorConfig.getMessageQueueCapacity()));
        }

        this.metrics = new CoordinationMetrics(metricsConfig.getInstanceId(),
            () -> state.health(),
            () -> state.activeOperations().size(),
            scheduler::getQueueLength,
            scheduler::getActiveCount);
        this.metrics.bindTo(meterRegistry);

        logger.info("System coordinator created (instance {})", metricsConfig.getInstanceId());
    }

    /**
     * Starts the scheduler aging timer and the coordinator's periodic timers. Idempotent.
     */
    public void start() {
        if (shutdown.get()) {
            throw new CoordinationException(SyncoreError.of(SyncoreErrorCodes.SHUTTING_DOWN,
                "Coordinator has been shut down"));
        }
        if (!started.compareAndSet(false, true)) {
            logger.debug("System coordinator already started");
            return;
        }
        scheduler.start();

        if (healthConfig.isEnabled()) {
            healthTimerId = vertx.setPeriodic(healthConfig.getCheckInterval().toMillis(), id -> runHealthTick());
        }
        dispatchTimerId = vertx.setPeriodic(coordinatorConfig.getDispatchInterval().toMillis(),
            id -> dispatchQueuedOperations(coordinatorConfig.getDispatchBatchSize()));
        if (metricsConfig.isEnabled()) {
            metricsTimerId = vertx.setPeriodic(metricsConfig.getExportInterval().toMillis(), id -> runMetricsExport());
        }
        logger.info("System coordinator started: health checks every {}, dispatch every {}, metrics export every {}",
            healthConfig.isEnabled() ? healthConfig.getCheckInterval() : "never",
            coordinatorConfig.getDispatchInterval(),
            metricsConfig.isEnabled() ? metricsConfig.getExportInterval() : "never");
    }

    // ========================================
    // Component registry
    // ========================================

    @Override
    public void registerComponent(ComponentStatus status) {
        stateLock.lock();
        try {
            registry.register(status);
            refreshComponents();
        } finally {
            stateLock.unlock();
        }
        eventPublisher.publish(CoordinationEvents.COMPONENT_REGISTERED,
            new ComponentEvent(status.id(), status, clock.instant()));
    }

    @Override
    public void unregisterComponent(String componentId) {
        boolean removed;
        stateLock.lock();
        try {
            removed = registry.unregister(componentId);
            if (removed) {
                refreshComponents();
            }
        } finally {
            stateLock.unlock();
        }
        if (!removed) {
            logger.debug("Unregister ignored, component not registered: {}", componentId);
            return;
        }
        healthEvaluator.removeHealthCheck(componentId);
        eventPublisher.publish(CoordinationEvents.COMPONENT_UNREGISTERED,
            new ComponentEvent(componentId, null, clock.instant()));
    }

    public void registerHealthCheck(String componentId, ComponentHealthCheck healthCheck) {
        healthEvaluator.registerHealthCheck(componentId, healthCheck);
    }

    // ========================================
    // Messaging
    // ========================================

    @Override
    public Future<RouteMessageResponse> sendMessage(UnifiedMessage message) {
        if (shutdown.get()) {
            return Future.failedFuture(shuttingDown());
        }
        SystemState snapshot = state;
        RouteMessageResponse response = messageRouter.route(snapshot, routeRequest(message, snapshot));
        return enqueueRouted(message, response);
    }

    /**
     * Sends a batch of messages. Every message gets a response in its slot; a message that cannot
     * be routed or enqueued gets an unsuccessful response and does not affect the others.
     */
    public Future<List<RouteMessageResponse>> sendMessages(List<UnifiedMessage> messages) {
        if (shutdown.get()) {
            return Future.failedFuture(shuttingDown());
        }
        SystemState snapshot = state;
        List<RouteMessageRequest> requests = messages.stream()
            .map(message -> routeRequest(message, snapshot))
            .toList();

        return batchMessageRouter.routeAll(snapshot, requests).compose(responses -> {
            List<Future<RouteMessageResponse>> enqueued = new ArrayList<>(responses.size());
            for (int i = 0; i < responses.size(); i++) {
                RouteMessageResponse response = responses.get(i);
                enqueued.add(enqueueRouted(messages.get(i), response)
                    .recover(error -> Future.succeededFuture(RouteMessageResponse.failure(
                        "Message could not be enqueued", response.latencyMs(), error.getMessage()))));
            }
            return Future.all(enqueued).map(composite -> enqueued.stream().map(Future::result).toList());
        });
    }

    /**
     * Removes and returns the oldest message routed in {@code mode}.
     */
    public Optional<UnifiedMessage> pollMessage(RoutingMode mode) {
        return Optional.ofNullable(messageQueues.get(mode).poll());
    }

    /**
     * Removes every message routed in {@code mode}, oldest first.
     */
    public List<UnifiedMessage> drainMessages(RoutingMode mode) {
        List<UnifiedMessage> drained = new ArrayList<>();
        messageQueues.get(mode).drainTo(drained);
        return drained;
    }

    public int getQueuedMessageCount(RoutingMode mode) {
        return messageQueues.get(mode).size();
    }

    private RouteMessageRequest routeRequest(UnifiedMessage message, SystemState snapshot) {
        boolean hubHealthy = snapshot.health() > routingConfig.getHubHealthThreshold();
        boolean directAvailable = messageQueues.get(RoutingMode.DIRECT).size() < routingConfig.getDirectQueueLimit();
        return new RouteMessageRequest(message, hubHealthy, directAvailable);
    }

    private Future<RouteMessageResponse> enqueueRouted(UnifiedMessage message, RouteMessageResponse response) {
        RoutingMode mode = response.routingDecision().mode();
        if (!messageQueues.get(mode).offer(message)) {
            metrics.recordMessageRejected();
            logger.warn("Message queue for mode {} is full, rejecting message {} from {} to {}",
                mode, message.correlation(), message.source(), message.target());
            return Future.failedFuture(new CoordinationException(SyncoreError.of(SyncoreErrorCodes.QUEUE_FULL,
                "Message queue full for routing mode " + mode,
                "capacity " + coordinatorConfig.getMessageQueueCapacity())));
        }
        metrics.recordMessageRouted(mode);

        eventPublisher.publish(CoordinationEvents.MESSAGE_ROUTED,
            new MessageRoutedEvent(message, mode, response.latencyMs()));
        String address = message.isBroadcast()
            ? CoordinationEvents.MESSAGE_BROADCAST
            : CoordinationEvents.messageAddress(message.target());
        eventPublisher.publish(address, message);
        return Future.succeededFuture(response);
    }

    // ========================================
    // Operations
    // ========================================

    @Override
    public Future<String> startOperation(Operation operation) {
        return startOperation(operation, false);
    }

    @Override
    public Future<String> startOperation(Operation operation, boolean forceExecution) {
        if (shutdown.get()) {
            return Future.failedFuture(shuttingDown());
        }
        if (state.activeOperations().containsKey(operation.id())) {
            return Future.failedFuture(alreadyActive(operation));
        }

        ExecuteOperationResponse response;
        try {
            response = operationPlanner.plan(refreshLoad(),
                new ExecuteOperationRequest(operation, false, forceExecution));
        } catch (RuntimeException e) {
            logger.error("Failed to start operation {} (type {}, participants {})",
                operation.id(), operation.type(), operation.participants(), e);
            return Future.failedFuture(e);
        }

        if (!response.success()) {
            return Future.failedFuture(reject(operation, response.error(), response));
        }

        Operation planned = response.operation();
        ExecutionPlan plan = response.executionPlan();
        ExecutionStrategy strategy = plan.strategy();
        boolean queued = strategy == ExecutionStrategy.QUEUED;
        List<String> assignees = queued ? List.of() : plan.participants();
        Instant now = clock.instant();

        stateLock.lock();
        try {
            if (state.activeOperations().containsKey(operation.id())) {
                return Future.failedFuture(alreadyActive(operation));
            }
            if (queued) {
                ScheduledTask task = new ScheduledTask(planned.id(), planned.initiator(),
                    planned.priority().schedulerPriority(), now, Duration.ofMillis(plan.estimatedDurationMs()),
                    planned.type());
                if (!scheduler.submit(task)) {
                    metrics.recordTaskRejected();
                    SyncoreError error = scheduler.isShutdown()
                        ? SyncoreError.of(SyncoreErrorCodes.SCHEDULER_SHUTDOWN, "Scheduler is shut down", planned.id())
                        : SyncoreError.of(SyncoreErrorCodes.QUOTA_EXCEEDED,
                            "Scheduler rejected queued operation for agent " + planned.initiator(), planned.id());
                    ExecuteOperationResponse rejected = new ExecuteOperationResponse(false, planned,
                        response.strategyDecision(), response.riskAssessment(), plan, response.executionTimeMs(), error);
                    return Future.failedFuture(reject(operation, error, rejected));
                }
            }

            Map<String, ActiveOperation> active = new LinkedHashMap<>(state.activeOperations());
            active.put(planned.id(), new ActiveOperation(planned, strategy, assignees, now,
                now.plus(coordinatorConfig.getOperationTimeout()), queued));
            recentStarts.addLast(now);
            SystemMetrics current = state.metrics();
            SystemMetrics updated = new SystemMetrics(current.operationsStarted() + 1, current.operationsCompleted(),
                current.operationsFailed(), current.operationsTimedOut(), operationsPerHour(now),
                current.averageOperationTimeMs(), current.errorRate());
            state = state.withActiveOperations(active).withMetrics(updated);
        } finally {
            stateLock.unlock();
        }

        metrics.recordOperationStarted();
        logger.info("Operation {} started: {} with {} (risk {})", planned.id(), strategy,
            queued ? "scheduler" : assignees, response.riskAssessment().riskLevel());
        eventPublisher.publish(CoordinationEvents.OPERATION_STARTED,
            new OperationEvent(planned, strategy, assignees, response.strategyDecision().reasoning(), now));
        dispatch(planned, plan, now);
        return Future.succeededFuture(planned.id());
    }

    /**
     * Plans a batch of operations against the current state without admitting any of them.
     */
    public Future<List<ExecuteOperationResponse>> planOperations(List<ExecuteOperationRequest> requests) {
        return batchOperationPlanner.planAll(refreshLoad(), requests);
    }

    public OperationValidation validateOperation(Operation operation) {
        return systemValidator.validateOperation(operation, refreshLoad());
    }

    private void dispatch(Operation operation, ExecutionPlan plan, Instant now) {
        switch (plan.strategy()) {
            case IMMEDIATE -> plan.participants().forEach(participant -> publishExecute(participant,
                new OperationDispatch(operation, ExecutionStrategy.IMMEDIATE, null)));
            case DISTRIBUTED -> {
                for (WorkloadAssignment assignment : plan.workloadDistribution()) {
                    Operation shard = operation.withMetadata(
                        operation.metadata().withPartition(assignment.partition(), assignment.totalPartitions()));
                    publishExecute(assignment.componentId(),
                        new OperationDispatch(shard, ExecutionStrategy.DISTRIBUTED, assignment));
                }
            }
            case DELEGATED -> publishExecute(plan.delegatedTo(),
                new OperationDispatch(operation, ExecutionStrategy.DELEGATED, null));
            case QUEUED -> eventPublisher.publish(CoordinationEvents.OPERATION_QUEUED,
                new OperationEvent(operation, ExecutionStrategy.QUEUED, operation.participants(),
                    "Queued for scheduler dispatch", now));
        }
    }

    private void publishExecute(String componentId, OperationDispatch dispatch) {
        eventPublisher.publish(CoordinationEvents.executeAddress(componentId), dispatch);
        logger.debug("Dispatched operation {} to {} ({})", dispatch.operation().id(), componentId, dispatch.strategy());
    }

    /**
     * Pulls up to {@code maxTasks} tasks from the scheduler and dispatches their operations to the
     * participants that are healthy now. An operation with no healthy participant left is failed.
     *
     * @return the number of operations dispatched
     */
    public int dispatchQueuedOperations(int maxTasks) {
        int dispatched = 0;
        for (int i = 0; i < maxTasks; i++) {
            Optional<ScheduledTask> next = scheduler.next();
            if (next.isEmpty()) {
                break;
            }
            ScheduledTask task = next.get();
            ActiveOperation activeOperation;
            List<String> healthy;
            stateLock.lock();
            try {
                activeOperation = state.activeOperations().get(task.taskId());
                if (activeOperation == null) {
                    healthy = List.of();
                } else {
                    SystemState snapshot = state;
                    healthy = activeOperation.operation().participants().stream()
                        .filter(snapshot::isComponentHealthy)
                        .toList();
                    if (!healthy.isEmpty()) {
                        Map<String, ActiveOperation> active = new LinkedHashMap<>(state.activeOperations());
                        active.put(task.taskId(), activeOperation.dispatched(healthy));
                        state = state.withActiveOperations(active);
                    }
                }
            } finally {
                stateLock.unlock();
            }

            if (activeOperation == null) {
                logger.warn("Scheduled task {} has no active operation, discarding", task.taskId());
                scheduler.complete(TaskResult.failure(task.taskId(), task.agentId(), "Operation no longer active"));
                continue;
            }
            if (healthy.isEmpty()) {
                logger.warn("No healthy participants for queued operation {} at dispatch", task.taskId());
                completeOperation(OperationResult.failure(task.taskId(), elapsedMs(activeOperation),
                    "No healthy participants available at dispatch"));
                continue;
            }
            for (String participant : healthy) {
                publishExecute(participant,
                    new OperationDispatch(activeOperation.operation(), ExecutionStrategy.QUEUED, null));
            }
            dispatched++;
        }
        if (dispatched > 0) {
            logger.debug("Dispatched {} queued operations", dispatched);
        }
        return dispatched;
    }

    @Override
    public boolean completeOperation(OperationResult result) {
        ActiveOperation removed;
        stateLock.lock();
        try {
            removed = state.activeOperations().get(result.operationId());
            if (removed == null) {
                logger.debug("Completion ignored, operation not active: {}", result.operationId());
                return false;
            }
            Map<String, ActiveOperation> active = new LinkedHashMap<>(state.activeOperations());
            active.remove(result.operationId());
            state = state.withActiveOperations(active)
                .withMetrics(recordFinished(state.metrics(), result.success(), result.durationMs(), false));
        } finally {
            stateLock.unlock();
        }

        if (removed.queued() && !scheduler.cancel(result.operationId())) {
            scheduler.complete(new TaskResult(result.operationId(), removed.operation().initiator(),
                result.success(), Duration.ofMillis(Math.max(0L, result.durationMs())), result.error()));
        }

        Instant now = clock.instant();
        if (result.success()) {
            metrics.recordOperationCompleted(result.durationMs());
            logger.info("Operation {} completed in {}ms", result.operationId(), result.durationMs());
            eventPublisher.publish(CoordinationEvents.OPERATION_COMPLETED,
                new OperationEvent(removed.operation(), removed.strategy(), removed.assignees(), null, now));
        } else {
            metrics.recordOperationFailed(result.durationMs());
            logger.warn("Operation {} failed after {}ms: {}", result.operationId(), result.durationMs(), result.error());
            eventPublisher.publish(CoordinationEvents.OPERATION_FAILED,
                new OperationEvent(removed.operation(), removed.strategy(), removed.assignees(), result.error(), now));
        }
        return true;
    }

    /**
     * Removes operations past their deadline and counts them as failed.
     *
     * @return the number of operations evicted
     */
    public int evictExpiredOperations() {
        Instant now = clock.instant();
        List<ActiveOperation> expired = new ArrayList<>();
        stateLock.lock();
        try {
            Map<String, ActiveOperation> active = new LinkedHashMap<>(state.activeOperations());
            SystemMetrics updated = state.metrics();
            for (ActiveOperation operation : state.activeOperations().values()) {
                if (operation.isExpired(now)) {
                    expired.add(operation);
                    active.remove(operation.operation().id());
                    updated = recordFinished(updated, false,
                        Duration.between(operation.startedAt(), now).toMillis(), true);
                }
            }
            if (!expired.isEmpty()) {
                state = state.withActiveOperations(active).withMetrics(updated);
            }
        } finally {
            stateLock.unlock();
        }

        for (ActiveOperation operation : expired) {
            String operationId = operation.operation().id();
            if (operation.queued() && !scheduler.cancel(operationId)) {
                scheduler.complete(TaskResult.failure(operationId, operation.operation().initiator(),
                    "Operation timed out"));
            }
            metrics.recordOperationTimedOut();
            logger.warn("Operation {} timed out after {} (deadline {})", operationId,
                coordinatorConfig.getOperationTimeout(), operation.deadline());
            eventPublisher.publish(CoordinationEvents.OPERATION_TIMED_OUT,
                new OperationEvent(operation.operation(), operation.strategy(), operation.assignees(),
                    "Deadline exceeded", now));
        }
        return expired.size();
    }

    @Override
    public void setAgentQuota(AgentQuota quota) {
        scheduler.setAgentQuota(quota);
    }

    // ========================================
    // Health and validation
    // ========================================

    @Override
    public Future<CheckHealthResponse> checkHealth() {
        return runHealthCheck(null);
    }

    @Override
    public Future<CheckHealthResponse> checkHealth(List<ComponentCheckResult> results) {
        return runHealthCheck(results);
    }

    private Future<CheckHealthResponse> runHealthCheck(List<ComponentCheckResult> results) {
        try {
            SystemState snapshot = state;
            HealthEvaluation evaluation = results == null
                ? healthEvaluator.evaluate(snapshot)
                : healthEvaluator.evaluate(snapshot, results);

            int previousHealth;
            int health;
            stateLock.lock();
            try {
                previousHealth = state.health();
                registry.applyStatuses(evaluation.updates(), evaluation.evaluated());
                refreshComponents();
                health = state.health();
            } finally {
                stateLock.unlock();
            }

            Instant now = clock.instant();
            if (!evaluation.transitions().isEmpty() || health != previousHealth) {
                logger.info("System health {} -> {} ({} transitions)", previousHealth, health,
                    evaluation.transitions().size());
            }
            evaluation.warnings().forEach(warning -> logger.warn("Health check warning: {}", warning));
            eventPublisher.publish(CoordinationEvents.HEALTH_UPDATED, new HealthUpdatedEvent(health, previousHealth, now));
            return Future.succeededFuture(new CheckHealthResponse(true, health, previousHealth,
                evaluation.transitions(), evaluation.warnings(), now));
        } catch (RuntimeException e) {
            logger.error("Health check failed for {} components", state.components().size(), e);
            return Future.failedFuture(e);
        }
    }

    @Override
    public Future<ValidationResult> validateSystem() {
        return validateSystem(ValidateSystemRequest.defaults());
    }

    @Override
    public Future<ValidationResult> validateSystem(ValidateSystemRequest request) {
        try {
            return Future.succeededFuture(systemValidator.validate(refreshLoad(), request));
        } catch (RuntimeException e) {
            logger.error("System validation failed", e);
            return Future.failedFuture(e);
        }
    }

    // ========================================
    // Status
    // ========================================

    @Override
    public SystemState getSystemState() {
        return state;
    }

    @Override
    public SystemStatusSummary getSystemStatus() {
        SystemState snapshot = state;
        Map<RoutingMode, Integer> queueSizes = new EnumMap<>(RoutingMode.class);
        int queuedMessages = 0;
        for (Map.Entry<RoutingMode, BlockingQueue<UnifiedMessage>> entry : messageQueues.entrySet()) {
            int size = entry.getValue().size();
            queueSizes.put(entry.getKey(), size);
            queuedMessages += size;
        }
        Runtime runtime = Runtime.getRuntime();
        double memoryUsageMb = (runtime.totalMemory() - runtime.freeMemory()) / (1024.0 * 1024.0);

        return new SystemStatusSummary(
            snapshot.health(),
            (int) snapshot.countHealthy(),
            snapshot.components().size(),
            snapshot.activeOperations().size(),
            queuedMessages,
            queueSizes,
            scheduler.getQueueLength(),
            memoryUsageMb);
    }

    @Override
    public RoutingStatus getRoutingStatus() {
        return messageRouter.getRoutingStatus();
    }

    public RoutingMetrics getRoutingMetrics() {
        return messageRouter.getMetrics();
    }

    @Override
    public SchedulerStats getSchedulerStats() {
        return scheduler.getStats();
    }

    public CoordinationEventPublisher getEventPublisher() {
        return eventPublisher;
    }

    /**
     * Publishes a snapshot of system, routing and scheduler status on {@code metrics:exported}.
     */
    public MetricsSnapshot exportMetrics() {
        MetricsSnapshot snapshot = new MetricsSnapshot(clock.instant(), getSystemStatus(), getRoutingStatus(),
            getSchedulerStats());
        eventPublisher.publish(CoordinationEvents.METRICS_EXPORTED, snapshot);
        logger.debug("Exported metrics: health {}, {} active operations", snapshot.systemStatus().health(),
            snapshot.systemStatus().activeOperations());
        return snapshot;
    }

    // ========================================
    // Lifecycle
    // ========================================

    @Override
    public Future<Void> shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return Future.succeededFuture();
        }
        logger.info("Shutting down system coordinator");
        healthTimerId = cancelTimer(healthTimerId);
        dispatchTimerId = cancelTimer(dispatchTimerId);
        metricsTimerId = cancelTimer(metricsTimerId);
        scheduler.shutdown();
        logger.info("System coordinator stopped ({} operations still active)", state.activeOperations().size());
        return Future.succeededFuture();
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    private long cancelTimer(long timerId) {
        if (timerId >= 0) {
            vertx.cancelTimer(timerId);
        }
        return -1;
    }

    private void runHealthTick() {
        checkHealth().onFailure(error -> logger.error("Periodic health check failed: {}", error.getMessage()));
        try {
            evictExpiredOperations();
        } catch (RuntimeException e) {
            logger.error("Operation deadline sweep failed", e);
        }
    }

    private void runMetricsExport() {
        try {
            exportMetrics();
        } catch (RuntimeException e) {
            logger.error("Metrics export failed", e);
        }
    }

    // ========================================
    // State helpers (callers hold stateLock where noted)
    // ========================================

    // caller holds stateLock
    private void refreshComponents() {
        Map<String, ComponentStatus> components = registry.snapshot();
        int health = healthEvaluator.calculateHealth(components.values(), state.metrics().errorRate());
        state = state.withComponents(components).withHealth(health);
    }

    private SystemState refreshLoad() {
        stateLock.lock();
        try {
            double perHour = operationsPerHour(clock.instant());
            if (perHour != state.metrics().operationsPerHour()) {
                state = state.withMetrics(state.metrics().withOperationsPerHour(perHour));
            }
            return state;
        } finally {
            stateLock.unlock();
        }
    }

    // caller holds stateLock
    private double operationsPerHour(Instant now) {
        Instant cutoff = now.minus(ONE_HOUR);
        while (!recentStarts.isEmpty() && !recentStarts.peekFirst().isAfter(cutoff)) {
            recentStarts.removeFirst();
        }
        return recentStarts.size();
    }

    // caller holds stateLock
    private SystemMetrics recordFinished(SystemMetrics current, boolean success, long durationMs, boolean timedOut) {
        long completed = current.operationsCompleted() + (success ? 1 : 0);
        long failed = current.operationsFailed() + (success ? 0 : 1);
        long timedOutCount = current.operationsTimedOut() + (timedOut ? 1 : 0);
        long finished = completed + failed;
        totalOperationTimeMs += Math.max(0L, durationMs);
        return new SystemMetrics(current.operationsStarted(), completed, failed, timedOutCount,
            current.operationsPerHour(),
            (double) totalOperationTimeMs / finished,
            (double) failed / finished);
    }

    private long elapsedMs(ActiveOperation operation) {
        return Math.max(0L, Duration.between(operation.startedAt(), clock.instant()).toMillis());
    }

    private OperationRejectedException reject(Operation operation, SyncoreError error, ExecuteOperationResponse response) {
        metrics.recordOperationRejected();
        logger.warn("Operation {} rejected: {}", operation.id(), error);
        eventPublisher.publish(CoordinationEvents.OPERATION_REJECTED,
            new OperationEvent(operation, response == null || response.executionPlan() == null
                ? null : response.executionPlan().strategy(),
                operation.participants(), error.message(), clock.instant()));
        return new OperationRejectedException(operation.id(), error, response);
    }

    private OperationRejectedException alreadyActive(Operation operation) {
        SyncoreError error = SyncoreError.of(SyncoreErrorCodes.OPERATION_ALREADY_ACTIVE,
            "Operation is already active", operation.id());
        return reject(operation, error, null);
    }

    private static CoordinationException shuttingDown() {
        return new CoordinationException(SyncoreError.of(SyncoreErrorCodes.SHUTTING_DOWN,
            "Coordinator is shutting down"));
    }
}

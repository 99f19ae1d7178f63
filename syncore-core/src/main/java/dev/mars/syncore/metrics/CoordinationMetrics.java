package dev.mars.syncore.metrics;

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

import dev.mars.syncore.api.messaging.RoutingMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Micrometer instrumentation for the coordinator.
 *
 * <p>Gauges read live values through suppliers handed in by the coordinator. Every meter carries
 * an {@code instance} tag.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class CoordinationMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(CoordinationMetrics.class);

    private final String instanceId;
    private final Supplier<Number> healthSupplier;
    private final Supplier<Number> activeOperationsSupplier;
    private final Supplier<Number> schedulerQueueSupplier;
    private final Supplier<Number> schedulerActiveSupplier;

    // Counters
    private final Map<RoutingMode, Counter> messagesRouted = new EnumMap<>(RoutingMode.class);
    private Counter messagesRejected;
    private Counter operationsStarted;
    private Counter operationsRejected;
    private Counter operationsCompleted;
    private Counter operationsFailed;
    private Counter operationsTimedOut;
    private Counter tasksRejected;

    // Timers
    private Timer operationDuration;

    public CoordinationMetrics(String instanceId,
                               Supplier<Number> healthSupplier,
                               Supplier<Number> activeOperationsSupplier,
                               Supplier<Number> schedulerQueueSupplier,
                               Supplier<Number> schedulerActiveSupplier) {
        this.instanceId = instanceId;
        this.healthSupplier = healthSupplier;
        this.activeOperationsSupplier = activeOperationsSupplier;
        this.schedulerQueueSupplier = schedulerQueueSupplier;
        this.schedulerActiveSupplier = schedulerActiveSupplier;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        for (RoutingMode mode : RoutingMode.values()) {
            messagesRouted.put(mode, Counter.builder("syncore.messages.routed")
                .description("Messages routed, by routing mode")
                .tag("instance", instanceId)
                .tag("mode", mode.name().toLowerCase())
                .register(registry));
        }

        messagesRejected = Counter.builder("syncore.messages.rejected")
            .description("Messages that could not be enqueued")
            .tag("instance", instanceId)
            .register(registry);

        operationsStarted = Counter.builder("syncore.operations.started")
            .description("Operations accepted by the coordinator")
            .tag("instance", instanceId)
            .register(registry);

        operationsRejected = Counter.builder("syncore.operations.rejected")
            .description("Operations rejected during planning")
            .tag("instance", instanceId)
            .register(registry);

        operationsCompleted = Counter.builder("syncore.operations.completed")
            .description("Operations completed successfully")
            .tag("instance", instanceId)
            .register(registry);

        operationsFailed = Counter.builder("syncore.operations.failed")
            .description("Operations that reported failure")
            .tag("instance", instanceId)
            .register(registry);

        operationsTimedOut = Counter.builder("syncore.operations.timedout")
            .description("Operations evicted after their deadline")
            .tag("instance", instanceId)
            .register(registry);

        tasksRejected = Counter.builder("syncore.scheduler.tasks.rejected")
            .description("Scheduler submissions rejected by quota")
            .tag("instance", instanceId)
            .register(registry);

        operationDuration = Timer.builder("syncore.operation.duration")
            .description("Operation run time reported on completion")
            .tag("instance", instanceId)
            .register(registry);

        Gauge.builder("syncore.system.health", healthSupplier)
            .description("Aggregate system health score (0-100)")
            .tag("instance", instanceId)
            .register(registry);

        Gauge.builder("syncore.operations.active", activeOperationsSupplier)
            .description("Operations currently active")
            .tag("instance", instanceId)
            .register(registry);

        Gauge.builder("syncore.scheduler.queue.length", schedulerQueueSupplier)
            .description("Tasks waiting in the fairness scheduler")
            .tag("instance", instanceId)
            .register(registry);

        Gauge.builder("syncore.scheduler.tasks.active", schedulerActiveSupplier)
            .description("Tasks running under the fairness scheduler")
            .tag("instance", instanceId)
            .register(registry);

        logger.info("Coordination metrics registered for instance: {}", instanceId);
    }

    public void recordMessageRouted(RoutingMode mode) {
        Counter counter = messagesRouted.get(mode);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordMessageRejected() {
        if (messagesRejected != null) {
            messagesRejected.increment();
        }
    }

    public void recordOperationStarted() {
        if (operationsStarted != null) {
            operationsStarted.increment();
        }
    }

    public void recordOperationRejected() {
        if (operationsRejected != null) {
            operationsRejected.increment();
        }
    }

    public void recordOperationCompleted(long durationMs) {
        if (operationsCompleted != null) {
            operationsCompleted.increment();
        }
        recordDuration(durationMs);
    }

    public void recordOperationFailed(long durationMs) {
        if (operationsFailed != null) {
            operationsFailed.increment();
        }
        recordDuration(durationMs);
    }

    public void recordOperationTimedOut() {
        if (operationsTimedOut != null) {
            operationsTimedOut.increment();
        }
    }

    public void recordTaskRejected() {
        if (tasksRejected != null) {
            tasksRejected.increment();
        }
    }

    private void recordDuration(long durationMs) {
        if (operationDuration != null && durationMs >= 0) {
            operationDuration.record(Duration.ofMillis(durationMs));
        }
    }
}

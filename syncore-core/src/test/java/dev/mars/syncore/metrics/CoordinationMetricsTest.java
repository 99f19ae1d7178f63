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
import dev.mars.syncore.test.categories.TestCategories;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class CoordinationMetricsTest {

    private final AtomicInteger health = new AtomicInteger(100);
    private final AtomicInteger activeOperations = new AtomicInteger();
    private MeterRegistry registry;
    private CoordinationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CoordinationMetrics("test-instance", health::get, activeOperations::get, () -> 3, () -> 1);
        metrics.bindTo(registry);
    }

    @Test
    void testRoutedMessagesAreTaggedByMode() {
        metrics.recordMessageRouted(RoutingMode.HUB);
        metrics.recordMessageRouted(RoutingMode.HUB);
        metrics.recordMessageRouted(RoutingMode.DIRECT);

        assertEquals(2.0, registry.get("syncore.messages.routed").tag("mode", "hub").counter().count());
        assertEquals(1.0, registry.get("syncore.messages.routed").tag("mode", "direct").counter().count());
        assertEquals(0.0, registry.get("syncore.messages.routed").tag("mode", "fallback").counter().count());
        assertEquals("test-instance",
            registry.get("syncore.messages.routed").tag("mode", "hub").counter().getId().getTag("instance"));
    }

    @Test
    void testOperationLifecycleCounters() {
        metrics.recordOperationStarted();
        metrics.recordOperationStarted();
        metrics.recordOperationRejected();
        metrics.recordOperationCompleted(120);
        metrics.recordOperationFailed(80);
        metrics.recordOperationTimedOut();

        assertEquals(2.0, registry.get("syncore.operations.started").counter().count());
        assertEquals(1.0, registry.get("syncore.operations.rejected").counter().count());
        assertEquals(1.0, registry.get("syncore.operations.completed").counter().count());
        assertEquals(1.0, registry.get("syncore.operations.failed").counter().count());
        assertEquals(1.0, registry.get("syncore.operations.timedout").counter().count());

        Timer duration = registry.get("syncore.operation.duration").timer();
        assertEquals(2, duration.count());
        assertEquals(200.0, duration.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    void testNegativeDurationIsNotRecorded() {
        metrics.recordOperationFailed(-1);

        assertEquals(1.0, registry.get("syncore.operations.failed").counter().count());
        assertEquals(0, registry.get("syncore.operation.duration").timer().count());
    }

    @Test
    void testGaugesReadSuppliers() {
        health.set(72);
        activeOperations.set(4);

        assertEquals(72.0, registry.get("syncore.system.health").gauge().value());
        assertEquals(4.0, registry.get("syncore.operations.active").gauge().value());
        assertEquals(3.0, registry.get("syncore.scheduler.queue.length").gauge().value());
        assertEquals(1.0, registry.get("syncore.scheduler.tasks.active").gauge().value());
    }

    @Test
    void testRejectionCounters() {
        metrics.recordMessageRejected();
        metrics.recordTaskRejected();
        metrics.recordTaskRejected();

        assertEquals(1.0, registry.get("syncore.messages.rejected").counter().count());
        assertEquals(2.0, registry.get("syncore.scheduler.tasks.rejected").counter().count());
    }

    @Test
    void testRecordingBeforeBindIsIgnored() {
        CoordinationMetrics unbound = new CoordinationMetrics("unbound", () -> 0, () -> 0, () -> 0, () -> 0);

        assertDoesNotThrow(() -> {
            unbound.recordOperationStarted();
            unbound.recordMessageRouted(RoutingMode.HUB);
            unbound.recordOperationCompleted(10);
        });
    }
}

package dev.mars.syncore.api.messaging;

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

import dev.mars.syncore.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for routing value types: retry policy per mode, message helpers and routing metrics.
 */
@Tag(TestCategories.CORE)
class RoutingDecisionTest {

    @Test
    void testRetryPolicyPerMode() {
        RoutingDecision direct = RoutingDecision.direct("peer");
        RoutingDecision hub = RoutingDecision.hub("central");
        RoutingDecision fallback = RoutingDecision.fallback("degraded");

        assertEquals(RoutingMode.DIRECT, direct.mode());
        assertEquals(2, direct.maxRetries());
        assertEquals(3, hub.maxRetries());
        assertEquals(RoutingMode.FALLBACK, fallback.mode());
        assertEquals(5, fallback.maxRetries());
        assertTrue(fallback.shouldRetry());
    }

    @Test
    void testBroadcastMessage() {
        UnifiedMessage message = UnifiedMessage.broadcast("coordinator", MessageType.EVENT, Priority.P1);

        assertTrue(message.isBroadcast());
        assertEquals(UnifiedMessage.BROADCAST, message.target());
        assertNotNull(message.correlation());
        assertNotNull(message.timestamp());
        assertTrue(message.payload().isEmpty());
    }

    @Test
    void testDirectMessageIsNotBroadcast() {
        UnifiedMessage message = UnifiedMessage.of("a", "b", MessageType.REQUEST, Priority.P2);

        assertFalse(message.isBroadcast());
        assertFalse(message.type().isBroadcastOnly());
        assertTrue(MessageType.EVENT.isBroadcastOnly());
    }

    @Test
    void testPriorityMapsToSchedulerPriority() {
        assertEquals(1, Priority.P0.schedulerPriority());
        assertEquals(4, Priority.P3.schedulerPriority());
        assertTrue(Priority.P0.isTopTier());
        assertFalse(Priority.P1.isTopTier());
    }

    @Test
    void testEmptyMetricsHaveZeroForEveryMode() {
        RoutingMetrics metrics = RoutingMetrics.empty(100.0, 40.0);

        for (RoutingMode mode : RoutingMode.values()) {
            assertEquals(0, metrics.count(mode));
            assertEquals(0.0, metrics.averageLatency(mode));
            assertEquals(0.0, metrics.share(mode));
        }
    }

    @Test
    void testShareIsFractionOfTotal() {
        RoutingMetrics metrics = new RoutingMetrics(4,
            Map.of(RoutingMode.HUB, 3L, RoutingMode.FALLBACK, 1L),
            Map.of(RoutingMode.HUB, 10.0),
            100.0, 40.0);

        assertEquals(0.75, metrics.share(RoutingMode.HUB), 0.0001);
        assertEquals(0.25, metrics.share(RoutingMode.FALLBACK), 0.0001);
        assertEquals(0, metrics.count(RoutingMode.DIRECT));
    }
}

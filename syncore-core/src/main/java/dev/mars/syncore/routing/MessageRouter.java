package dev.mars.syncore.routing;

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

import dev.mars.syncore.api.messaging.RouteMessageRequest;
import dev.mars.syncore.api.messaging.RouteMessageResponse;
import dev.mars.syncore.api.messaging.RoutingDecision;
import dev.mars.syncore.api.messaging.RoutingHistoryEntry;
import dev.mars.syncore.api.messaging.RoutingMetrics;
import dev.mars.syncore.api.messaging.RoutingMode;
import dev.mars.syncore.api.messaging.RoutingStatus;
import dev.mars.syncore.api.messaging.UnifiedMessage;
import dev.mars.syncore.api.state.SystemState;
import dev.mars.syncore.config.SyncoreConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Route-message use case: applies {@link RoutingDecider} to a message, measures the decision
 * latency and keeps per-mode running metrics plus a bounded routing history.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class MessageRouter {
    private static final Logger logger = LoggerFactory.getLogger(MessageRouter.class);

    private static final int RECENT_HISTORY = 10;
    private static final double FALLBACK_RECOMMENDATION_SHARE = 0.10;
    private static final double DIRECT_RECOMMENDATION_SHARE = 0.50;

    private final RoutingDecider decider;
    private final Clock clock;
    private final int historySize;
    private final double baselineHubLatency;
    private final double baselineDirectLatency;

    // guarded by this
    private final Deque<RoutingHistoryEntry> history = new ArrayDeque<>();
    private final Map<RoutingMode, Long> counts = new EnumMap<>(RoutingMode.class);
    private final Map<RoutingMode, Double> averageLatency = new EnumMap<>(RoutingMode.class);
    private long totalMessages;

    public MessageRouter(RoutingDecider decider, SyncoreConfiguration.RoutingConfig config, Clock clock) {
        this.decider = decider;
        this.clock = clock;
        this.historySize = config.getHistorySize();
        this.baselineHubLatency = config.getBaselineHubLatencyMs();
        this.baselineDirectLatency = config.getBaselineDirectLatencyMs();
    }

    /**
     * Routes one message. Never throws: if the decision itself fails, a fallback decision is
     * returned with {@code success == false}.
     */
    public RouteMessageResponse route(SystemState state, RouteMessageRequest request) {
        long start = System.nanoTime();
        UnifiedMessage message = request.message();
        logger.debug("Routing message {} from {} to {} ({}, {})",
            message.correlation(), message.source(), message.target(), message.type(), message.priority());
        try {
            RoutingDecision decision = decider.decide(message, request.hubHealthy(), request.directConnectionsAvailable());
            boolean establishDirect = decider.shouldEstablishDirectConnection(
                message, state.metrics().operationsPerHour(), request.hubHealthy());
            boolean coordination = decider.requiresCoordination(message);

            double latencyMs = elapsedMs(start);
            record(message, decision, latencyMs);

            logger.debug("Message {} routed via {}: {}", message.correlation(), decision.mode(), decision.reason());
            return new RouteMessageResponse(true, decision, latencyMs, establishDirect, coordination, null);
        } catch (RuntimeException e) {
            double latencyMs = elapsedMs(start);
            logger.error("Message routing failed for {}: {}", message.correlation(), e.getMessage(), e);
            RouteMessageResponse response = RouteMessageResponse.failure("Routing error - using fallback", latencyMs, e.getMessage());
            record(message, response.routingDecision(), latencyMs);
            return response;
        }
    }

    public synchronized RoutingMetrics getMetrics() {
        return new RoutingMetrics(totalMessages, counts, averageLatency, baselineHubLatency, baselineDirectLatency);
    }

    /**
     * Most recent history entries, oldest first.
     */
    public synchronized List<RoutingHistoryEntry> getHistory(int limit) {
        List<RoutingHistoryEntry> all = new ArrayList<>(history);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public synchronized RoutingStatus getRoutingStatus() {
        RoutingMetrics metrics = getMetrics();
        List<RoutingHistoryEntry> recent = getHistory(RECENT_HISTORY);
        RoutingMode currentMode = recent.isEmpty() ? RoutingMode.HUB : recent.get(recent.size() - 1).mode();

        double hubLatency = metrics.count(RoutingMode.HUB) > 0 ? metrics.averageLatency(RoutingMode.HUB) : baselineHubLatency;
        double directLatency = metrics.count(RoutingMode.DIRECT) > 0
            ? metrics.averageLatency(RoutingMode.DIRECT) : baselineDirectLatency;
        String latencyReduction = hubLatency > directLatency
            ? formatPercent((hubLatency - directLatency) / hubLatency * 100.0)
            : "0%";

        return new RoutingStatus(currentMode, metrics, recent, latencyReduction,
            formatPercent(metrics.share(RoutingMode.DIRECT) * 100.0), recommendOptimalMode());
    }

    /**
     * Fallback above 10% of traffic signals systemic trouble; direct is recommended once it
     * carries most traffic and beats the hub on latency; otherwise hub.
     */
    public synchronized RoutingMode recommendOptimalMode() {
        if (totalMessages == 0) {
            return RoutingMode.HUB;
        }
        RoutingMetrics metrics = getMetrics();
        if (metrics.share(RoutingMode.FALLBACK) > FALLBACK_RECOMMENDATION_SHARE) {
            return RoutingMode.FALLBACK;
        }
        if (metrics.share(RoutingMode.DIRECT) > DIRECT_RECOMMENDATION_SHARE
                && metrics.averageLatency(RoutingMode.DIRECT) < metrics.averageLatency(RoutingMode.HUB)) {
            return RoutingMode.DIRECT;
        }
        return RoutingMode.HUB;
    }

    public synchronized void clear() {
        history.clear();
        counts.clear();
        averageLatency.clear();
        totalMessages = 0;
        logger.debug("Routing history and metrics cleared");
    }

    private synchronized void record(UnifiedMessage message, RoutingDecision decision, double latencyMs) {
        RoutingMode mode = decision.mode();
        long count = counts.merge(mode, 1L, Long::sum);
        double previous = averageLatency.getOrDefault(mode, 0.0);
        averageLatency.put(mode, previous + (latencyMs - previous) / count);
        totalMessages++;

        history.addLast(new RoutingHistoryEntry(clock.instant(), mode, decision.reason(), latencyMs,
            message.correlation(), message.priority()));
        while (history.size() > historySize) {
            history.removeFirst();
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static String formatPercent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }
}

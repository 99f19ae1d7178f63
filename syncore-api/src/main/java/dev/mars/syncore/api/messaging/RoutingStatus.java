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

import java.util.List;

/**
 * Snapshot of routing behaviour for status endpoints and metric exports.
 *
 * @param currentMode              mode of the most recent routed message, HUB when none
 * @param metrics                  aggregated routing metrics
 * @param recentHistory            the last few routing entries, oldest first
 * @param latencyReduction         direct-vs-hub latency reduction, formatted as a percentage
 * @param directRoutingPercentage  share of direct routing, formatted as a percentage
 * @param recommendedMode          mode suggested by observed traffic
 */
public record RoutingStatus(
    RoutingMode currentMode,
    RoutingMetrics metrics,
    List<RoutingHistoryEntry> recentHistory,
    String latencyReduction,
    String directRoutingPercentage,
    RoutingMode recommendedMode
) {
    public RoutingStatus {
        recentHistory = recentHistory == null ? List.of() : List.copyOf(recentHistory);
    }
}

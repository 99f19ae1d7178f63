package dev.mars.syncore.api.state;

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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Flat status view of the coordinator for dashboards and metric exports.
 */
public record SystemStatusSummary(
    int health,
    int componentsHealthy,
    int componentsTotal,
    int activeOperations,
    int queuedMessages,
    Map<RoutingMode, Integer> messageQueues,
    int pendingTasks,
    double memoryUsageMb
) {
    public SystemStatusSummary {
        messageQueues = messageQueues == null || messageQueues.isEmpty()
            ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(messageQueues));
    }
}

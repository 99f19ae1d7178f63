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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregated routing counters and count-weighted mean decision latency per mode.
 *
 * @param totalMessages         messages routed since the last clear
 * @param modeDistribution      messages routed per mode
 * @param averageLatency        mean latency per mode in milliseconds
 * @param baselineHubLatency    reference hub latency used when no hub samples exist
 * @param baselineDirectLatency reference direct latency used when no direct samples exist
 */
public record RoutingMetrics(
    long totalMessages,
    Map<RoutingMode, Long> modeDistribution,
    Map<RoutingMode, Double> averageLatency,
    double baselineHubLatency,
    double baselineDirectLatency
) {
    public RoutingMetrics {
        modeDistribution = Collections.unmodifiableMap(fill(modeDistribution, 0L));
        averageLatency = Collections.unmodifiableMap(fill(averageLatency, 0.0));
    }

    public static RoutingMetrics empty(double baselineHubLatency, double baselineDirectLatency) {
        return new RoutingMetrics(0, null, null, baselineHubLatency, baselineDirectLatency);
    }

    public long count(RoutingMode mode) {
        return modeDistribution.get(mode);
    }

    public double averageLatency(RoutingMode mode) {
        return averageLatency.get(mode);
    }

    public double share(RoutingMode mode) {
        return totalMessages == 0 ? 0.0 : (double) count(mode) / totalMessages;
    }

    private static <V> Map<RoutingMode, V> fill(Map<RoutingMode, V> source, V zero) {
        Map<RoutingMode, V> result = new EnumMap<>(RoutingMode.class);
        for (RoutingMode mode : RoutingMode.values()) {
            V value = source == null ? null : source.get(mode);
            result.put(mode, value == null ? zero : value);
        }
        return result;
    }
}

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

import java.util.Objects;

/**
 * Routing mode chosen for a single message together with its retry policy.
 *
 * @param mode        chosen routing mode, never null
 * @param reason      human-readable explanation
 * @param shouldRetry whether delivery should be retried on failure
 * @param maxRetries  upper bound on retries
 */
public record RoutingDecision(RoutingMode mode, String reason, boolean shouldRetry, int maxRetries) {

    public static final int DIRECT_MAX_RETRIES = 2;
    public static final int HUB_MAX_RETRIES = 3;
    public static final int FALLBACK_MAX_RETRIES = 5;

    public RoutingDecision {
        Objects.requireNonNull(mode, "Routing mode cannot be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative");
        }
    }

    public static RoutingDecision direct(String reason) {
        return new RoutingDecision(RoutingMode.DIRECT, reason, true, DIRECT_MAX_RETRIES);
    }

    public static RoutingDecision hub(String reason) {
        return new RoutingDecision(RoutingMode.HUB, reason, true, HUB_MAX_RETRIES);
    }

    public static RoutingDecision fallback(String reason) {
        return new RoutingDecision(RoutingMode.FALLBACK, reason, true, FALLBACK_MAX_RETRIES);
    }
}

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

/**
 * Outcome of routing one message. A failed response still carries a fallback decision so the
 * message is never dropped.
 *
 * @param success                          whether routing completed normally
 * @param routingDecision                  chosen mode and retry policy
 * @param latencyMs                        time spent deciding, in milliseconds
 * @param shouldEstablishDirectConnection  hint that a peer connection would pay off
 * @param requiresCoordination             whether the hub must be involved
 * @param error                            failure description, null on success
 */
public record RouteMessageResponse(
    boolean success,
    RoutingDecision routingDecision,
    double latencyMs,
    boolean shouldEstablishDirectConnection,
    boolean requiresCoordination,
    String error
) {
    public static RouteMessageResponse failure(String reason, double latencyMs, String error) {
        return new RouteMessageResponse(false, RoutingDecision.fallback(reason), latencyMs, false, false, error);
    }
}

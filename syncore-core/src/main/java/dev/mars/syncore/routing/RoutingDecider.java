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

import dev.mars.syncore.api.messaging.MessageType;
import dev.mars.syncore.api.messaging.RoutingDecision;
import dev.mars.syncore.api.messaging.UnifiedMessage;
import dev.mars.syncore.config.SyncoreConfiguration;

/**
 * Chooses exactly one routing mode per message.
 *
 * <ol>
 *   <li>broadcast target: hub</li>
 *   <li>direct path available, hub unhealthy and the message may travel peer-to-peer: direct</li>
 *   <li>hub healthy: hub</li>
 *   <li>otherwise: fallback with retries</li>
 * </ol>
 *
 * <p>Decisions are pure functions of their inputs.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class RoutingDecider {

    private final double directConnectionLoadThreshold;

    public RoutingDecider(SyncoreConfiguration.RoutingConfig config) {
        this.directConnectionLoadThreshold = config.getDirectConnectionLoadThreshold();
    }

    public RoutingDecision decide(UnifiedMessage message, boolean hubHealthy, boolean directConnectionsAvailable) {
        if (message.isBroadcast()) {
            return RoutingDecision.hub("Broadcast messages are hub-mediated");
        }
        if (directConnectionsAvailable && !hubHealthy && !message.type().isBroadcastOnly()) {
            return RoutingDecision.direct("Hub unhealthy - direct connection available");
        }
        if (hubHealthy) {
            return RoutingDecision.hub("Normal hub-mediated routing");
        }
        return RoutingDecision.fallback(directConnectionsAvailable
            ? "Hub unhealthy - message type cannot use a direct connection"
            : "Hub unhealthy and no direct connection available");
    }

    /**
     * Whether a peer connection between source and target would pay off: never for broadcasts,
     * otherwise under high load or while the hub is unhealthy.
     */
    public boolean shouldEstablishDirectConnection(UnifiedMessage message, double operationsPerHour, boolean hubHealthy) {
        if (message.isBroadcast()) {
            return false;
        }
        return operationsPerHour > directConnectionLoadThreshold || !hubHealthy;
    }

    public boolean requiresCoordination(UnifiedMessage message) {
        return message.isBroadcast() || message.type() == MessageType.REQUEST;
    }
}

package dev.mars.syncore.api.events;

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
 * Event bus addresses published by the coordinator.
 *
 * <p>Targeted addresses are built from a prefix plus a component id: participants subscribe to
 * {@link #executeAddress(String)} to receive work and to {@link #messageAddress(String)} to
 * receive routed messages.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public final class CoordinationEvents {

    private CoordinationEvents() {
        // Utility class - no instantiation
    }

    public static final String COMPONENT_REGISTERED = "component:registered";
    public static final String COMPONENT_UNREGISTERED = "component:unregistered";

    public static final String MESSAGE_ROUTED = "message:routed";
    public static final String MESSAGE_BROADCAST = "message:broadcast";
    public static final String MESSAGE_PREFIX = "message:";

    public static final String OPERATION_STARTED = "operation:started";
    public static final String OPERATION_QUEUED = "operation:queued";
    public static final String OPERATION_REJECTED = "operation:rejected";
    public static final String OPERATION_COMPLETED = "operation:completed";
    public static final String OPERATION_FAILED = "operation:failed";
    public static final String OPERATION_TIMED_OUT = "operation:timedout";
    public static final String OPERATION_EXECUTE_PREFIX = "operation:execute:";

    public static final String HEALTH_UPDATED = "health:updated";
    public static final String METRICS_EXPORTED = "metrics:exported";

    public static String messageAddress(String target) {
        return MESSAGE_PREFIX + target;
    }

    public static String executeAddress(String componentId) {
        return OPERATION_EXECUTE_PREFIX + componentId;
    }
}

package dev.mars.syncore.api.error;

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
 * Standard error codes for the coordination core.
 *
 * Error code ranges:
 * - SYNERR0001-0049: General/System errors
 * - SYNERR0050-0099: Component/Registry errors
 * - SYNERR0100-0149: Routing errors
 * - SYNERR0150-0199: Operation errors
 * - SYNERR0200-0249: Scheduler errors
 * - SYNERR0250-0299: Health/Validation errors
 * - SYNERR0300-0349: Configuration/Event errors
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public final class SyncoreErrorCodes {

    private SyncoreErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "SYNERR0001";
    public static final String INVALID_REQUEST = "SYNERR0002";
    public static final String SERVICE_UNAVAILABLE = "SYNERR0003";
    public static final String SHUTTING_DOWN = "SYNERR0004";

    // ========================================================================
    // Component/Registry Errors (0050-0099)
    // ========================================================================
    public static final String COMPONENT_NOT_FOUND = "SYNERR0050";
    public static final String COMPONENT_INVALID = "SYNERR0051";

    // ========================================================================
    // Routing Errors (0100-0149)
    // ========================================================================
    public static final String ROUTING_FAILED = "SYNERR0100";
    public static final String QUEUE_FULL = "SYNERR0101";
    public static final String BATCH_ROUTING_FAILED = "SYNERR0102";

    // ========================================================================
    // Operation Errors (0150-0199)
    // ========================================================================
    public static final String NO_HEALTHY_PARTICIPANTS = "SYNERR0150";
    public static final String RISK_TOO_HIGH = "SYNERR0151";
    public static final String OPERATION_ALREADY_ACTIVE = "SYNERR0152";
    public static final String OPERATION_NOT_FOUND = "SYNERR0153";
    public static final String OPERATION_TIMED_OUT = "SYNERR0154";
    public static final String BATCH_EXECUTION_FAILED = "SYNERR0155";

    // ========================================================================
    // Scheduler Errors (0200-0249)
    // ========================================================================
    public static final String QUOTA_EXCEEDED = "SYNERR0200";
    public static final String SCHEDULER_SHUTDOWN = "SYNERR0201";

    // ========================================================================
    // Health/Validation Errors (0250-0299)
    // ========================================================================
    public static final String HEALTH_CHECK_FAILED = "SYNERR0250";
    public static final String VALIDATION_FAILED = "SYNERR0251";

    // ========================================================================
    // Configuration/Event Errors (0300-0349)
    // ========================================================================
    public static final String CONFIGURATION_INVALID = "SYNERR0300";
    public static final String EVENT_ENCODING_FAILED = "SYNERR0301";
    public static final String EVENT_DECODING_FAILED = "SYNERR0302";
}

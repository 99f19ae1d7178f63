package dev.mars.syncore.api.component;

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
 * Lifecycle/health state of a registered component.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public enum ComponentState {
    HEALTHY,
    DEGRADED,
    FAILED,
    STARTING;

    public boolean isHealthy() {
        return this == HEALTHY;
    }

    /**
     * Failed and degraded components count as "down" for readiness checks.
     */
    public boolean isDown() {
        return this == FAILED || this == DEGRADED;
    }
}

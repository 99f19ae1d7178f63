package dev.mars.syncore.health;

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

import dev.mars.syncore.api.component.ComponentState;
import dev.mars.syncore.api.component.ComponentStatus;

/**
 * Functional interface for a per-component health check.
 *
 * <p>A check that throws, or returns null, marks the component {@link ComponentState#FAILED}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
@FunctionalInterface
public interface ComponentHealthCheck {

    /**
     * Determines the component's current state.
     *
     * @param current the component as currently registered
     * @return the observed state
     * @throws Exception if the check cannot complete
     */
    ComponentState check(ComponentStatus current) throws Exception;
}

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
 * Priority tier for messages and operations. {@link #P0} is the topmost tier.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public enum Priority {
    P0,
    P1,
    P2,
    P3;

    public boolean isTopTier() {
        return this == P0;
    }

    /**
     * Maps the tier onto the scheduler's numeric scale where 1 is the highest priority.
     */
    public int schedulerPriority() {
        return ordinal() + 1;
    }
}

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

import java.util.List;

/**
 * Result of checking whether a component can start given the state of its dependencies.
 *
 * @param canStart   true when every dependency is registered and healthy
 * @param reason     human-readable explanation
 * @param blockedBy  dependency ids that are missing or not healthy
 */
public record StartCheck(boolean canStart, String reason, List<String> blockedBy) {

    public StartCheck {
        blockedBy = blockedBy == null ? List.of() : List.copyOf(blockedBy);
    }

    public static StartCheck ready() {
        return new StartCheck(true, "All dependencies satisfied", List.of());
    }

    public static StartCheck blocked(List<String> blockedBy) {
        return new StartCheck(false, "Blocked by " + blockedBy.size() + " failed dependencies", blockedBy);
    }
}

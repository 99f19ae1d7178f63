package dev.mars.syncore.api.scheduler;

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
 * Per-agent admission limits, checked when a task is submitted.
 *
 * @param agentId        agent the quota applies to
 * @param maxConcurrent  maximum tasks the agent may have running
 * @param maxPerMinute   maximum task starts in the trailing 60 seconds
 * @param maxPerHour     maximum task starts in the trailing hour
 */
public record AgentQuota(String agentId, int maxConcurrent, int maxPerMinute, int maxPerHour) {

    public AgentQuota {
        Objects.requireNonNull(agentId, "Agent id cannot be null");
        if (maxConcurrent < 0 || maxPerMinute < 0 || maxPerHour < 0) {
            throw new IllegalArgumentException("Quota limits must be non-negative for agent " + agentId);
        }
    }
}

package dev.mars.syncore.api.operation;

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

import dev.mars.syncore.api.messaging.Priority;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A unit of coordinated work involving one or more components.
 *
 * @param id           operation id, unique among active operations
 * @param type         operation type, also the default capability a delegate should offer
 * @param initiator    agent that requested the operation, used for scheduler quotas
 * @param participants component ids taking part
 * @param metadata     structured metadata
 * @param createdAt    creation time
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public record Operation(
    String id,
    String type,
    String initiator,
    List<String> participants,
    OperationMetadata metadata,
    Instant createdAt
) {
    public static final String SYSTEM_INITIATOR = "system";

    public Operation {
        Objects.requireNonNull(id, "Operation id cannot be null");
        Objects.requireNonNull(type, "Operation type cannot be null");
        initiator = initiator == null ? SYSTEM_INITIATOR : initiator;
        participants = participants == null ? List.of() : List.copyOf(participants);
        metadata = metadata == null ? OperationMetadata.empty() : metadata;
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static Operation of(String id, String type, Priority priority, String... participants) {
        return new Operation(id, type, null, List.of(participants), OperationMetadata.of(priority), null);
    }

    public Priority priority() {
        return metadata.priority();
    }

    public Operation withParticipants(List<String> newParticipants) {
        return new Operation(id, type, initiator, newParticipants, metadata, createdAt);
    }

    public Operation withMetadata(OperationMetadata newMetadata) {
        return new Operation(id, type, initiator, participants, newMetadata, createdAt);
    }
}

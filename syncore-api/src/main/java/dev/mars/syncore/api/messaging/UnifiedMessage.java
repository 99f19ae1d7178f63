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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * In-process message exchanged between components. Created per send and never persisted.
 *
 * @param source       sending component id
 * @param target       receiving component id, or {@link #BROADCAST}
 * @param type         message kind
 * @param priority     priority tier
 * @param correlation  correlation id, generated when absent
 * @param payload      message body
 * @param timestamp    creation time
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public record UnifiedMessage(
    String source,
    String target,
    MessageType type,
    Priority priority,
    String correlation,
    Map<String, Object> payload,
    Instant timestamp
) {
    public static final String BROADCAST = "broadcast";

    public UnifiedMessage {
        Objects.requireNonNull(source, "Message source cannot be null");
        Objects.requireNonNull(target, "Message target cannot be null");
        Objects.requireNonNull(type, "Message type cannot be null");
        Objects.requireNonNull(priority, "Message priority cannot be null");
        correlation = correlation == null ? UUID.randomUUID().toString() : correlation;
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static UnifiedMessage of(String source, String target, MessageType type, Priority priority) {
        return new UnifiedMessage(source, target, type, priority, null, null, null);
    }

    public static UnifiedMessage broadcast(String source, MessageType type, Priority priority) {
        return new UnifiedMessage(source, BROADCAST, type, priority, null, null, null);
    }

    public boolean isBroadcast() {
        return BROADCAST.equals(target);
    }
}

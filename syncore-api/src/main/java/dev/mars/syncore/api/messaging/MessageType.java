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
 * Kind of a {@link UnifiedMessage}.
 *
 * <p>{@link #EVENT} messages are fan-out notifications and never travel over a direct
 * peer-to-peer connection.</p>
 */
public enum MessageType {
    REQUEST,
    RESPONSE,
    EVENT,
    COMMAND;

    public boolean isBroadcastOnly() {
        return this == EVENT;
    }
}

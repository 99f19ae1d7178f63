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

import java.time.Instant;

/**
 * Immutable error record carried by rejected results and coordination exceptions.
 *
 * @param code      the standard error code (e.g., SYNERR0150)
 * @param message   human-readable error message
 * @param timestamp when the error occurred
 * @param details   optional additional details (can be null)
 */
public record SyncoreError(
    String code,
    String message,
    Instant timestamp,
    String details
) {
    /**
     * Creates an error with code and message, using current timestamp.
     */
    public static SyncoreError of(String code, String message) {
        return new SyncoreError(code, message, Instant.now(), null);
    }

    /**
     * Creates an error with code, message and details, using current timestamp.
     */
    public static SyncoreError of(String code, String message, String details) {
        return new SyncoreError(code, message, Instant.now(), details);
    }

    @Override
    public String toString() {
        return details == null ? code + ": " + message : code + ": " + message + " (" + details + ")";
    }
}

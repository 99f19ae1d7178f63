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

/**
 * How an operation's work is carried out.
 */
public enum ExecutionStrategy {
    /** All participants run the operation now, in-process. */
    IMMEDIATE,
    /** The operation is split into one shard per participant. */
    DISTRIBUTED,
    /** The whole operation is forwarded to a single best-fit component. */
    DELEGATED,
    /** The operation is handed to the fairness scheduler and runs later. */
    QUEUED
}

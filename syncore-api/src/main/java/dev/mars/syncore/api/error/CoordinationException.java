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

/**
 * Unchecked exception carrying a structured {@link SyncoreError}.
 */
public class CoordinationException extends RuntimeException {

    private final SyncoreError error;

    public CoordinationException(SyncoreError error) {
        super(error.toString());
        this.error = error;
    }

    public CoordinationException(SyncoreError error, Throwable cause) {
        super(error.toString(), cause);
        this.error = error;
    }

    public SyncoreError getError() {
        return error;
    }

    public String getErrorCode() {
        return error.code();
    }
}

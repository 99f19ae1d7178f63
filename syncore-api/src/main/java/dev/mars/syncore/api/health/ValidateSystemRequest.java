package dev.mars.syncore.api.health;

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

import dev.mars.syncore.api.operation.Operation;

/**
 * Options for a system validation pass.
 *
 * @param checkDependencies          validate component dependencies
 * @param checkOperationalReadiness  assess readiness and risk
 * @param targetOperation            optional operation to assess risk against
 * @param strictMode                 treat "not ready" as a validation error
 */
public record ValidateSystemRequest(
    boolean checkDependencies,
    boolean checkOperationalReadiness,
    Operation targetOperation,
    boolean strictMode
) {
    public static ValidateSystemRequest defaults() {
        return new ValidateSystemRequest(true, true, null, false);
    }

    public static ValidateSystemRequest strict() {
        return new ValidateSystemRequest(true, true, null, true);
    }

    public ValidateSystemRequest forOperation(Operation operation) {
        return new ValidateSystemRequest(checkDependencies, checkOperationalReadiness, operation, strictMode);
    }
}

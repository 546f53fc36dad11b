/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.saga.engine.step;

import java.time.Duration;

/**
 * The last attempt of a step did not finish within the step timeout.
 */
public class StepTimeoutException extends SagaStepException {

    private final Duration timeout;

    public StepTimeoutException(String stepId, Duration timeout, int attempts) {
        super("Step '" + stepId + "' timed out after " + timeout.toMillis() + "ms", stepId, attempts, null);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}

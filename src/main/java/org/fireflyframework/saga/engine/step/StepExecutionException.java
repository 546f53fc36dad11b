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

/**
 * The action of a step raised an error on its last attempt. The cause is that error.
 */
public class StepExecutionException extends SagaStepException {

    public StepExecutionException(String stepId, int attempts, Throwable cause) {
        super(buildMessage(stepId, attempts, cause), stepId, attempts, cause);
    }

    private static String buildMessage(String stepId, int attempts, Throwable cause) {
        String reason = cause != null && cause.getMessage() != null
                ? cause.getMessage()
                : cause != null ? cause.getClass().getSimpleName() : "unknown error";
        return "Step '" + stepId + "' failed after " + attempts + " attempt(s): " + reason;
    }
}

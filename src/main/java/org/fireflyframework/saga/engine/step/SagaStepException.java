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

import org.fireflyframework.saga.core.SagaException;

/**
 * A step whose action failed for good, either because it was critical or because its
 * retry budget ran out. Triggers compensation of the steps completed before it.
 */
public abstract class SagaStepException extends SagaException {

    private final String stepId;
    private final int attempts;

    protected SagaStepException(String message, String stepId, int attempts, Throwable cause) {
        super(message, cause);
        this.stepId = stepId;
        this.attempts = attempts;
    }

    public String getStepId() {
        return stepId;
    }

    /** Number of attempts made, including the first one. */
    public int getAttempts() {
        return attempts;
    }
}

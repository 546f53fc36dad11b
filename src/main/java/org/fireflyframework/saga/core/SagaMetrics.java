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

package org.fireflyframework.saga.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Progress counters of an execution.
 */
public record SagaMetrics(int totalSteps, int completedSteps, String failedStep, Long executionTimeMs) {

    @JsonCreator
    public SagaMetrics(@JsonProperty("totalSteps") int totalSteps,
                       @JsonProperty("completedSteps") int completedSteps,
                       @JsonProperty("failedStep") String failedStep,
                       @JsonProperty("executionTimeMs") Long executionTimeMs) {
        this.totalSteps = totalSteps;
        this.completedSteps = completedSteps;
        this.failedStep = failedStep;
        this.executionTimeMs = executionTimeMs;
    }

    public static SagaMetrics initial(int totalSteps) {
        return new SagaMetrics(totalSteps, 0, null, null);
    }

    public SagaMetrics withCompletedSteps(int completed) {
        return new SagaMetrics(totalSteps, completed, failedStep, executionTimeMs);
    }

    public SagaMetrics withFailedStep(String stepId) {
        return new SagaMetrics(totalSteps, completedSteps, stepId, executionTimeMs);
    }

    public SagaMetrics withExecutionTimeMs(Long millis) {
        return new SagaMetrics(totalSteps, completedSteps, failedStep, millis);
    }
}

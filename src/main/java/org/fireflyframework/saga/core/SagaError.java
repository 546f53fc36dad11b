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

import java.time.Instant;

/**
 * Error recorded on a failed, compensating or compensated execution.
 *
 * @param type       simple class name of the triggering exception
 * @param message    error message, never {@code null}
 * @param stepId     step that failed, {@code null} for orchestrator-level faults and cancellations
 * @param occurredAt when the error was recorded
 */
public record SagaError(String type, String message, String stepId, Instant occurredAt) {

    @JsonCreator
    public SagaError(@JsonProperty("type") String type,
                     @JsonProperty("message") String message,
                     @JsonProperty("stepId") String stepId,
                     @JsonProperty("occurredAt") Instant occurredAt) {
        this.type = type;
        this.message = message != null ? message : "";
        this.stepId = stepId;
        this.occurredAt = occurredAt;
    }

    public static SagaError from(Throwable error, String stepId, Instant occurredAt) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new SagaError(error.getClass().getSimpleName(), message, stepId, occurredAt);
    }
}

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

package org.fireflyframework.saga.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Data;

import java.time.Instant;

/**
 * Event envelope handed to a {@link SagaEventPublisher} for every lifecycle event.
 * <p>
 * Fields that do not apply to an event kind are {@code null}: step-level fields are only set
 * for step and compensation events, error fields only for failures and retries.
 */
@Data
public class SagaEventEnvelope {
    private SagaEventType type;
    private String sagaName;
    private String sagaId;
    private String stepId;
    private Integer attempt;      // attempt number for step events
    private Integer stepCount;    // steps in the definition, or steps to compensate
    private Long durationMs;      // step latency or saga duration
    private String errorType;
    private String errorMessage;
    private Instant timestamp;

    public SagaEventEnvelope(SagaEventType type, String sagaName, String sagaId, String stepId) {
        this.type = type;
        this.sagaName = sagaName;
        this.sagaId = sagaId;
        this.stepId = stepId;
        this.timestamp = Instant.now();
    }

    public SagaEventEnvelope withError(Throwable error) {
        if (error != null) {
            this.errorType = error.getClass().getSimpleName();
            this.errorMessage = error.getMessage();
        }
        return this;
    }

    @Override
    public String toString() {
        try {
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            return mapper.writeValueAsString(this);
        } catch (Exception e) {
            // Fallback to basic representation if JSON serialization fails
            return String.format("SagaEvent{type=%s, saga=%s, sagaId=%s, step=%s, timestamp=%s}",
                    type, sagaName, sagaId, stepId, timestamp);
        }
    }
}

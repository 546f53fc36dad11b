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
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime context of a single saga execution.
 * <p>
 * Carries the triggering input, the caller attributes (tenant, user, correlation id),
 * the results produced by completed step actions and a free-form metadata map that
 * steps may use to exchange data.
 * <p>
 * Step results and metadata are thread-safe. {@code null} values are never stored.
 * After an execution is reloaded from the durable store, the input, results and
 * metadata hold JSON trees (maps, lists and scalars) rather than the original types.
 */
public class SagaContext {

    private final String sagaId;
    private final String tenantId;
    private final String userId;
    private final String correlationId;
    private final Object input;
    private final Map<String, Object> stepResults = new ConcurrentHashMap<>();
    private final Map<String, Object> metadata = new ConcurrentHashMap<>();
    private final Instant startTime;
    private volatile String currentStep;

    public SagaContext(String sagaId, Object input, SagaOptions options, Instant startTime) {
        this(sagaId,
                options.getTenantId(),
                options.getUserId(),
                options.getCorrelationId(),
                input,
                null,
                options.getMetadata(),
                null,
                startTime);
    }

    @JsonCreator
    public SagaContext(@JsonProperty("sagaId") String sagaId,
                       @JsonProperty("tenantId") String tenantId,
                       @JsonProperty("userId") String userId,
                       @JsonProperty("correlationId") String correlationId,
                       @JsonProperty("input") Object input,
                       @JsonProperty("stepResults") Map<String, Object> stepResults,
                       @JsonProperty("metadata") Map<String, Object> metadata,
                       @JsonProperty("currentStep") String currentStep,
                       @JsonProperty("startTime") Instant startTime) {
        this.sagaId = sagaId;
        this.tenantId = tenantId;
        this.userId = userId;
        this.correlationId = correlationId != null ? correlationId : sagaId;
        this.input = input;
        this.startTime = startTime != null ? startTime : Instant.now();
        this.currentStep = currentStep;
        if (stepResults != null) {
            stepResults.forEach(this::putResult);
        }
        if (metadata != null) {
            metadata.forEach(this::putMetadata);
        }
    }

    public String getSagaId() { return sagaId; }
    public String getTenantId() { return tenantId; }
    public String getUserId() { return userId; }
    public String getCorrelationId() { return correlationId; }
    public Object getInput() { return input; }
    public Instant getStartTime() { return startTime; }

    @SuppressWarnings("unchecked")
    public <T> T getInputAs(Class<T> type) {
        if (input == null) return null;
        if (type.isInstance(input)) return (T) input;
        throw new ClassCastException("Saga input is of type " + input.getClass().getName() + " and cannot be cast to " + type.getName());
    }

    /** Id of the step currently executing, or the last one that ran. */
    public String getCurrentStep() {
        return currentStep;
    }

    public void setCurrentStep(String currentStep) {
        this.currentStep = currentStep;
    }

    // Step results
    /** Live, thread-safe view of the step results. */
    public Map<String, Object> getStepResults() {
        return stepResults;
    }

    public Object getResult(String stepId) {
        return stepId != null ? stepResults.get(stepId) : null;
    }

    public <T> T getResultAs(String stepId, Class<T> type) {
        Object v = getResult(stepId);
        if (v == null) return null;
        if (type.isInstance(v)) return type.cast(v);
        throw new ClassCastException("Result of step '" + stepId + "' is of type " + v.getClass().getName() + " and cannot be cast to " + type.getName());
    }

    public void putResult(String stepId, Object value) {
        if (stepId != null && value != null) {
            stepResults.put(stepId, value);
        }
    }

    // Metadata
    /** Live, thread-safe view of the metadata. */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Object getMetadata(String key) {
        return key != null ? metadata.get(key) : null;
    }

    public void putMetadata(String key, Object value) {
        if (key == null) return;
        if (value == null) {
            metadata.remove(key);
        } else {
            metadata.put(key, value);
        }
    }

    /**
     * Detached copy; the maps are copied shallowly.
     */
    public SagaContext copy() {
        return new SagaContext(sagaId, tenantId, userId, correlationId, input,
                stepResults, metadata, currentStep, startTime);
    }

    @Override
    public String toString() {
        return "SagaContext{" +
                "sagaId='" + sagaId + '\'' +
                ", correlationId='" + correlationId + '\'' +
                ", tenantId='" + tenantId + '\'' +
                ", currentStep='" + currentStep + '\'' +
                ", results=" + stepResults.keySet() +
                '}';
    }
}

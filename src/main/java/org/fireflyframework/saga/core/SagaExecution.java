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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Durable record of one saga run.
 * <p>
 * Instances are owned by the orchestrator and mutated only through the transition methods
 * below, all of which synchronize on the instance. Callers of the public API receive
 * detached copies (see {@link #copy()}).
 * <p>
 * {@code completedSteps} only grows while the saga runs and {@code compensatedSteps} only grows
 * while it compensates. {@code currentStepIndex} equals the number of completed steps whenever no
 * step is in flight.
 */
public final class SagaExecution {

    private final String sagaId;
    private final String definitionId;
    private final SagaContext context;
    private final Instant startTime;
    private final List<String> completedSteps;
    private final List<String> compensatedSteps;
    private final Map<String, String> compensationErrors;
    private SagaStatus status;
    private int currentStepIndex;
    private SagaError error;
    private Instant endTime;
    private Instant updatedAt;
    private SagaMetrics metrics;

    @JsonCreator
    public SagaExecution(@JsonProperty("sagaId") String sagaId,
                         @JsonProperty("definitionId") String definitionId,
                         @JsonProperty("context") SagaContext context,
                         @JsonProperty("status") SagaStatus status,
                         @JsonProperty("currentStepIndex") int currentStepIndex,
                         @JsonProperty("completedSteps") List<String> completedSteps,
                         @JsonProperty("compensatedSteps") List<String> compensatedSteps,
                         @JsonProperty("compensationErrors") Map<String, String> compensationErrors,
                         @JsonProperty("error") SagaError error,
                         @JsonProperty("startTime") Instant startTime,
                         @JsonProperty("endTime") Instant endTime,
                         @JsonProperty("updatedAt") Instant updatedAt,
                         @JsonProperty("metrics") SagaMetrics metrics) {
        this.sagaId = Objects.requireNonNull(sagaId, "sagaId");
        this.definitionId = Objects.requireNonNull(definitionId, "definitionId");
        this.context = Objects.requireNonNull(context, "context");
        this.status = Objects.requireNonNull(status, "status");
        this.currentStepIndex = currentStepIndex;
        this.completedSteps = new ArrayList<>(completedSteps != null ? completedSteps : List.of());
        this.compensatedSteps = new ArrayList<>(compensatedSteps != null ? compensatedSteps : List.of());
        this.compensationErrors = new LinkedHashMap<>(compensationErrors != null ? compensationErrors : Map.of());
        this.error = error;
        this.startTime = startTime != null ? startTime : context.getStartTime();
        this.endTime = endTime;
        this.updatedAt = updatedAt != null ? updatedAt : this.startTime;
        this.metrics = metrics != null ? metrics : SagaMetrics.initial(0);
    }

    /**
     * A fresh {@link SagaStatus#RUNNING} execution positioned before its first step.
     */
    public static SagaExecution start(String definitionId, SagaContext context, int totalSteps) {
        return new SagaExecution(context.getSagaId(), definitionId, context, SagaStatus.RUNNING, 0,
                List.of(), List.of(), Map.of(), null, context.getStartTime(), null,
                context.getStartTime(), SagaMetrics.initial(totalSteps));
    }

    // Getters

    public String getSagaId() { return sagaId; }
    public String getDefinitionId() { return definitionId; }
    public SagaContext getContext() { return context; }
    public Instant getStartTime() { return startTime; }

    public synchronized SagaStatus getStatus() { return status; }
    public synchronized int getCurrentStepIndex() { return currentStepIndex; }
    public synchronized List<String> getCompletedSteps() { return List.copyOf(completedSteps); }
    public synchronized List<String> getCompensatedSteps() { return List.copyOf(compensatedSteps); }
    public synchronized Map<String, String> getCompensationErrors() { return Map.copyOf(compensationErrors); }
    public synchronized SagaError getError() { return error; }
    public synchronized Instant getEndTime() { return endTime; }
    public synchronized Instant getUpdatedAt() { return updatedAt; }
    public synchronized SagaMetrics getMetrics() { return metrics; }

    @JsonIgnore
    public synchronized boolean isCompleted(String stepId) {
        return completedSteps.contains(stepId);
    }

    @JsonIgnore
    public synchronized boolean isCompensated(String stepId) {
        return compensatedSteps.contains(stepId);
    }

    // Transitions

    /**
     * Positions the execution on the step at {@code index} before it runs.
     */
    public synchronized void beginStep(int index, String stepId, Instant now) {
        requireStatus(SagaStatus.RUNNING);
        this.currentStepIndex = index;
        this.context.setCurrentStep(stepId);
        this.updatedAt = now;
    }

    public synchronized void completeStep(String stepId, Instant now) {
        if (!completedSteps.contains(stepId)) {
            completedSteps.add(stepId);
        }
        this.currentStepIndex = completedSteps.size();
        this.metrics = metrics.withCompletedSteps(completedSteps.size());
        this.updatedAt = now;
    }

    public synchronized void markCompleted(Instant now) {
        moveTo(SagaStatus.COMPLETED);
        finish(now);
    }

    /**
     * Starts rollback. The error names the failed step, or has no step for a cancellation.
     */
    public synchronized void markCompensating(SagaError cause, Instant now) {
        moveTo(SagaStatus.COMPENSATING);
        this.error = cause;
        if (cause != null && cause.stepId() != null) {
            this.metrics = metrics.withFailedStep(cause.stepId());
        }
        this.updatedAt = now;
    }

    public synchronized void recordCompensated(String stepId, Instant now) {
        if (!compensatedSteps.contains(stepId)) {
            compensatedSteps.add(stepId);
        }
        compensationErrors.remove(stepId);
        this.updatedAt = now;
    }

    public synchronized void recordCompensationFailure(String stepId, String message, Instant now) {
        compensationErrors.put(stepId, message != null ? message : "");
        this.updatedAt = now;
    }

    public synchronized void markCompensated(Instant now) {
        moveTo(SagaStatus.COMPENSATED);
        finish(now);
    }

    /**
     * Records an orchestrator-level fault. Such a fault can interrupt any phase, including the
     * persistence of another terminal transition, so every status but {@code FAILED} is accepted.
     */
    public synchronized void markFailed(SagaError cause, Instant now) {
        if (status == SagaStatus.FAILED) {
            return;
        }
        this.status = SagaStatus.FAILED;
        this.error = cause;
        finish(now);
    }

    /**
     * Re-arms a failed or compensated execution so that it resumes at its first incomplete step.
     */
    public synchronized void resetForRetry(Instant now) {
        moveTo(SagaStatus.RUNNING);
        this.error = null;
        this.endTime = null;
        this.currentStepIndex = completedSteps.size();
        this.metrics = metrics.withFailedStep(null).withExecutionTimeMs(null);
        this.updatedAt = now;
    }

    public synchronized SagaExecution copy() {
        return new SagaExecution(sagaId, definitionId, context.copy(), status, currentStepIndex,
                completedSteps, compensatedSteps, compensationErrors, error, startTime, endTime,
                updatedAt, metrics);
    }

    private void finish(Instant now) {
        this.endTime = now;
        this.updatedAt = now;
        this.metrics = metrics.withExecutionTimeMs(Math.max(0L, Duration.between(startTime, now).toMillis()));
    }

    private void moveTo(SagaStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Saga " + sagaId + " cannot move from " + status + " to " + target);
        }
        this.status = target;
    }

    private void requireStatus(SagaStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Saga " + sagaId + " is " + status + ", expected " + expected);
        }
    }

    @Override
    public synchronized String toString() {
        return "SagaExecution{" +
                "sagaId='" + sagaId + '\'' +
                ", definitionId='" + definitionId + '\'' +
                ", status=" + status +
                ", currentStepIndex=" + currentStepIndex +
                ", completedSteps=" + completedSteps +
                ", compensatedSteps=" + compensatedSteps +
                ", error=" + error +
                '}';
    }
}

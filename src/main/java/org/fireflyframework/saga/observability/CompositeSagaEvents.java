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

package org.fireflyframework.saga.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fan-out implementation of SagaEvents that delegates to multiple sinks
 * (e.g., logs + metrics + publishing) in registration order.
 * A delegate that throws is logged and does not prevent the others from being notified.
 */
public class CompositeSagaEvents implements SagaEvents {

    private static final Logger log = LoggerFactory.getLogger(CompositeSagaEvents.class);

    private final List<SagaEvents> delegates;

    public CompositeSagaEvents(Collection<? extends SagaEvents> delegates) {
        this.delegates = new ArrayList<>(Objects.requireNonNull(delegates, "delegates"));
    }

    public List<SagaEvents> getDelegates() {
        return List.copyOf(delegates);
    }

    @Override
    public void onSagaRegistered(String definitionId, int stepCount) {
        each("saga_registered", d -> d.onSagaRegistered(definitionId, stepCount));
    }

    @Override
    public void onSagaStarted(String definitionId, String sagaId) {
        each("saga_started", d -> d.onSagaStarted(definitionId, sagaId));
    }

    @Override
    public void onStepExecuted(String definitionId, String sagaId, String stepId, int attempts, long latencyMs) {
        each("step_executed", d -> d.onStepExecuted(definitionId, sagaId, stepId, attempts, latencyMs));
    }

    @Override
    public void onStepCompleted(String definitionId, String sagaId, String stepId, int stepIndex) {
        each("step_completed", d -> d.onStepCompleted(definitionId, sagaId, stepId, stepIndex));
    }

    @Override
    public void onStepFailed(String definitionId, String sagaId, String stepId, Throwable error) {
        each("step_failed", d -> d.onStepFailed(definitionId, sagaId, stepId, error));
    }

    @Override
    public void onStepRetry(String definitionId, String sagaId, String stepId, int attempt, Throwable error) {
        each("step_retry", d -> d.onStepRetry(definitionId, sagaId, stepId, attempt, error));
    }

    @Override
    public void onCompensationStarted(String definitionId, String sagaId, int stepsToCompensate) {
        each("compensation_started", d -> d.onCompensationStarted(definitionId, sagaId, stepsToCompensate));
    }

    @Override
    public void onStepCompensated(String definitionId, String sagaId, String stepId) {
        each("step_compensated", d -> d.onStepCompensated(definitionId, sagaId, stepId));
    }

    @Override
    public void onCompensationFailed(String definitionId, String sagaId, String stepId, Throwable error) {
        each("compensation_failed", d -> d.onCompensationFailed(definitionId, sagaId, stepId, error));
    }

    @Override
    public void onSagaCompleted(String definitionId, String sagaId, long durationMs) {
        each("saga_completed", d -> d.onSagaCompleted(definitionId, sagaId, durationMs));
    }

    @Override
    public void onSagaFailed(String definitionId, String sagaId, Throwable error) {
        each("saga_failed", d -> d.onSagaFailed(definitionId, sagaId, error));
    }

    @Override
    public void onSagaCompensated(String definitionId, String sagaId, Throwable cause, long durationMs) {
        each("saga_compensated", d -> d.onSagaCompensated(definitionId, sagaId, cause, durationMs));
    }

    private void each(String event, Consumer<SagaEvents> call) {
        for (SagaEvents d : delegates) {
            try {
                call.accept(d);
            } catch (RuntimeException e) {
                log.warn("Saga event subscriber {} failed on {}", d.getClass().getName(), event, e);
            }
        }
    }
}

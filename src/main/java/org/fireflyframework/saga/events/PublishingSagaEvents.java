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

import org.fireflyframework.saga.observability.SagaEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Bridges typed lifecycle callbacks to a {@link SagaEventPublisher}.
 * Publishing is fire-and-forget: failures of the publisher are logged and dropped.
 */
public class PublishingSagaEvents implements SagaEvents {

    private static final Logger log = LoggerFactory.getLogger(PublishingSagaEvents.class);

    private final SagaEventPublisher publisher;

    public PublishingSagaEvents(SagaEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void onSagaRegistered(String definitionId, int stepCount) {
        SagaEventEnvelope e = new SagaEventEnvelope(SagaEventType.SAGA_REGISTERED, definitionId, null, null);
        e.setStepCount(stepCount);
        publish(e);
    }

    @Override
    public void onSagaStarted(String definitionId, String sagaId) {
        publish(new SagaEventEnvelope(SagaEventType.SAGA_STARTED, definitionId, sagaId, null));
    }

    @Override
    public void onStepExecuted(String definitionId, String sagaId, String stepId, int attempts, long latencyMs) {
        SagaEventEnvelope e = new SagaEventEnvelope(SagaEventType.STEP_EXECUTED, definitionId, sagaId, stepId);
        e.setAttempt(attempts);
        e.setDurationMs(latencyMs);
        publish(e);
    }

    @Override
    public void onStepCompleted(String definitionId, String sagaId, String stepId, int stepIndex) {
        publish(new SagaEventEnvelope(SagaEventType.STEP_COMPLETED, definitionId, sagaId, stepId));
    }

    @Override
    public void onStepFailed(String definitionId, String sagaId, String stepId, Throwable error) {
        publish(new SagaEventEnvelope(SagaEventType.STEP_FAILED, definitionId, sagaId, stepId).withError(error));
    }

    @Override
    public void onStepRetry(String definitionId, String sagaId, String stepId, int attempt, Throwable error) {
        SagaEventEnvelope e = new SagaEventEnvelope(SagaEventType.STEP_RETRY, definitionId, sagaId, stepId).withError(error);
        e.setAttempt(attempt);
        publish(e);
    }

    @Override
    public void onCompensationStarted(String definitionId, String sagaId, int stepsToCompensate) {
        SagaEventEnvelope e = new SagaEventEnvelope(SagaEventType.COMPENSATION_STARTED, definitionId, sagaId, null);
        e.setStepCount(stepsToCompensate);
        publish(e);
    }

    @Override
    public void onStepCompensated(String definitionId, String sagaId, String stepId) {
        publish(new SagaEventEnvelope(SagaEventType.STEP_COMPENSATED, definitionId, sagaId, stepId));
    }

    @Override
    public void onCompensationFailed(String definitionId, String sagaId, String stepId, Throwable error) {
        publish(new SagaEventEnvelope(SagaEventType.COMPENSATION_FAILED, definitionId, sagaId, stepId).withError(error));
    }

    @Override
    public void onSagaCompleted(String definitionId, String sagaId, long durationMs) {
        SagaEventEnvelope e = new SagaEventEnvelope(SagaEventType.SAGA_COMPLETED, definitionId, sagaId, null);
        e.setDurationMs(durationMs);
        publish(e);
    }

    @Override
    public void onSagaFailed(String definitionId, String sagaId, Throwable error) {
        publish(new SagaEventEnvelope(SagaEventType.SAGA_FAILED, definitionId, sagaId, null).withError(error));
    }

    @Override
    public void onSagaCompensated(String definitionId, String sagaId, Throwable cause, long durationMs) {
        SagaEventEnvelope e = new SagaEventEnvelope(SagaEventType.SAGA_COMPENSATED, definitionId, sagaId, null).withError(cause);
        e.setDurationMs(durationMs);
        publish(e);
    }

    private void publish(SagaEventEnvelope event) {
        Mono.defer(() -> publisher.publish(event))
                .subscribe(
                        v -> { },
                        error -> log.warn("Failed to publish saga event {} for saga {}", event.getType(), event.getSagaId(), error));
    }
}

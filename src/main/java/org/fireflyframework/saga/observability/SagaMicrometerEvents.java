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

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer-based implementation of SagaEvents.
 * <p>
 * Publishes counters, timers and distribution summaries tagged with the saga definition
 * (and the step, where one is involved).
 */
public class SagaMicrometerEvents implements SagaEvents {

    private final MeterRegistry registry;

    public SagaMicrometerEvents(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onSagaStarted(String definitionId, String sagaId) {
        registry.counter("saga.started", sagaTags(definitionId)).increment();
    }

    @Override
    public void onStepExecuted(String definitionId, String sagaId, String stepId, int attempts, long latencyMs) {
        Tags tags = stepTags(definitionId, stepId);
        Timer.builder("saga.step.latency")
                .tags(tags)
                .register(registry)
                .record(Duration.ofMillis(Math.max(0, latencyMs)));
        DistributionSummary.builder("saga.step.attempts")
                .baseUnit("attempts")
                .tags(tags)
                .register(registry)
                .record(attempts);
    }

    @Override
    public void onStepCompleted(String definitionId, String sagaId, String stepId, int stepIndex) {
        registry.counter("saga.step.completed", stepTags(definitionId, stepId)).increment();
    }

    @Override
    public void onStepFailed(String definitionId, String sagaId, String stepId, Throwable error) {
        registry.counter("saga.step.failed", stepTags(definitionId, stepId)
                .and(Tag.of("error.type", error != null ? error.getClass().getSimpleName() : "unknown"))).increment();
    }

    @Override
    public void onStepRetry(String definitionId, String sagaId, String stepId, int attempt, Throwable error) {
        registry.counter("saga.step.retries", stepTags(definitionId, stepId)).increment();
    }

    @Override
    public void onStepCompensated(String definitionId, String sagaId, String stepId) {
        registry.counter("saga.step.compensated", stepTags(definitionId, stepId).and(Tag.of("outcome", "success"))).increment();
    }

    @Override
    public void onCompensationFailed(String definitionId, String sagaId, String stepId, Throwable error) {
        registry.counter("saga.step.compensated", stepTags(definitionId, stepId).and(Tag.of("outcome", "failure"))).increment();
    }

    @Override
    public void onSagaCompleted(String definitionId, String sagaId, long durationMs) {
        finished(definitionId, "completed", durationMs);
    }

    @Override
    public void onSagaFailed(String definitionId, String sagaId, Throwable error) {
        registry.counter("saga.completed", sagaTags(definitionId).and(Tag.of("outcome", "failed"))).increment();
    }

    @Override
    public void onSagaCompensated(String definitionId, String sagaId, Throwable cause, long durationMs) {
        finished(definitionId, "compensated", durationMs);
    }

    private void finished(String definitionId, String outcome, long durationMs) {
        Tags tags = sagaTags(definitionId).and(Tag.of("outcome", outcome));
        registry.counter("saga.completed", tags).increment();
        if (durationMs > 0) {
            registry.timer("saga.execution.time", tags).record(Duration.ofMillis(durationMs));
        }
    }

    private static Tags sagaTags(String definitionId) {
        return Tags.of(Tag.of("saga.name", definitionId));
    }

    private static Tags stepTags(String definitionId, String stepId) {
        return sagaTags(definitionId).and(Tag.of("step.id", stepId));
    }
}

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

package org.fireflyframework.saga.engine;

import org.fireflyframework.saga.core.SagaContext;
import org.fireflyframework.saga.core.SagaExecution;
import org.fireflyframework.saga.engine.step.StepExecutor;
import org.fireflyframework.saga.engine.step.StepTimeoutException;
import org.fireflyframework.saga.observability.SagaEvents;
import org.fireflyframework.saga.persistence.SagaExecutionStore;
import org.fireflyframework.saga.registry.SagaDefinition;
import org.fireflyframework.saga.registry.SagaStep;
import org.fireflyframework.saga.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Undoes the completed steps of an execution in strict reverse order.
 * <p>
 * The pass is best effort: a compensation that fails or times out is recorded on the execution
 * and reported, and the pass moves on to the previous step. Steps already present in
 * {@code compensatedSteps} are skipped, which lets an interrupted pass resume. Only a failure of
 * the durable store aborts the pass.
 */
final class SagaCompensator {

    private static final Logger log = LoggerFactory.getLogger(SagaCompensator.class);

    private final SagaExecutionStore store;
    private final SagaEvents events;
    private final StepExecutor stepExecutor;
    private final Scheduler scheduler;
    private final Clock clock;

    SagaCompensator(SagaExecutionStore store, SagaEvents events, StepExecutor stepExecutor,
                    Scheduler scheduler, Clock clock) {
        this.store = store;
        this.events = events;
        this.stepExecutor = stepExecutor;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    Mono<Void> compensate(SagaDefinition definition, SagaExecution execution) {
        return Mono.defer(() -> {
            List<String> pending = new ArrayList<>();
            synchronized (execution) {
                for (String stepId : execution.getCompletedSteps()) {
                    if (!execution.isCompensated(stepId)) {
                        pending.add(stepId);
                    }
                }
            }
            Collections.reverse(pending);
            log.info(JsonUtils.json(
                    "event", "compensation_started",
                    "saga_id", execution.getSagaId(),
                    "saga_name", definition.getId(),
                    "steps", pending));
            events.onCompensationStarted(definition.getId(), execution.getSagaId(), pending.size());
            return Flux.fromIterable(pending)
                    .concatMap(stepId -> compensateOne(definition, execution, stepId))
                    .then();
        });
    }

    private Mono<Void> compensateOne(SagaDefinition definition, SagaExecution execution, String stepId) {
        SagaStep step = definition.stepById(stepId).orElse(null);
        SagaContext ctx = execution.getContext();
        Mono<Boolean> outcome;
        if (step == null) {
            outcome = Mono.defer(() -> {
                recordFailure(definition, execution, stepId,
                        new IllegalStateException("Step '" + stepId + "' is not part of saga definition '" + definition.getId() + "'"));
                return Mono.just(false);
            });
        } else {
            Duration timeout = stepExecutor.timeoutFor(step);
            outcome = Mono.defer(() -> invoke(step, ctx))
                    .subscribeOn(scheduler)
                    .timeout(timeout, Mono.defer(() -> Mono.error(new StepTimeoutException(stepId, timeout, 1))))
                    .thenReturn(true)
                    .onErrorResume(err -> {
                        recordFailure(definition, execution, stepId, err);
                        return Mono.just(false);
                    });
        }
        return outcome.flatMap(ok -> {
            if (ok) {
                execution.recordCompensated(stepId, clock.instant());
            }
            return store.save(execution)
                    .then(Mono.fromRunnable(() -> {
                        if (ok) {
                            log.info(JsonUtils.json(
                                    "event", "step_compensated",
                                    "saga_id", execution.getSagaId(),
                                    "step_id", stepId));
                            events.onStepCompensated(definition.getId(), execution.getSagaId(), stepId);
                        }
                    }));
        });
    }

    private Mono<Void> invoke(SagaStep step, SagaContext ctx) {
        try {
            Mono<Void> result = step.getCompensation().compensate(ctx, ctx.getResult(step.getId()));
            return result != null ? result : Mono.empty();
        } catch (Throwable t) {
            return Mono.error(t);
        }
    }

    private void recordFailure(SagaDefinition definition, SagaExecution execution, String stepId, Throwable err) {
        CompensationException failure = new CompensationException(stepId, err);
        log.error(JsonUtils.json(
                "event", "compensation_failed",
                "saga_id", execution.getSagaId(),
                "step_id", stepId,
                "error_class", err.getClass().getSimpleName(),
                "error_message", err.getMessage()), err);
        execution.recordCompensationFailure(stepId, failure.getMessage(), clock.instant());
        events.onCompensationFailed(definition.getId(), execution.getSagaId(), stepId, failure);
    }
}

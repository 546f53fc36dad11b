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

import org.fireflyframework.saga.config.SagaOrchestratorProperties;
import org.fireflyframework.saga.core.OrchestratorFaultException;
import org.fireflyframework.saga.core.SagaCancelledException;
import org.fireflyframework.saga.core.SagaContext;
import org.fireflyframework.saga.core.SagaError;
import org.fireflyframework.saga.core.SagaException;
import org.fireflyframework.saga.core.SagaExecution;
import org.fireflyframework.saga.core.SagaMetrics;
import org.fireflyframework.saga.core.SagaNotFoundException;
import org.fireflyframework.saga.core.SagaOptions;
import org.fireflyframework.saga.core.SagaStatistics;
import org.fireflyframework.saga.core.SagaStatus;
import org.fireflyframework.saga.engine.step.SagaStepException;
import org.fireflyframework.saga.engine.step.StepExecutor;
import org.fireflyframework.saga.observability.CompositeSagaEvents;
import org.fireflyframework.saga.observability.SagaEvents;
import org.fireflyframework.saga.persistence.SagaExecutionStore;
import org.fireflyframework.saga.registry.SagaDefinition;
import org.fireflyframework.saga.registry.SagaRegistry;
import org.fireflyframework.saga.registry.SagaStep;
import org.fireflyframework.saga.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for running sagas.
 * <p>
 * {@link #startSaga} persists a new {@link SagaStatus#RUNNING} execution and hands it to a
 * background worker on the orchestrator's scheduler; the caller learns the outcome through
 * {@link #getStatus} or the lifecycle events. The worker runs the steps strictly in order and
 * persists the execution before each step and after each completion. When a step fails for good
 * the completed steps are compensated in reverse order and the saga ends
 * {@link SagaStatus#COMPENSATED}. A failure of the orchestrator itself (typically the durable
 * store) ends the saga {@link SagaStatus#FAILED} without compensation.
 * <p>
 * Executions are cached in memory; the durable store stays authoritative across restarts.
 */
public class SagaOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SagaOrchestrator.class);

    private final SagaRegistry registry;
    private final SagaExecutionStore store;
    private final SagaEvents events;
    private final StepExecutor stepExecutor;
    private final SagaCompensator compensator;
    private final Scheduler scheduler;
    private final boolean ownsScheduler;
    private final Clock clock;

    private final Map<String, SagaExecution> executions = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> activeWorkers = new ConcurrentHashMap<>();
    // errors that started a rollback in this process, handed to the onFailed hook
    private final Map<String, Throwable> rollbackCauses = new ConcurrentHashMap<>();

    /**
     * Orchestrator with default settings and its own worker scheduler, released by {@link #close()}.
     */
    public SagaOrchestrator(SagaRegistry registry, SagaExecutionStore store, SagaEvents events) {
        this(registry, store, events, new SagaOrchestratorProperties());
    }

    public SagaOrchestrator(SagaRegistry registry, SagaExecutionStore store, SagaEvents events,
                            SagaOrchestratorProperties properties) {
        this(registry, store, events, properties, newWorkerScheduler(properties.getWorker()), Clock.systemUTC(), true);
    }

    /**
     * Orchestrator running on a scheduler managed by the caller.
     */
    public SagaOrchestrator(SagaRegistry registry, SagaExecutionStore store, SagaEvents events,
                            SagaOrchestratorProperties properties, Scheduler scheduler, Clock clock) {
        this(registry, store, events, properties, scheduler, clock, false);
    }

    private SagaOrchestrator(SagaRegistry registry, SagaExecutionStore store, SagaEvents events,
                             SagaOrchestratorProperties properties, Scheduler scheduler, Clock clock,
                             boolean ownsScheduler) {
        this.registry = registry;
        this.store = store;
        this.events = isolated(events);
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.clock = clock;
        this.stepExecutor = new StepExecutor(
                properties.getDefaultStepTimeout(),
                properties.getDefaultStepRetries(),
                properties.getRetry().getInitialBackoff(),
                properties.getRetry().isJitter(),
                properties.getRetry().getJitterFactor(),
                scheduler,
                this.events);
        this.compensator = new SagaCompensator(store, this.events, stepExecutor, scheduler, clock);
    }

    public static Scheduler newWorkerScheduler(SagaOrchestratorProperties.WorkerProperties worker) {
        return Schedulers.newBoundedElastic(worker.getThreadCap(), worker.getQueuedTaskCap(), worker.getThreadNamePrefix());
    }

    private static SagaEvents isolated(SagaEvents events) {
        if (events == null) {
            return new CompositeSagaEvents(List.of());
        }
        return events instanceof CompositeSagaEvents ? events : new CompositeSagaEvents(List.of(events));
    }

    // ---------------------------------------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------------------------------------

    /**
     * Registers (or replaces) a saga definition.
     *
     * @throws org.fireflyframework.saga.registry.SagaValidationException if the definition is malformed
     */
    public void registerSaga(SagaDefinition definition) {
        registry.register(definition);
        log.info(JsonUtils.json(
                "event", "saga_registered",
                "saga_name", definition.getId(),
                "steps", definition.size()));
        events.onSagaRegistered(definition.getId(), definition.size());
    }

    public Mono<String> startSaga(String definitionId, Object input) {
        return startSaga(definitionId, input, SagaOptions.none());
    }

    /**
     * Creates and persists a new execution, then schedules it.
     *
     * @return the generated saga id, emitted once the execution is persisted. Errors with
     * {@link SagaNotFoundException} for an unknown definition and with
     * {@link OrchestratorFaultException} when the initial record cannot be persisted.
     */
    public Mono<String> startSaga(String definitionId, Object input, SagaOptions options) {
        return Mono.defer(() -> {
            SagaDefinition definition = registry.getDefinition(definitionId);
            String sagaId = UUID.randomUUID().toString();
            SagaContext ctx = new SagaContext(sagaId, input, options != null ? options : SagaOptions.none(), clock.instant());
            SagaExecution execution = SagaExecution.start(definition.getId(), ctx, definition.size());
            executions.put(sagaId, execution);
            return store.save(execution)
                    .doOnError(e -> {
                        executions.remove(sagaId, execution);
                        log.error(JsonUtils.json(
                                "event", "saga_start_failed",
                                "saga_id", sagaId,
                                "saga_name", definition.getId(),
                                "error_message", e.getMessage()), e);
                    })
                    .then(Mono.fromRunnable(() -> {
                        log.info(JsonUtils.json(
                                "event", "saga_started",
                                "saga_id", sagaId,
                                "saga_name", definition.getId(),
                                "correlation_id", ctx.getCorrelationId(),
                                "steps", definition.size()));
                        events.onSagaStarted(definition.getId(), sagaId);
                        dispatch(execution, drive(definition, execution));
                    }))
                    .thenReturn(sagaId);
        });
    }

    /**
     * @return a detached copy of the execution, read from memory or else from the durable store;
     * empty when the saga is unknown
     */
    public Mono<SagaExecution> getStatus(String sagaId) {
        return findExecution(sagaId).map(SagaExecution::copy);
    }

    /**
     * Requests rollback of a running saga. The step in flight, if any, is allowed to finish first.
     *
     * @return {@code true} if the saga moved to {@link SagaStatus#COMPENSATING}, {@code false} if
     * it was not running
     */
    public Mono<Boolean> cancelSaga(String sagaId) {
        return findExecution(sagaId)
                .switchIfEmpty(Mono.error(() -> SagaNotFoundException.execution(sagaId)))
                .flatMap(execution -> {
                    SagaDefinition definition = registry.getDefinition(execution.getDefinitionId());
                    boolean needsWorker;
                    synchronized (execution) {
                        if (execution.getStatus() != SagaStatus.RUNNING) {
                            return Mono.just(false);
                        }
                        SagaCancelledException cancelled = new SagaCancelledException(sagaId);
                        execution.markCompensating(SagaError.from(cancelled, null, clock.instant()), clock.instant());
                        rollbackCauses.put(sagaId, cancelled);
                        needsWorker = !hasActiveWorker(sagaId);
                    }
                    log.warn(JsonUtils.json(
                            "event", "saga_cancelled",
                            "saga_id", sagaId,
                            "saga_name", definition.getId(),
                            "completed_steps", execution.getCompletedSteps().size()));
                    if (needsWorker) {
                        dispatch(execution, guarded(definition, execution, compensateAndFinish(definition, execution)));
                    }
                    return Mono.just(true);
                });
    }

    /**
     * Re-runs a failed or compensated saga from its first incomplete step. Steps already recorded
     * as completed are never executed again.
     *
     * @return {@code false} if the saga is neither failed nor compensated
     */
    public Mono<Boolean> retrySaga(String sagaId) {
        return findExecution(sagaId)
                .switchIfEmpty(Mono.error(() -> SagaNotFoundException.execution(sagaId)))
                .flatMap(execution -> {
                    SagaDefinition definition = registry.getDefinition(execution.getDefinitionId());
                    synchronized (execution) {
                        if (!execution.getStatus().isRetriable()) {
                            return Mono.just(false);
                        }
                        execution.resetForRetry(clock.instant());
                    }
                    log.info(JsonUtils.json(
                            "event", "saga_retry",
                            "saga_id", sagaId,
                            "saga_name", definition.getId(),
                            "resume_index", execution.getCurrentStepIndex()));
                    return store.save(execution)
                            .onErrorResume(e -> fail(definition, execution, e).then(Mono.error(e)))
                            .then(Mono.fromRunnable(() -> dispatch(execution, drive(definition, execution))))
                            .thenReturn(true);
                });
    }

    /**
     * Statistics over the executions currently held in memory.
     */
    public SagaStatistics getStatistics() {
        long total = 0;
        long running = 0;
        long completed = 0;
        long failed = 0;
        long timed = 0;
        long totalTime = 0;
        for (SagaExecution execution : executions.values()) {
            total++;
            SagaStatus status = execution.getStatus();
            if (status == SagaStatus.RUNNING) running++;
            else if (status == SagaStatus.COMPLETED) completed++;
            else if (status == SagaStatus.FAILED || status == SagaStatus.COMPENSATED) failed++;
            Long time = execution.getMetrics().executionTimeMs();
            if (time != null) {
                timed++;
                totalTime += time;
            }
        }
        double average = timed > 0 ? (double) totalTime / timed : 0.0d;
        return new SagaStatistics(total, running, completed, failed, average, registry.size());
    }

    /**
     * Evicts terminal executions started before {@code now - olderThan} from memory and deletes
     * their records.
     *
     * @return the number of executions evicted
     */
    public Mono<Long> cleanup(Duration olderThan) {
        return Mono.defer(() -> {
            Instant cutoff = clock.instant().minus(olderThan);
            List<String> evicted = new ArrayList<>();
            executions.forEach((sagaId, execution) -> {
                if (execution.getStatus().isTerminal()
                        && execution.getStartTime().isBefore(cutoff)
                        && !hasActiveWorker(sagaId)
                        && executions.remove(sagaId, execution)) {
                    evicted.add(sagaId);
                }
            });
            return Flux.fromIterable(evicted)
                    .concatMap(sagaId -> store.delete(sagaId)
                            .onErrorResume(e -> {
                                log.warn("Failed to delete record of evicted saga {}", sagaId, e);
                                return Mono.empty();
                            }))
                    .then(Mono.fromCallable(() -> {
                        if (!evicted.isEmpty()) {
                            log.info(JsonUtils.json("event", "saga_cleanup", "evicted", evicted.size(), "cutoff", cutoff));
                        }
                        return (long) evicted.size();
                    }));
        });
    }

    /**
     * Adopts an execution read from the durable store and continues it: a running saga resumes at
     * its first incomplete step, a compensating one resumes its reverse pass.
     *
     * @return {@code false} when the execution is not in flight, its definition is not registered,
     * or a worker already owns it
     */
    Mono<Boolean> resume(SagaExecution loaded) {
        return Mono.defer(() -> {
            String sagaId = loaded.getSagaId();
            if (!loaded.getStatus().isInFlight() || !registry.hasDefinition(loaded.getDefinitionId())
                    || hasActiveWorker(sagaId)) {
                return Mono.just(false);
            }
            SagaExecution cached = executions.putIfAbsent(sagaId, loaded);
            SagaExecution execution = cached != null ? cached : loaded;
            SagaDefinition definition = registry.getDefinition(execution.getDefinitionId());
            SagaStatus status = execution.getStatus();
            log.info(JsonUtils.json(
                    "event", "saga_resumed",
                    "saga_id", sagaId,
                    "saga_name", definition.getId(),
                    "status", status.wireValue(),
                    "completed_steps", execution.getCompletedSteps().size()));
            if (status == SagaStatus.RUNNING) {
                dispatch(execution, drive(definition, execution));
            } else if (status == SagaStatus.COMPENSATING) {
                dispatch(execution, guarded(definition, execution, compensateAndFinish(definition, execution)));
            } else {
                return Mono.just(false);
            }
            return Mono.just(true);
        });
    }

    public SagaRegistry getRegistry() {
        return registry;
    }

    public SagaExecutionStore getStore() {
        return store;
    }

    /** Whether a background worker currently drives the saga. */
    public boolean isActive(String sagaId) {
        return hasActiveWorker(sagaId);
    }

    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.dispose();
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Worker flow
    // ---------------------------------------------------------------------------------------------

    private Mono<SagaExecution> findExecution(String sagaId) {
        return Mono.defer(() -> {
            if (sagaId == null) {
                return Mono.empty();
            }
            SagaExecution cached = executions.get(sagaId);
            if (cached != null) {
                return Mono.just(cached);
            }
            return store.load(sagaId).map(loaded -> {
                SagaExecution previous = executions.putIfAbsent(sagaId, loaded);
                return previous != null ? previous : loaded;
            });
        });
    }

    private void dispatch(SagaExecution execution, Mono<Void> work) {
        String sagaId = execution.getSagaId();
        activeWorkers.computeIfAbsent(sagaId, k -> new AtomicInteger()).incrementAndGet();
        work.subscribeOn(scheduler)
                .doFinally(signal -> release(sagaId))
                .subscribe(
                        v -> { },
                        error -> log.error(JsonUtils.json(
                                "event", "saga_worker_error",
                                "saga_id", sagaId,
                                "error_class", error.getClass().getSimpleName(),
                                "error_message", error.getMessage()), error));
    }

    private void release(String sagaId) {
        activeWorkers.computeIfPresent(sagaId, (k, counter) -> counter.decrementAndGet() <= 0 ? null : counter);
    }

    private boolean hasActiveWorker(String sagaId) {
        AtomicInteger counter = activeWorkers.get(sagaId);
        return counter != null && counter.get() > 0;
    }

    private Mono<Void> drive(SagaDefinition definition, SagaExecution execution) {
        return guarded(definition, execution, runSteps(definition, execution));
    }

    private Mono<Void> guarded(SagaDefinition definition, SagaExecution execution, Mono<Void> work) {
        return work.onErrorResume(err -> fail(definition, execution, err));
    }

    /**
     * Runs the next incomplete step, or finishes the saga when none is left. The status check and
     * the positioning on the next step happen under the execution's monitor so that a concurrent
     * cancellation is observed at the step boundary.
     */
    private Mono<Void> runSteps(SagaDefinition definition, SagaExecution execution) {
        return Mono.defer(() -> {
            SagaStep next;
            synchronized (execution) {
                SagaStatus status = execution.getStatus();
                if (status == SagaStatus.COMPENSATING) {
                    return compensateAndFinish(definition, execution);
                }
                if (status != SagaStatus.RUNNING) {
                    return Mono.empty();
                }
                int index = execution.getCompletedSteps().size();
                if (index >= definition.size()) {
                    execution.markCompleted(clock.instant());
                    return finishCompleted(definition, execution);
                }
                next = definition.getSteps().get(index);
                execution.beginStep(index, next.getId(), clock.instant());
            }
            SagaStep step = next;
            return store.save(execution)
                    .then(stepExecutor.execute(definition.getId(), execution.getContext(), step)
                            .thenReturn(Optional.<SagaStepException>empty())
                            .onErrorResume(SagaStepException.class, e -> Mono.just(Optional.of(e))))
                    .flatMap(failure -> failure.isPresent()
                            ? onStepFailed(definition, execution, step, failure.get())
                            : onStepSucceeded(definition, execution, step));
        });
    }

    private Mono<Void> onStepSucceeded(SagaDefinition definition, SagaExecution execution, SagaStep step) {
        int index;
        synchronized (execution) {
            execution.completeStep(step.getId(), clock.instant());
            index = execution.getCompletedSteps().size() - 1;
        }
        return store.save(execution)
                .then(Mono.fromRunnable(() -> {
                    log.info(JsonUtils.json(
                            "event", "step_completed",
                            "saga_id", execution.getSagaId(),
                            "step_id", step.getId(),
                            "step_index", index));
                    events.onStepCompleted(definition.getId(), execution.getSagaId(), step.getId(), index);
                }))
                .then(runSteps(definition, execution));
    }

    private Mono<Void> onStepFailed(SagaDefinition definition, SagaExecution execution, SagaStep step,
                                    SagaStepException error) {
        log.error(JsonUtils.json(
                "event", "step_failed",
                "saga_id", execution.getSagaId(),
                "step_id", step.getId(),
                "attempts", error.getAttempts(),
                "critical", step.isCritical(),
                "error_class", error.getClass().getSimpleName(),
                "error_message", error.getMessage()));
        events.onStepFailed(definition.getId(), execution.getSagaId(), step.getId(), error);
        synchronized (execution) {
            // a cancellation that arrived while the step ran keeps its own error
            if (execution.getStatus() == SagaStatus.RUNNING) {
                execution.markCompensating(SagaError.from(error, step.getId(), clock.instant()), clock.instant());
                rollbackCauses.put(execution.getSagaId(), error);
            }
        }
        return compensateAndFinish(definition, execution);
    }

    private Mono<Void> compensateAndFinish(SagaDefinition definition, SagaExecution execution) {
        return store.save(execution)
                .then(compensator.compensate(definition, execution))
                .then(Mono.defer(() -> {
                    execution.markCompensated(clock.instant());
                    return store.save(execution);
                }))
                .then(Mono.defer(() -> {
                    Throwable recorded = rollbackCauses.remove(execution.getSagaId());
                    Throwable cause = recorded != null ? recorded : causeOf(execution);
                    long duration = durationOf(execution);
                    return runFailureHook(definition, execution, cause)
                            .then(Mono.fromRunnable(() -> {
                                log.warn(JsonUtils.json(
                                        "event", "saga_compensated",
                                        "saga_id", execution.getSagaId(),
                                        "saga_name", definition.getId(),
                                        "completed_steps", execution.getCompletedSteps().size(),
                                        "compensated_steps", execution.getCompensatedSteps().size(),
                                        "duration_ms", duration));
                                events.onSagaCompensated(definition.getId(), execution.getSagaId(), cause, duration);
                            }));
                }));
    }

    private Mono<Void> finishCompleted(SagaDefinition definition, SagaExecution execution) {
        return store.save(execution)
                .then(Mono.defer(() -> runCompletionHook(definition, execution)))
                .then(Mono.fromRunnable(() -> {
                    long duration = durationOf(execution);
                    log.info(JsonUtils.json(
                            "event", "saga_completed",
                            "saga_id", execution.getSagaId(),
                            "saga_name", definition.getId(),
                            "duration_ms", duration));
                    events.onSagaCompleted(definition.getId(), execution.getSagaId(), duration);
                }));
    }

    /**
     * Orchestrator-level fault: the saga fails without compensation since the durability layer
     * cannot be trusted to record a partial rollback.
     */
    private Mono<Void> fail(SagaDefinition definition, SagaExecution execution, Throwable err) {
        return Mono.defer(() -> {
            OrchestratorFaultException fault = err instanceof OrchestratorFaultException
                    ? (OrchestratorFaultException) err
                    : new OrchestratorFaultException("Saga " + execution.getSagaId() + " failed: " + err.getMessage(), err);
            log.error(JsonUtils.json(
                    "event", "saga_failed",
                    "saga_id", execution.getSagaId(),
                    "saga_name", definition.getId(),
                    "error_class", err.getClass().getSimpleName(),
                    "error_message", err.getMessage()), err);
            execution.markFailed(SagaError.from(fault, null, clock.instant()), clock.instant());
            rollbackCauses.remove(execution.getSagaId());
            return store.save(execution)
                    .onErrorResume(e -> {
                        log.error("Failed to persist failed state of saga {}", execution.getSagaId(), e);
                        return Mono.empty();
                    })
                    .then(runFailureHook(definition, execution, fault))
                    .then(Mono.fromRunnable(() -> events.onSagaFailed(definition.getId(), execution.getSagaId(), fault)));
        });
    }

    private Mono<Void> runCompletionHook(SagaDefinition definition, SagaExecution execution) {
        return definition.getOnComplete()
                .map(hook -> Mono.defer(() -> orEmpty(hook.onComplete(execution.getContext())))
                        .onErrorResume(e -> {
                            log.error(JsonUtils.json(
                                    "event", "saga_hook_failed",
                                    "hook", "onComplete",
                                    "saga_id", execution.getSagaId(),
                                    "error_message", e.getMessage()), e);
                            return Mono.empty();
                        }))
                .orElse(Mono.empty());
    }

    private Mono<Void> runFailureHook(SagaDefinition definition, SagaExecution execution, Throwable cause) {
        return definition.getOnFailed()
                .map(hook -> Mono.defer(() -> orEmpty(hook.onFailed(execution.getContext(), cause)))
                        .onErrorResume(e -> {
                            log.error(JsonUtils.json(
                                    "event", "saga_hook_failed",
                                    "hook", "onFailed",
                                    "saga_id", execution.getSagaId(),
                                    "error_message", e.getMessage()), e);
                            return Mono.empty();
                        }))
                .orElse(Mono.empty());
    }

    private static Mono<Void> orEmpty(Mono<Void> mono) {
        return mono != null ? mono : Mono.empty();
    }

    /**
     * The error that started the rollback, rebuilt from the record when the original exception is
     * not at hand (the execution may have been reloaded from the store).
     */
    private static Throwable causeOf(SagaExecution execution) {
        SagaError error = execution.getError();
        if (error == null) {
            return new SagaException("Saga " + execution.getSagaId() + " was compensated");
        }
        if (SagaCancelledException.class.getSimpleName().equals(error.type())) {
            return new SagaCancelledException(execution.getSagaId());
        }
        return new SagaException(error.type() + ": " + error.message());
    }

    private static long durationOf(SagaExecution execution) {
        SagaMetrics metrics = execution.getMetrics();
        return metrics.executionTimeMs() != null ? metrics.executionTimeMs() : 0L;
    }
}

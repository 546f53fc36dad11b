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
import org.fireflyframework.saga.core.SagaExecution;
import org.fireflyframework.saga.core.SagaNotFoundException;
import org.fireflyframework.saga.core.SagaOptions;
import org.fireflyframework.saga.core.SagaStatistics;
import org.fireflyframework.saga.core.SagaStatus;
import org.fireflyframework.saga.engine.step.StepExecutionException;
import org.fireflyframework.saga.observability.CompositeSagaEvents;
import org.fireflyframework.saga.observability.SagaEvents;
import org.fireflyframework.saga.persistence.SagaExecutionStore;
import org.fireflyframework.saga.persistence.serialization.JsonSagaExecutionSerializer;
import org.fireflyframework.saga.registry.SagaBuilder;
import org.fireflyframework.saga.registry.SagaDefinition;
import org.fireflyframework.saga.registry.SagaRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class SagaOrchestratorTest {

    private FlakyDurableStore durableStore;
    private SagaExecutionStore store;
    private RecordingSagaEvents events;
    private SagaOrchestrator orchestrator;

    static SagaOrchestratorProperties testProperties() {
        SagaOrchestratorProperties properties = new SagaOrchestratorProperties();
        properties.setDefaultStepTimeout(Duration.ofSeconds(2));
        properties.getRetry().setInitialBackoff(Duration.ofMillis(10));
        properties.getWorker().setThreadCap(8);
        return properties;
    }

    @BeforeEach
    void setUp() {
        durableStore = new FlakyDurableStore();
        store = new SagaExecutionStore(durableStore, new JsonSagaExecutionSerializer(), "saga:", Duration.ofDays(7), null);
        events = new RecordingSagaEvents();
        orchestrator = new SagaOrchestrator(new SagaRegistry(), store, events, testProperties());
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    private String start(String definitionId, Object input) {
        String sagaId = orchestrator.startSaga(definitionId, input).block(Duration.ofSeconds(5));
        assertThat(sagaId).isNotBlank();
        return sagaId;
    }

    private static void awaitIdle(SagaOrchestrator target, String sagaId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (target.isActive(sagaId) && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(target.isActive(sagaId)).isFalse();
    }

    private SagaExecution status(String sagaId) {
        return orchestrator.getStatus(sagaId).block(Duration.ofSeconds(5));
    }

    @Test
    void runsAllStepsInOrderAndCompletes() throws Exception {
        List<String> order = new CopyOnWriteArrayList<>();
        AtomicReference<String> hookSaw = new AtomicReference<>();
        orchestrator.registerSaga(SagaBuilder.saga("order")
                .step("reserve").action(ctx -> Mono.fromCallable(() -> { order.add("reserve"); return "R-1"; })).noCompensation().add()
                .step("charge").action(ctx -> Mono.fromCallable(() -> {
                    order.add("charge");
                    return "charged " + ctx.getResultAs("reserve", String.class);
                })).noCompensation().add()
                .step("ship").action(ctx -> Mono.fromRunnable(() -> order.add("ship"))).noCompensation().add()
                .onComplete(ctx -> Mono.fromRunnable(() -> hookSaw.set(ctx.getResultAs("charge", String.class))))
                .build());

        String sagaId = start("order", "input");
        events.awaitFinished(sagaId);

        SagaExecution execution = status(sagaId);
        assertThat(execution.getStatus()).isEqualTo(SagaStatus.COMPLETED);
        assertThat(execution.getCompletedSteps()).containsExactly("reserve", "charge", "ship");
        assertThat(execution.getCurrentStepIndex()).isEqualTo(3);
        assertThat(execution.getError()).isNull();
        assertThat(execution.getEndTime()).isNotNull();
        assertThat(execution.getMetrics().completedSteps()).isEqualTo(3);
        assertThat(execution.getMetrics().executionTimeMs()).isNotNull();
        assertThat(execution.getContext().getResult("reserve")).isEqualTo("R-1");
        assertThat(execution.getContext().getStepResults()).doesNotContainKey("ship");
        assertThat(order).containsExactly("reserve", "charge", "ship");
        assertThat(hookSaw.get()).isEqualTo("charged R-1");
        assertThat(events.calls).containsSubsequence(
                "saga_registered:order", "saga_started:order",
                "step_completed:reserve", "step_completed:charge", "step_completed:ship",
                "saga_completed:order");

        StepVerifier.create(store.load(sagaId))
                .assertNext(persisted -> {
                    assertThat(persisted.getStatus()).isEqualTo(SagaStatus.COMPLETED);
                    assertThat(persisted.getCompletedSteps()).containsExactly("reserve", "charge", "ship");
                })
                .verifyComplete();
    }

    @Test
    void contextCarriesOptionsAndDefaultsCorrelationIdToSagaId() throws Exception {
        orchestrator.registerSaga(SagaBuilder.saga("ctx")
                .step("only").action(ctx -> Mono.just(ctx.getTenantId() + "/" + ctx.getUserId())).noCompensation().add()
                .build());

        String withOptions = orchestrator.startSaga("ctx", null, SagaOptions.builder()
                .tenantId("t-1").userId("u-1").correlationId("corr-1").metadata("channel", "web").build())
                .block(Duration.ofSeconds(5));
        String withoutOptions = start("ctx", null);
        events.awaitFinished(withOptions);
        events.awaitFinished(withoutOptions);

        SagaExecution first = status(withOptions);
        assertThat(first.getContext().getCorrelationId()).isEqualTo("corr-1");
        assertThat(first.getContext().getMetadata("channel")).isEqualTo("web");
        assertThat(first.getContext().getResult("only")).isEqualTo("t-1/u-1");
        assertThat(status(withoutOptions).getContext().getCorrelationId()).isEqualTo(withoutOptions);
    }

    @Test
    void failedStepCompensatesCompletedStepsInReverseOrder() throws Exception {
        List<String> compensated = new CopyOnWriteArrayList<>();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        orchestrator.registerSaga(SagaBuilder.saga("rollback")
                .step("a").action(ctx -> Mono.just("A")).compensation((ctx, result) -> Mono.fromRunnable(() -> compensated.add("a:" + result))).add()
                .step("b").action(ctx -> Mono.just("B")).compensation((ctx, result) -> Mono.fromRunnable(() -> compensated.add("b:" + result))).add()
                .step("c").action(ctx -> Mono.just("C")).compensation((ctx, result) -> Mono.fromRunnable(() -> compensated.add("c:" + result))).add()
                .step("d").action(ctx -> Mono.error(new IllegalStateException("card declined"))).retries(0).noCompensation().add()
                .onFailed((ctx, error) -> Mono.fromRunnable(() -> failure.set(error)))
                .build());

        String sagaId = start("rollback", null);
        events.awaitFinished(sagaId);

        SagaExecution execution = status(sagaId);
        assertThat(execution.getStatus()).isEqualTo(SagaStatus.COMPENSATED);
        assertThat(execution.getCompletedSteps()).containsExactly("a", "b", "c");
        assertThat(execution.getCompensatedSteps()).containsExactly("c", "b", "a");
        assertThat(execution.getCompensationErrors()).isEmpty();
        assertThat(execution.getError().stepId()).isEqualTo("d");
        assertThat(execution.getError().type()).isEqualTo("StepExecutionException");
        assertThat(execution.getMetrics().failedStep()).isEqualTo("d");
        assertThat(compensated).containsExactly("c:C", "b:B", "a:A");
        assertThat(failure.get()).isInstanceOf(StepExecutionException.class).hasRootCauseMessage("card declined");
        assertThat(events.compensationCauses).singleElement().isInstanceOf(StepExecutionException.class);
        assertThat(events.calls).containsSubsequence(
                "step_failed:d", "compensation_started:3",
                "step_compensated:c", "step_compensated:b", "step_compensated:a",
                "saga_compensated:rollback");
    }

    @Test
    void transientFailuresAreRetriedUntilTheStepSucceeds() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        orchestrator.registerSaga(SagaBuilder.saga("flaky")
                .step("call").action(ctx -> Mono.fromCallable(() -> {
                    if (attempts.incrementAndGet() < 3) {
                        throw new IllegalStateException("temporarily unavailable");
                    }
                    return "ok";
                })).retries(2).noCompensation().add()
                .build());

        String sagaId = start("flaky", null);
        events.awaitFinished(sagaId);

        assertThat(status(sagaId).getStatus()).isEqualTo(SagaStatus.COMPLETED);
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(events.callsStartingWith("step_retry:")).containsExactly("step_retry:call:1", "step_retry:call:2");
    }

    @Test
    void exhaustedRetriesStartRollback() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        AtomicInteger compensations = new AtomicInteger();
        orchestrator.registerSaga(SagaBuilder.saga("exhausted")
                .step("first").action(ctx -> Mono.just(1)).compensationCtx(ctx -> Mono.fromRunnable(compensations::incrementAndGet)).add()
                .step("second").action(ctx -> Mono.fromCallable(() -> {
                    attempts.incrementAndGet();
                    throw new IllegalStateException("down");
                })).retries(2).noCompensation().add()
                .build());

        String sagaId = start("exhausted", null);
        events.awaitFinished(sagaId);

        SagaExecution execution = status(sagaId);
        assertThat(execution.getStatus()).isEqualTo(SagaStatus.COMPENSATED);
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(compensations.get()).isEqualTo(1);
    }

    @Test
    void criticalStepIsNeverRetried() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        orchestrator.registerSaga(SagaBuilder.saga("critical")
                .step("pay").action(ctx -> Mono.fromCallable(() -> {
                    attempts.incrementAndGet();
                    throw new IllegalStateException("rejected");
                })).retries(5).critical().noCompensation().add()
                .build());

        String sagaId = start("critical", null);
        events.awaitFinished(sagaId);

        assertThat(status(sagaId).getStatus()).isEqualTo(SagaStatus.COMPENSATED);
        assertThat(attempts.get()).isEqualTo(1);
        assertThat(events.callsStartingWith("step_retry:")).isEmpty();
    }

    @Test
    void stepExceedingItsTimeoutFails() throws Exception {
        orchestrator.registerSaga(SagaBuilder.saga("slow")
                .step("hang").action(ctx -> Mono.never()).timeoutMs(50).retries(0).noCompensation().add()
                .build());

        String sagaId = start("slow", null);
        events.awaitFinished(sagaId);

        SagaExecution execution = status(sagaId);
        assertThat(execution.getStatus()).isEqualTo(SagaStatus.COMPENSATED);
        assertThat(execution.getError().type()).isEqualTo("StepTimeoutException");
        assertThat(execution.getError().stepId()).isEqualTo("hang");
    }

    @Test
    void failingCompensationIsRecordedAndRollbackContinues() throws Exception {
        List<String> attempted = new CopyOnWriteArrayList<>();
        orchestrator.registerSaga(SagaBuilder.saga("best-effort")
                .step("a").action(ctx -> Mono.just("A")).compensationCtx(ctx -> Mono.fromRunnable(() -> attempted.add("a"))).add()
                .step("b").action(ctx -> Mono.just("B")).compensationCtx(ctx -> Mono.defer(() -> {
                    attempted.add("b");
                    return Mono.error(new IllegalStateException("refund service down"));
                })).add()
                .step("c").action(ctx -> Mono.error(new IllegalStateException("boom"))).retries(0).noCompensation().add()
                .build());

        String sagaId = start("best-effort", null);
        events.awaitFinished(sagaId);

        SagaExecution execution = status(sagaId);
        assertThat(execution.getStatus()).isEqualTo(SagaStatus.COMPENSATED);
        assertThat(attempted).containsExactly("b", "a");
        assertThat(execution.getCompensatedSteps()).containsExactly("a");
        assertThat(execution.getCompensationErrors()).containsOnlyKeys("b");
        assertThat(execution.getCompensationErrors().get("b")).contains("refund service down");
        assertThat(events.calls).contains("compensation_failed:b", "step_compensated:a");
    }

    @Test
    void cancellationWaitsForTheRunningStepThenCompensates() throws Exception {
        CountDownLatch stepStarted = new CountDownLatch(1);
        CountDownLatch releaseStep = new CountDownLatch(1);
        AtomicInteger thirdStepRuns = new AtomicInteger();
        List<String> compensated = new CopyOnWriteArrayList<>();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        orchestrator.registerSaga(SagaBuilder.saga("cancel")
                .step("a").action(ctx -> Mono.just("A")).compensationCtx(ctx -> Mono.fromRunnable(() -> compensated.add("a"))).add()
                .step("b").action(ctx -> Mono.fromCallable(() -> {
                    stepStarted.countDown();
                    releaseStep.await(5, TimeUnit.SECONDS);
                    return "B";
                })).compensationCtx(ctx -> Mono.fromRunnable(() -> compensated.add("b"))).add()
                .step("c").action(ctx -> Mono.fromRunnable(thirdStepRuns::incrementAndGet)).noCompensation().add()
                .onFailed((ctx, error) -> Mono.fromRunnable(() -> failure.set(error)))
                .build());

        String sagaId = start("cancel", null);
        assertThat(stepStarted.await(5, TimeUnit.SECONDS)).isTrue();

        StepVerifier.create(orchestrator.cancelSaga(sagaId)).expectNext(true).verifyComplete();
        assertThat(status(sagaId).getStatus()).isEqualTo(SagaStatus.COMPENSATING);
        StepVerifier.create(orchestrator.cancelSaga(sagaId)).expectNext(false).verifyComplete();

        releaseStep.countDown();
        events.awaitFinished(sagaId);

        SagaExecution execution = status(sagaId);
        assertThat(execution.getStatus()).isEqualTo(SagaStatus.COMPENSATED);
        assertThat(execution.getCompletedSteps()).containsExactly("a", "b");
        assertThat(execution.getError().type()).isEqualTo("SagaCancelledException");
        assertThat(compensated).containsExactly("b", "a");
        assertThat(thirdStepRuns.get()).isZero();
        assertThat(failure.get()).isInstanceOf(SagaCancelledException.class);
    }

    @Test
    void cancelOfFinishedSagaIsRejected() throws Exception {
        orchestrator.registerSaga(SagaBuilder.saga("quick")
                .step("only").action(ctx -> Mono.just(1)).noCompensation().add()
                .build());
        String sagaId = start("quick", null);
        events.awaitFinished(sagaId);

        StepVerifier.create(orchestrator.cancelSaga(sagaId)).expectNext(false).verifyComplete();
        assertThat(status(sagaId).getStatus()).isEqualTo(SagaStatus.COMPLETED);
    }

    @Test
    void unknownSagaIsReported() {
        StepVerifier.create(orchestrator.getStatus("missing")).verifyComplete();
        StepVerifier.create(orchestrator.cancelSaga("missing")).expectError(SagaNotFoundException.class).verify();
        StepVerifier.create(orchestrator.retrySaga("missing")).expectError(SagaNotFoundException.class).verify();
        StepVerifier.create(orchestrator.startSaga("no-such-definition", null))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(SagaNotFoundException.class)
                        .hasMessageContaining("no-such-definition"))
                .verify();
    }

    @Test
    void retryResumesAtTheFirstIncompleteStep() throws Exception {
        AtomicInteger firstRuns = new AtomicInteger();
        AtomicInteger secondRuns = new AtomicInteger();
        AtomicInteger thirdRuns = new AtomicInteger();
        orchestrator.registerSaga(SagaBuilder.saga("resumable")
                .step("first").action(ctx -> Mono.fromCallable(firstRuns::incrementAndGet)).noCompensation().add()
                .step("second").action(ctx -> Mono.fromCallable(() -> {
                    if (secondRuns.incrementAndGet() == 1) {
                        throw new IllegalStateException("not yet");
                    }
                    return "done";
                })).retries(0).noCompensation().add()
                .step("third").action(ctx -> Mono.fromCallable(thirdRuns::incrementAndGet)).noCompensation().add()
                .build());

        String sagaId = start("resumable", null);
        events.awaitFinished(sagaId);
        assertThat(status(sagaId).getStatus()).isEqualTo(SagaStatus.COMPENSATED);

        StepVerifier.create(orchestrator.retrySaga(sagaId)).expectNext(true).verifyComplete();
        events.awaitFinished(sagaId, 2, Duration.ofSeconds(10));

        SagaExecution execution = status(sagaId);
        assertThat(execution.getStatus()).isEqualTo(SagaStatus.COMPLETED);
        assertThat(execution.getCompletedSteps()).containsExactly("first", "second", "third");
        assertThat(execution.getError()).isNull();
        assertThat(firstRuns.get()).isEqualTo(1);
        assertThat(secondRuns.get()).isEqualTo(2);
        assertThat(thirdRuns.get()).isEqualTo(1);
    }

    @Test
    void retryIsRejectedForCompletedSaga() throws Exception {
        orchestrator.registerSaga(SagaBuilder.saga("done")
                .step("only").action(ctx -> Mono.just(1)).noCompensation().add()
                .build());
        String sagaId = start("done", null);
        events.awaitFinished(sagaId);

        StepVerifier.create(orchestrator.retrySaga(sagaId)).expectNext(false).verifyComplete();
    }

    @Test
    void storeFailureFailsTheSagaWithoutCompensation() throws Exception {
        AtomicInteger compensations = new AtomicInteger();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        orchestrator.registerSaga(SagaBuilder.saga("fragile")
                .step("a").action(ctx -> Mono.fromRunnable(() -> durableStore.failWrites.set(true)))
                .compensationCtx(ctx -> Mono.fromRunnable(compensations::incrementAndGet)).add()
                .step("b").action(ctx -> Mono.just("B")).noCompensation().add()
                .onFailed((ctx, error) -> Mono.fromRunnable(() -> failure.set(error)))
                .build());

        String sagaId = start("fragile", null);
        events.awaitFinished(sagaId);

        SagaExecution execution = status(sagaId);
        assertThat(execution.getStatus()).isEqualTo(SagaStatus.FAILED);
        assertThat(execution.getError().type()).isEqualTo("OrchestratorFaultException");
        assertThat(compensations.get()).isZero();
        assertThat(failure.get()).isInstanceOf(OrchestratorFaultException.class);
        assertThat(events.calls).contains("saga_failed:fragile").doesNotContain("compensation_started:1");
    }

    @Test
    void startFailsWhenTheInitialRecordCannotBeWritten() {
        orchestrator.registerSaga(SagaBuilder.saga("unwritable")
                .step("only").action(ctx -> Mono.just(1)).noCompensation().add()
                .build());
        durableStore.failWrites.set(true);

        StepVerifier.create(orchestrator.startSaga("unwritable", null))
                .expectError(OrchestratorFaultException.class)
                .verify();
        assertThat(orchestrator.getStatistics().totalSagas()).isZero();
        assertThat(events.callsStartingWith("saga_started:")).isEmpty();
    }

    @Test
    void statusIsReadFromTheStoreByAnotherOrchestrator() throws Exception {
        SagaDefinition definition = SagaBuilder.saga("durable")
                .step("only").action(ctx -> Mono.just("value")).noCompensation().add()
                .build();
        orchestrator.registerSaga(definition);
        String sagaId = start("durable", "payload");
        events.awaitFinished(sagaId);

        try (SagaOrchestrator other = new SagaOrchestrator(new SagaRegistry(List.of(definition)), store, null, testProperties())) {
            StepVerifier.create(other.getStatus(sagaId))
                    .assertNext(execution -> {
                        assertThat(execution.getStatus()).isEqualTo(SagaStatus.COMPLETED);
                        assertThat(execution.getContext().getInputAs(String.class)).isEqualTo("payload");
                        assertThat(execution.getContext().getResultAs("only", String.class)).isEqualTo("value");
                    })
                    .verifyComplete();
        }
    }

    @Test
    void statisticsSummariseKnownExecutions() throws Exception {
        orchestrator.registerSaga(SagaBuilder.saga("ok")
                .step("only").action(ctx -> Mono.just(1)).noCompensation().add()
                .build());
        orchestrator.registerSaga(SagaBuilder.saga("ko")
                .step("only").action(ctx -> Mono.error(new IllegalStateException("no"))).retries(0).noCompensation().add()
                .build());

        String ok = start("ok", null);
        String ko = start("ko", null);
        events.awaitFinished(ok);
        events.awaitFinished(ko);

        SagaStatistics stats = orchestrator.getStatistics();
        assertThat(stats.totalSagas()).isEqualTo(2);
        assertThat(stats.completedSagas()).isEqualTo(1);
        assertThat(stats.failedSagas()).isEqualTo(1);
        assertThat(stats.runningSagas()).isZero();
        assertThat(stats.registeredDefinitions()).isEqualTo(2);
        assertThat(stats.averageExecutionTimeMs()).isGreaterThanOrEqualTo(0.0d);
    }

    @Test
    void hookAndListenerErrorsDoNotChangeTheOutcome() throws Exception {
        SagaEvents throwing = new SagaEvents() {
            @Override
            public void onStepCompleted(String definitionId, String sagaId, String stepId, int stepIndex) {
                throw new IllegalStateException("listener bug");
            }
        };
        try (SagaOrchestrator guarded = new SagaOrchestrator(new SagaRegistry(), store,
                new CompositeSagaEvents(List.of(throwing, events)), testProperties())) {
            guarded.registerSaga(SagaBuilder.saga("hooks")
                    .step("only").action(ctx -> Mono.just(1)).noCompensation().add()
                    .onComplete(ctx -> Mono.error(new IllegalStateException("hook bug")))
                    .build());

            String sagaId = guarded.startSaga("hooks", null).block(Duration.ofSeconds(5));
            events.awaitFinished(sagaId);

            assertThat(guarded.getStatus(sagaId).block(Duration.ofSeconds(5)).getStatus()).isEqualTo(SagaStatus.COMPLETED);
            assertThat(events.calls).contains("step_completed:only", "saga_completed:hooks");
        }
    }

    @Test
    void cleanupEvictsOldTerminalExecutions() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        Scheduler scheduler = SagaOrchestrator.newWorkerScheduler(testProperties().getWorker());
        try (SagaOrchestrator clocked = new SagaOrchestrator(new SagaRegistry(), store, events, testProperties(), scheduler, clock)) {
            clocked.registerSaga(SagaBuilder.saga("old")
                    .step("only").action(ctx -> Mono.just(1)).noCompensation().add()
                    .build());
            String sagaId = clocked.startSaga("old", null).block(Duration.ofSeconds(5));
            events.awaitFinished(sagaId);
            awaitIdle(clocked, sagaId);

            StepVerifier.create(clocked.cleanup(Duration.ofHours(1))).expectNext(0L).verifyComplete();

            clock.advance(Duration.ofHours(2));
            StepVerifier.create(clocked.cleanup(Duration.ofHours(1))).expectNext(1L).verifyComplete();
            StepVerifier.create(clocked.getStatus(sagaId)).verifyComplete();
            StepVerifier.create(store.load(sagaId)).verifyComplete();
        } finally {
            scheduler.dispose();
        }
    }
}

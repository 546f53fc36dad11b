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

import org.fireflyframework.saga.core.SagaExecution;
import org.fireflyframework.saga.persistence.SagaExecutionStore;
import org.fireflyframework.saga.registry.SagaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resumes executions left in flight by a previous process.
 * <p>
 * Recovery process:
 * <ol>
 *   <li>Scan the durable store for execution records</li>
 *   <li>Keep those still running or compensating</li>
 *   <li>Skip those whose definition is not registered in this process</li>
 *   <li>Hand the rest to the orchestrator, which continues at the first incomplete step or
 *   resumes the reverse pass</li>
 * </ol>
 * Only one process should own a given saga; running recovery in several processes over the
 * same store would execute the same saga twice.
 */
public class SagaRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(SagaRecoveryService.class);

    private final SagaExecutionStore store;
    private final SagaOrchestrator orchestrator;
    private final SagaRegistry registry;

    public SagaRecoveryService(SagaExecutionStore store, SagaOrchestrator orchestrator) {
        this.store = store;
        this.orchestrator = orchestrator;
        this.registry = orchestrator.getRegistry();
    }

    public Mono<RecoveryResult> recoverInFlightSagas() {
        Instant startTime = Instant.now();
        AtomicInteger totalFound = new AtomicInteger(0);
        AtomicInteger recovered = new AtomicInteger(0);
        AtomicInteger failed = new AtomicInteger(0);
        AtomicInteger skipped = new AtomicInteger(0);

        log.info("Starting recovery of in-flight sagas");

        return store.findAll()
                .filter(execution -> execution.getStatus().isInFlight())
                .doOnNext(execution -> {
                    totalFound.incrementAndGet();
                    log.debug("Found in-flight saga for recovery: {} ({}, {})",
                            execution.getSagaId(), execution.getDefinitionId(), execution.getStatus());
                })
                .concatMap(this::recoverSingleSaga)
                .doOnNext(status -> {
                    switch (status) {
                        case RECOVERED -> recovered.incrementAndGet();
                        case FAILED -> failed.incrementAndGet();
                        default -> skipped.incrementAndGet();
                    }
                })
                .then(Mono.fromCallable(() -> {
                    RecoveryResult result = new RecoveryResult(totalFound.get(), recovered.get(),
                            failed.get(), skipped.get(), Duration.between(startTime, Instant.now()));
                    log.info("Saga recovery completed: {}", result);
                    return result;
                }));
    }

    /**
     * Recovers one saga by id.
     */
    public Mono<RecoveryStatus> recoverSaga(String sagaId) {
        return store.load(sagaId)
                .flatMap(this::recoverSingleSaga)
                .defaultIfEmpty(RecoveryStatus.NOT_FOUND);
    }

    private Mono<RecoveryStatus> recoverSingleSaga(SagaExecution execution) {
        if (!execution.getStatus().isInFlight()) {
            return Mono.just(RecoveryStatus.SKIPPED);
        }
        if (!registry.hasDefinition(execution.getDefinitionId())) {
            log.warn("Cannot recover saga {}: definition '{}' is not registered",
                    execution.getSagaId(), execution.getDefinitionId());
            return Mono.just(RecoveryStatus.SKIPPED);
        }
        return orchestrator.resume(execution)
                .map(resumed -> resumed ? RecoveryStatus.RECOVERED : RecoveryStatus.SKIPPED)
                .onErrorResume(e -> {
                    log.error("Failed to recover saga {}", execution.getSagaId(), e);
                    return Mono.just(RecoveryStatus.FAILED);
                });
    }

    public enum RecoveryStatus {
        RECOVERED,
        SKIPPED,
        FAILED,
        NOT_FOUND
    }

    public static class RecoveryResult {
        private final int totalFound;
        private final int successfullyRecovered;
        private final int failed;
        private final int skipped;
        private final Duration recoveryTime;

        public RecoveryResult(int totalFound, int successfullyRecovered,
                              int failed, int skipped, Duration recoveryTime) {
            this.totalFound = totalFound;
            this.successfullyRecovered = successfullyRecovered;
            this.failed = failed;
            this.skipped = skipped;
            this.recoveryTime = recoveryTime;
        }

        public int getTotalFound() { return totalFound; }
        public int getSuccessfullyRecovered() { return successfullyRecovered; }
        public int getFailed() { return failed; }
        public int getSkipped() { return skipped; }
        public Duration getRecoveryTime() { return recoveryTime; }

        @Override
        public String toString() {
            return String.format("RecoveryResult{total=%d, recovered=%d, failed=%d, skipped=%d, time=%s}",
                    totalFound, successfullyRecovered, failed, skipped, recoveryTime);
        }
    }
}

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

package org.fireflyframework.saga.persistence;

import org.fireflyframework.saga.core.OrchestratorFaultException;
import org.fireflyframework.saga.core.SagaExecution;
import org.fireflyframework.saga.persistence.serialization.SagaExecutionSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Maps execution records onto a {@link DurableStore}.
 * <p>
 * Key layout: {@code {keyPrefix}execution:{sagaId}}. Terminal records expire after the retention
 * window; in-flight records use {@code inFlightTtl}, which is unset by default so that a saga
 * interrupted by a crash stays recoverable.
 * <p>
 * Every store or serialization failure surfaces as an {@link OrchestratorFaultException}.
 */
public class SagaExecutionStore {

    private static final Logger log = LoggerFactory.getLogger(SagaExecutionStore.class);

    static final String EXECUTION_SEGMENT = "execution:";

    private final DurableStore store;
    private final SagaExecutionSerializer serializer;
    private final String executionKeyPrefix;
    private final Duration retention;
    private final Duration inFlightTtl;

    public SagaExecutionStore(DurableStore store,
                              SagaExecutionSerializer serializer,
                              String keyPrefix,
                              Duration retention,
                              Duration inFlightTtl) {
        this.store = store;
        this.serializer = serializer;
        this.executionKeyPrefix = (keyPrefix != null ? keyPrefix : "") + EXECUTION_SEGMENT;
        this.retention = retention;
        this.inFlightTtl = inFlightTtl;
    }

    public String keyFor(String sagaId) {
        return executionKeyPrefix + sagaId;
    }

    /**
     * Writes a snapshot of the execution. The snapshot is taken under the execution's monitor so
     * that it never observes a transition half applied.
     */
    public Mono<Void> save(SagaExecution execution) {
        return Mono.defer(() -> {
            byte[] bytes;
            Duration ttl;
            synchronized (execution) {
                try {
                    bytes = serializer.serialize(execution);
                } catch (SagaExecutionSerializer.SerializationException e) {
                    return Mono.error(new OrchestratorFaultException(
                            "Failed to serialize saga execution " + execution.getSagaId(), e));
                }
                ttl = execution.getStatus().isTerminal() ? retention : inFlightTtl;
            }
            String key = keyFor(execution.getSagaId());
            return store.put(key, bytes, ttl)
                    .onErrorMap(e -> !(e instanceof OrchestratorFaultException),
                            e -> new OrchestratorFaultException("Failed to persist saga execution " + execution.getSagaId(), e));
        });
    }

    /**
     * @return the stored execution, or an empty {@code Mono} when none is stored
     */
    public Mono<SagaExecution> load(String sagaId) {
        String key = keyFor(sagaId);
        return store.get(key)
                .onErrorMap(e -> new OrchestratorFaultException("Failed to read saga execution " + sagaId, e))
                .flatMap(bytes -> {
                    try {
                        return Mono.just(serializer.deserialize(bytes));
                    } catch (SagaExecutionSerializer.SerializationException e) {
                        return Mono.error(new OrchestratorFaultException("Corrupt record for saga execution " + sagaId, e));
                    }
                });
    }

    public Mono<Void> delete(String sagaId) {
        return store.delete(keyFor(sagaId))
                .onErrorMap(e -> new OrchestratorFaultException("Failed to delete saga execution " + sagaId, e));
    }

    /**
     * Streams every stored execution. Records that cannot be read are logged and skipped.
     */
    public Flux<SagaExecution> findAll() {
        return store.scanKeys(executionKeyPrefix)
                .map(key -> key.substring(executionKeyPrefix.length()))
                .concatMap(sagaId -> load(sagaId)
                        .onErrorResume(OrchestratorFaultException.class, e -> {
                            log.warn("Skipping unreadable saga execution {}: {}", sagaId, e.getMessage());
                            return Mono.empty();
                        }));
    }

    public Mono<Boolean> isHealthy() {
        return store.isHealthy();
    }

    public DurableStore getStore() {
        return store;
    }
}

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

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Key-value port through which the orchestrator persists execution records.
 * <p>
 * Implementations must provide read-after-write consistency for a single key.
 * No multi-key atomicity is required.
 */
public interface DurableStore {

    /**
     * Stores {@code value} under {@code key}, replacing any previous value and expiry.
     *
     * @param ttl time to live, or {@code null} to keep the value until it is deleted
     */
    Mono<Void> put(String key, byte[] value, Duration ttl);

    /**
     * @return the stored value, or an empty {@code Mono} when the key is absent or expired
     */
    Mono<byte[]> get(String key);

    Mono<Void> delete(String key);

    /**
     * Lists the live keys starting with {@code prefix}. Used by recovery and retention.
     */
    Flux<String> scanKeys(String prefix);

    Mono<Boolean> isHealthy();

    StoreType getStoreType();

    enum StoreType {
        IN_MEMORY,
        REDIS
    }
}

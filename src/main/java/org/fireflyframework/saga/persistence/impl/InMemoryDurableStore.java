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

package org.fireflyframework.saga.persistence.impl;

import org.fireflyframework.saga.persistence.DurableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local {@link DurableStore}.
 * <p>
 * Values do not survive a restart of the process; sharing one instance between orchestrators
 * in the same JVM is enough to exercise recovery. Expired entries are dropped lazily on access
 * and in bulk by {@link #purgeExpired()}.
 */
public class InMemoryDurableStore implements DurableStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDurableStore.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDurableStore() {
        this(Clock.systemUTC());
    }

    public InMemoryDurableStore(Clock clock) {
        this.clock = clock;
        log.info("Initialized in-memory durable store");
    }

    @Override
    public Mono<Void> put(String key, byte[] value, Duration ttl) {
        return Mono.fromRunnable(() -> {
            Instant expiresAt = ttl != null ? clock.instant().plus(ttl) : null;
            entries.put(key, new Entry(Arrays.copyOf(value, value.length), expiresAt));
            log.debug("Stored key {} ({} bytes, ttl={})", key, value.length, ttl);
        });
    }

    @Override
    public Mono<byte[]> get(String key) {
        return Mono.fromCallable(() -> {
            Entry entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired(clock.instant())) {
                entries.remove(key, entry);
                return null;
            }
            return Arrays.copyOf(entry.value, entry.value.length);
        });
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromRunnable(() -> entries.remove(key));
    }

    @Override
    public Flux<String> scanKeys(String prefix) {
        return Flux.defer(() -> {
            Instant now = clock.instant();
            List<String> keys = entries.entrySet().stream()
                    .filter(e -> e.getKey().startsWith(prefix))
                    .filter(e -> !e.getValue().isExpired(now))
                    .map(Map.Entry::getKey)
                    .sorted()
                    .collect(Collectors.toList());
            return Flux.fromIterable(keys);
        });
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    @Override
    public StoreType getStoreType() {
        return StoreType.IN_MEMORY;
    }

    /**
     * Removes every expired entry.
     *
     * @return the number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Purged {} expired entries", removed);
        }
        return Math.max(0, removed);
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry {
        private final byte[] value;
        private final Instant expiresAt;

        private Entry(byte[] value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}

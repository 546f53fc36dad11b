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

import org.fireflyframework.saga.engine.MutableClock;
import org.fireflyframework.saga.persistence.DurableStore;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryDurableStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final InMemoryDurableStore store = new InMemoryDurableStore(clock);

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void putGetAndDelete() {
        StepVerifier.create(store.put("k1", bytes("v1"), null)).verifyComplete();

        StepVerifier.create(store.get("k1"))
                .assertNext(value -> assertThat(new String(value, StandardCharsets.UTF_8)).isEqualTo("v1"))
                .verifyComplete();

        StepVerifier.create(store.delete("k1")).verifyComplete();
        StepVerifier.create(store.get("k1")).verifyComplete();
        StepVerifier.create(store.get("never-written")).verifyComplete();
    }

    @Test
    void storedValueIsIsolatedFromCallerBuffer() {
        byte[] value = bytes("abc");
        store.put("k", value, null).block();
        value[0] = 'z';

        StepVerifier.create(store.get("k"))
                .assertNext(stored -> assertThat(new String(stored, StandardCharsets.UTF_8)).isEqualTo("abc"))
                .verifyComplete();
    }

    @Test
    void entriesExpireAfterTheirTtl() {
        store.put("short", bytes("1"), Duration.ofMinutes(5)).block();
        store.put("forever", bytes("2"), null).block();

        clock.advance(Duration.ofMinutes(4));
        StepVerifier.create(store.get("short")).expectNextCount(1).verifyComplete();

        clock.advance(Duration.ofMinutes(2));
        StepVerifier.create(store.get("short")).verifyComplete();
        StepVerifier.create(store.get("forever")).expectNextCount(1).verifyComplete();
    }

    @Test
    void overwriteReplacesValueAndExpiry() {
        store.put("k", bytes("old"), Duration.ofSeconds(1)).block();
        store.put("k", bytes("new"), null).block();

        clock.advance(Duration.ofHours(1));

        StepVerifier.create(store.get("k"))
                .assertNext(v -> assertThat(new String(v, StandardCharsets.UTF_8)).isEqualTo("new"))
                .verifyComplete();
    }

    @Test
    void scanListsLiveKeysUnderPrefix() {
        store.put("saga:execution:b", bytes("b"), null).block();
        store.put("saga:execution:a", bytes("a"), null).block();
        store.put("saga:execution:gone", bytes("x"), Duration.ofSeconds(1)).block();
        store.put("other:key", bytes("o"), null).block();
        clock.advance(Duration.ofSeconds(2));

        StepVerifier.create(store.scanKeys("saga:execution:"))
                .expectNext("saga:execution:a", "saga:execution:b")
                .verifyComplete();
    }

    @Test
    void purgeRemovesExpiredEntries() {
        store.put("a", bytes("a"), Duration.ofSeconds(1)).block();
        store.put("b", bytes("b"), null).block();
        clock.advance(Duration.ofSeconds(5));

        assertThat(store.purgeExpired()).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void reportsTypeAndHealth() {
        assertThat(store.getStoreType()).isEqualTo(DurableStore.StoreType.IN_MEMORY);
        StepVerifier.create(store.isHealthy()).expectNext(true).verifyComplete();
    }
}

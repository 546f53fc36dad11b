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
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Redis-backed {@link DurableStore}.
 * <p>
 * Values are written with a single {@code SET} (with {@code EX} when a TTL is given), so a record
 * and its expiry change atomically. Key listing uses {@code SCAN} and never blocks the server.
 */
public class RedisDurableStore implements DurableStore {

    private static final Logger log = LoggerFactory.getLogger(RedisDurableStore.class);

    private final ReactiveRedisTemplate<String, byte[]> redisTemplate;
    private final String healthCheckKey;

    public RedisDurableStore(ReactiveRedisTemplate<String, byte[]> redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.healthCheckKey = keyPrefix + "health:check";
        log.info("Initialized Redis durable store with key prefix: {}", keyPrefix);
    }

    @Override
    public Mono<Void> put(String key, byte[] value, Duration ttl) {
        Mono<Boolean> op = ttl != null
                ? redisTemplate.opsForValue().set(key, value, ttl)
                : redisTemplate.opsForValue().set(key, value);
        return op
                .flatMap(ok -> Boolean.TRUE.equals(ok)
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(new IllegalStateException("Redis SET was not acknowledged for key " + key)))
                .doOnSuccess(v -> log.debug("Stored key {} ({} bytes, ttl={})", key, value.length, ttl))
                .doOnError(error -> log.error("Failed to store key {} in Redis", key, error));
    }

    @Override
    public Mono<byte[]> get(String key) {
        return redisTemplate.opsForValue().get(key)
                .doOnError(error -> log.error("Failed to read key {} from Redis", key, error));
    }

    @Override
    public Mono<Void> delete(String key) {
        return redisTemplate.delete(key)
                .doOnNext(count -> log.debug("Deleted key {} ({} removed)", key, count))
                .then();
    }

    @Override
    public Flux<String> scanKeys(String prefix) {
        return redisTemplate.scan(ScanOptions.scanOptions().match(prefix + "*").count(500).build())
                .doOnSubscribe(subscription -> log.debug("Scanning Redis keys with prefix {}", prefix));
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return redisTemplate.opsForValue()
                .set(healthCheckKey, "ok".getBytes(StandardCharsets.UTF_8), Duration.ofSeconds(10))
                .flatMap(ok -> redisTemplate.opsForValue().get(healthCheckKey))
                .map(bytes -> "ok".equals(new String(bytes, StandardCharsets.UTF_8)))
                .defaultIfEmpty(false)
                .onErrorResume(error -> {
                    log.warn("Redis health check failed", error);
                    return Mono.just(false);
                });
    }

    @Override
    public StoreType getStoreType() {
        return StoreType.REDIS;
    }
}

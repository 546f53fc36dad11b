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

package org.fireflyframework.saga.engine.step;

import org.fireflyframework.saga.core.SagaContext;
import org.fireflyframework.saga.observability.SagaEvents;
import org.fireflyframework.saga.registry.SagaStep;
import org.fireflyframework.saga.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Runs the action of a single step with timeout and bounded exponential retry.
 * <p>
 * A step gets {@code retries + 1} attempts at most, where {@code retries} is zero for critical
 * steps and otherwise the step's own value or the default. Between attempts the executor waits
 * {@code initialBackoff * 2^(attempt-1)}. A timed-out attempt is abandoned, not cancelled: the
 * action's side effect may still happen, so actions must be safe to repeat.
 */
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final Duration defaultTimeout;
    private final int defaultRetries;
    private final Duration initialBackoff;
    private final boolean jitter;
    private final double jitterFactor;
    private final Scheduler scheduler;
    private final SagaEvents events;

    public StepExecutor(Duration defaultTimeout,
                        int defaultRetries,
                        Duration initialBackoff,
                        boolean jitter,
                        double jitterFactor,
                        Scheduler scheduler,
                        SagaEvents events) {
        this.defaultTimeout = defaultTimeout;
        this.defaultRetries = defaultRetries;
        this.initialBackoff = initialBackoff;
        this.jitter = jitter;
        this.jitterFactor = jitterFactor;
        this.scheduler = scheduler;
        this.events = events;
    }

    /**
     * Executes the step and stores its non-null result in the context.
     *
     * @return an empty Mono on success, or a {@link SagaStepException} once the attempts run out
     */
    public Mono<Void> execute(String definitionId, SagaContext ctx, SagaStep step) {
        return attempt(definitionId, ctx, step, 1, retriesFor(step), timeoutFor(step));
    }

    private Mono<Void> attempt(String definitionId, SagaContext ctx, SagaStep step,
                               int attempt, int retries, Duration timeout) {
        return Mono.defer(() -> {
            long started = System.currentTimeMillis();
            return invoke(step, ctx)
                    .subscribeOn(scheduler)
                    .timeout(timeout, Mono.defer(() -> Mono.error(new StepTimeoutException(step.getId(), timeout, attempt))))
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .doOnNext(result -> {
                        result.ifPresent(value -> ctx.putResult(step.getId(), value));
                        long latencyMs = System.currentTimeMillis() - started;
                        notify(() -> events.onStepExecuted(definitionId, ctx.getSagaId(), step.getId(), attempt, latencyMs));
                    })
                    .then()
                    .onErrorResume(err -> {
                        if (attempt <= retries) {
                            long delay = computeDelay(backoffFor(attempt), jitter, jitterFactor);
                            log.warn(JsonUtils.json(
                                    "event", "step_attempt_failed",
                                    "saga_id", ctx.getSagaId(),
                                    "step_id", step.getId(),
                                    "attempt", attempt,
                                    "next_delay_ms", delay,
                                    "error_class", err.getClass().getSimpleName(),
                                    "error_message", err.getMessage()));
                            notify(() -> events.onStepRetry(definitionId, ctx.getSagaId(), step.getId(), attempt, err));
                            return Mono.delay(Duration.ofMillis(delay), scheduler)
                                    .then(attempt(definitionId, ctx, step, attempt + 1, retries, timeout));
                        }
                        return Mono.error(toStepException(step, attempt, err));
                    });
        });
    }

    private Mono<?> invoke(SagaStep step, SagaContext ctx) {
        try {
            Mono<?> result = step.getAction().execute(ctx);
            return result != null ? result : Mono.empty();
        } catch (Throwable t) {
            return Mono.error(t);
        }
    }

    private static SagaStepException toStepException(SagaStep step, int attempts, Throwable err) {
        if (err instanceof StepTimeoutException timeout) {
            return timeout;
        }
        return new StepExecutionException(step.getId(), attempts, err);
    }

    public int retriesFor(SagaStep step) {
        if (step.isCritical()) {
            return 0;
        }
        return step.getRetries() != null ? Math.max(0, step.getRetries()) : defaultRetries;
    }

    public Duration timeoutFor(SagaStep step) {
        return step.getTimeout() != null ? step.getTimeout() : defaultTimeout;
    }

    /**
     * Base delay before the retry that follows {@code attempt} (1-based).
     */
    public long backoffFor(int attempt) {
        long base = initialBackoff.toMillis();
        int shift = Math.min(Math.max(0, attempt - 1), 30);
        long delay = base << shift;
        return delay < 0 ? Long.MAX_VALUE : delay;
    }

    public static long computeDelay(long backoffMs, boolean jitter, double jitterFactor) {
        if (backoffMs <= 0) return 0L;
        if (!jitter) return backoffMs;
        double f = Math.max(0.0d, Math.min(jitterFactor, 1.0d));
        double min = backoffMs * (1.0d - f);
        double max = backoffMs * (1.0d + f);
        if (max <= min) return backoffMs;
        long v = Math.round(ThreadLocalRandom.current().nextDouble(min, max));
        return Math.max(0L, v);
    }

    private static void notify(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Saga event callback failed", e);
        }
    }
}

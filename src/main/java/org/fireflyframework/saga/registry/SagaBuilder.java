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

package org.fireflyframework.saga.registry;

import org.fireflyframework.saga.core.SagaContext;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Fluent builder for {@link SagaDefinition}.
 * <pre>{@code
 * SagaDefinition def = SagaBuilder.saga("order-fulfilment")
 *     .name("Order fulfilment")
 *     .step("reserve").name("Reserve stock")
 *         .action(ctx -> inventory.reserve(ctx.getInput()))
 *         .compensation((ctx, reservation) -> inventory.release(reservation))
 *         .timeoutMs(5_000).retries(2)
 *         .add()
 *     .step("charge").name("Charge card")
 *         .action(ctx -> payments.charge(ctx.getInput()))
 *         .compensation((ctx, charge) -> payments.refund(charge))
 *         .critical(true)
 *         .add()
 *     .build();
 * }</pre>
 * The builder does not validate; {@link SagaRegistry#register(SagaDefinition)} does.
 */
public class SagaBuilder {

    private final String id;
    private String name;
    private final List<SagaStep> steps = new ArrayList<>();
    private SagaCompletionHook onComplete;
    private SagaFailureHook onFailed;

    private SagaBuilder(String id) {
        this.id = id;
        this.name = id;
    }

    public static SagaBuilder saga(String id) {
        return new SagaBuilder(id);
    }

    /** Alias for saga(id) for readability in DSL samples. */
    public static SagaBuilder named(String id) { return saga(id); }

    public SagaBuilder name(String name) {
        this.name = name;
        return this;
    }

    public Step step(String stepId) {
        return new Step(stepId);
    }

    public SagaBuilder onComplete(SagaCompletionHook hook) {
        this.onComplete = hook;
        return this;
    }

    public SagaBuilder onFailed(SagaFailureHook hook) {
        this.onFailed = hook;
        return this;
    }

    public SagaDefinition build() {
        return new SagaDefinition(id, name, steps, onComplete, onFailed);
    }

    public class Step {
        private final String id;
        private String name;
        private StepAction action;
        private StepCompensation compensation;
        private Duration timeout;
        private Integer retries;
        private boolean critical;

        private Step(String id) {
            this.id = id;
            this.name = id;
        }

        public Step name(String name) { this.name = name; return this; }

        public Step action(StepAction action) { this.action = action; return this; }

        /** Action that ignores the context. */
        public <O> Step action(Supplier<Mono<O>> fn) {
            if (fn == null) throw new IllegalArgumentException("action");
            this.action = ctx -> fn.get();
            return this;
        }

        public Step compensation(StepCompensation compensation) { this.compensation = compensation; return this; }

        public Step compensationCtx(Function<SagaContext, Mono<Void>> fn) {
            if (fn == null) throw new IllegalArgumentException("compensation");
            this.compensation = (ctx, result) -> fn.apply(ctx);
            return this;
        }

        public Step noCompensation() { this.compensation = StepCompensation.none(); return this; }

        public Step timeout(Duration timeout) { this.timeout = timeout; return this; }
        /** Convenience overload: set timeout in milliseconds. */
        public Step timeoutMs(long ms) { this.timeout = (ms > 0 ? Duration.ofMillis(ms) : null); return this; }
        public Step retries(int retries) { this.retries = retries; return this; }
        public Step critical(boolean critical) { this.critical = critical; return this; }
        public Step critical() { return critical(true); }

        public SagaBuilder add() {
            steps.add(new SagaStep(id, name, action, compensation, timeout, retries, critical));
            return SagaBuilder.this;
        }
    }
}

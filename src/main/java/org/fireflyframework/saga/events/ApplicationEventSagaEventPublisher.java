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

package org.fireflyframework.saga.events;

import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Mono;

/**
 * Publishes lifecycle envelopes as Spring application events, so that any
 * {@code @EventListener(SagaEventEnvelope.class)} in the context receives them.
 */
public class ApplicationEventSagaEventPublisher implements SagaEventPublisher {

    private final ApplicationEventPublisher delegate;

    public ApplicationEventSagaEventPublisher(ApplicationEventPublisher delegate) {
        this.delegate = delegate;
    }

    @Override
    public Mono<Void> publish(SagaEventEnvelope event) {
        return Mono.fromRunnable(() -> delegate.publishEvent(event));
    }
}

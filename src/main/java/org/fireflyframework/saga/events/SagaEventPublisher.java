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

import reactor.core.publisher.Mono;

/**
 * Port interface for publishing saga lifecycle events.
 * <p>
 * Services implement this interface to route events through their chosen messaging
 * infrastructure (Kafka, SQS, RabbitMQ, etc.). The library publishes through Spring's
 * {@code ApplicationEventPublisher} when no custom publisher is configured.
 */
public interface SagaEventPublisher {

    /**
     * @return a Mono that completes when the event is handed over
     */
    Mono<Void> publish(SagaEventEnvelope event);
}

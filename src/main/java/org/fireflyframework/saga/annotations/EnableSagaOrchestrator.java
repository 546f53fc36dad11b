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

package org.fireflyframework.saga.annotations;

import org.fireflyframework.saga.config.SagaOrchestratorConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables the Saga Orchestrator components in a Spring application.
 * <p>
 * This annotation imports {@link SagaOrchestratorConfiguration} directly so it works
 * in both Spring Boot (auto-configuration) and plain Spring contexts
 * (e.g. {@code AnnotationConfigApplicationContext}).
 * <p>
 * The Redis durable store is registered via
 * {@code META-INF/spring/org.springframework.boot.autoconfigure.AutoConfiguration.imports}
 * and activated in Spring Boot applications with
 * {@code firefly.saga.orchestrator.persistence.provider=redis}.
 * <p>
 * Components wired by this annotation:
 * - {@code SagaRegistry}: registers every {@code SagaDefinition} bean
 * - {@code SagaOrchestrator}: runs sagas on a bounded worker scheduler
 * - {@code SagaExecutionStore}: in-memory durable store unless another store is configured
 * - {@code SagaEventPublisher}: Spring application events (override by declaring your own bean)
 * - {@code SagaLoggerEvents}: structured lifecycle logging
 * - {@code SagaRecoveryService} and {@code SagaCleanupScheduler}
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@Import(SagaOrchestratorConfiguration.class)
public @interface EnableSagaOrchestrator {
}

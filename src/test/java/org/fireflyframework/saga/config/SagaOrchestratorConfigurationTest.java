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

package org.fireflyframework.saga.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.saga.annotations.EnableSagaOrchestrator;
import org.fireflyframework.saga.core.SagaExecution;
import org.fireflyframework.saga.core.SagaStatus;
import org.fireflyframework.saga.engine.SagaCleanupScheduler;
import org.fireflyframework.saga.engine.SagaOrchestrator;
import org.fireflyframework.saga.engine.SagaRecoveryService;
import org.fireflyframework.saga.events.SagaEventEnvelope;
import org.fireflyframework.saga.events.SagaEventPublisher;
import org.fireflyframework.saga.events.SagaEventType;
import org.fireflyframework.saga.observability.SagaLoggerEvents;
import org.fireflyframework.saga.observability.SagaMicrometerEvents;
import org.fireflyframework.saga.observability.SagaOrchestratorHealthIndicator;
import org.fireflyframework.saga.persistence.DurableStore;
import org.fireflyframework.saga.persistence.impl.InMemoryDurableStore;
import org.fireflyframework.saga.persistence.impl.RedisDurableStore;
import org.fireflyframework.saga.registry.SagaBuilder;
import org.fireflyframework.saga.registry.SagaDefinition;
import org.fireflyframework.saga.registry.SagaRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class SagaOrchestratorConfigurationTest {

    private final ApplicationContextRunner contextRunner = runner();

    /**
     * Application beans the orchestrator configuration backs off from are registered ahead of it.
     */
    private static ApplicationContextRunner runner(Class<?>... applicationBeans) {
        return new ApplicationContextRunner()
                .withUserConfiguration(applicationBeans)
                .withUserConfiguration(SagaApp.class)
                .withPropertyValues("firefly.saga.orchestrator.retry.initial-backoff=10ms");
    }

    @Configuration
    @EnableSagaOrchestrator
    static class SagaApp {

        @Bean
        SagaDefinition greetingSaga() {
            return SagaBuilder.saga("greeting")
                    .step("hello").action(ctx -> Mono.just("hello " + ctx.getInput())).noCompensation().add()
                    .build();
        }

        @Bean
        EnvelopeCollector envelopeCollector() {
            return new EnvelopeCollector();
        }
    }

    static class EnvelopeCollector {
        final List<SagaEventEnvelope> received = new CopyOnWriteArrayList<>();
        final CountDownLatch completed = new CountDownLatch(1);

        @EventListener
        public void on(SagaEventEnvelope envelope) {
            received.add(envelope);
            if (envelope.getType() == SagaEventType.SAGA_COMPLETED) {
                completed.countDown();
            }
        }
    }

    @Configuration
    static class MetricsConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomPublisherConfig {
        @Bean
        SagaEventPublisher customPublisher() {
            return event -> Mono.empty();
        }
    }

    @Configuration
    static class RedisClientConfig {
        @Bean
        RedisConnectionFactory redisConnectionFactory() {
            return mock(RedisConnectionFactory.class);
        }

        @Bean
        @SuppressWarnings("unchecked")
        ReactiveRedisTemplate<String, byte[]> sagaReactiveRedisTemplate() {
            return mock(ReactiveRedisTemplate.class);
        }
    }

    @Test
    void wiresDefaultComponents() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(SagaOrchestrator.class);
            assertThat(context).hasSingleBean(SagaRecoveryService.class);
            assertThat(context).hasSingleBean(SagaLoggerEvents.class);
            assertThat(context).hasSingleBean(SagaCleanupScheduler.class);
            assertThat(context).hasSingleBean(SagaOrchestratorHealthIndicator.class);
            assertThat(context).doesNotHaveBean(SagaMicrometerEvents.class);
            assertThat(context).doesNotHaveBean(SagaRecoveryStartupListener.class);
            assertThat(context.getBean(DurableStore.class)).isInstanceOf(InMemoryDurableStore.class);
            assertThat(context.getBean(SagaRegistry.class).hasDefinition("greeting")).isTrue();
        });
    }

    @Test
    void runsDefinitionBeansAndPublishesApplicationEvents() {
        contextRunner.run(context -> {
            SagaOrchestrator orchestrator = context.getBean(SagaOrchestrator.class);
            EnvelopeCollector collector = context.getBean(EnvelopeCollector.class);

            String sagaId = orchestrator.startSaga("greeting", "world").block(Duration.ofSeconds(5));

            assertThat(collector.completed.await(5, TimeUnit.SECONDS)).isTrue();
            SagaExecution execution = orchestrator.getStatus(sagaId).block(Duration.ofSeconds(5));
            assertThat(execution.getStatus()).isEqualTo(SagaStatus.COMPLETED);
            assertThat(execution.getContext().getResult("hello")).isEqualTo("hello world");
            assertThat(collector.received).extracting(SagaEventEnvelope::getType)
                    .contains(SagaEventType.SAGA_STARTED, SagaEventType.STEP_COMPLETED, SagaEventType.SAGA_COMPLETED);
        });
    }

    @Test
    void registersMicrometerSinkWhenRegistryPresent() {
        runner(MetricsConfig.class).run(context ->
                assertThat(context).hasSingleBean(SagaMicrometerEvents.class));
    }

    @Test
    void observabilitySinksCanBeSwitchedOff() {
        runner(MetricsConfig.class)
                .withPropertyValues(
                        "firefly.saga.orchestrator.observability.logging-enabled=false",
                        "firefly.saga.orchestrator.observability.metrics-enabled=false",
                        "firefly.saga.orchestrator.persistence.cleanup-enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(SagaLoggerEvents.class);
                    assertThat(context).doesNotHaveBean(SagaMicrometerEvents.class);
                    assertThat(context).doesNotHaveBean(SagaCleanupScheduler.class);
                });
    }

    @Test
    void recoveryListenerIsOptIn() {
        contextRunner.withPropertyValues("firefly.saga.orchestrator.recovery.enabled=true").run(context ->
                assertThat(context).hasSingleBean(SagaRecoveryStartupListener.class));
    }

    @Test
    void applicationPublisherReplacesTheDefault() {
        runner(CustomPublisherConfig.class).run(context -> {
            assertThat(context).hasSingleBean(SagaEventPublisher.class);
            assertThat(context).hasBean("customPublisher");
        });
    }

    @Test
    void redisProviderSwapsTheDurableStore() {
        runner(RedisClientConfig.class)
                .withConfiguration(AutoConfigurations.of(SagaRedisAutoConfiguration.class))
                .withPropertyValues("firefly.saga.orchestrator.persistence.provider=redis")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(DurableStore.class)).isInstanceOf(RedisDurableStore.class);
                });
    }

    @Test
    void redisAutoConfigurationStaysOffForInMemoryProvider() {
        contextRunner.withConfiguration(AutoConfigurations.of(SagaRedisAutoConfiguration.class)).run(context -> {
            assertThat(context).doesNotHaveBean(RedisDurableStore.class);
            assertThat(context.getBean(DurableStore.class)).isInstanceOf(InMemoryDurableStore.class);
        });
    }
}

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
import org.fireflyframework.saga.engine.SagaCleanupScheduler;
import org.fireflyframework.saga.engine.SagaOrchestrator;
import org.fireflyframework.saga.engine.SagaRecoveryService;
import org.fireflyframework.saga.events.ApplicationEventSagaEventPublisher;
import org.fireflyframework.saga.events.PublishingSagaEvents;
import org.fireflyframework.saga.events.SagaEventPublisher;
import org.fireflyframework.saga.observability.CompositeSagaEvents;
import org.fireflyframework.saga.observability.SagaEvents;
import org.fireflyframework.saga.observability.SagaLoggerEvents;
import org.fireflyframework.saga.observability.SagaMicrometerEvents;
import org.fireflyframework.saga.observability.SagaOrchestratorHealthIndicator;
import org.fireflyframework.saga.persistence.DurableStore;
import org.fireflyframework.saga.persistence.SagaExecutionStore;
import org.fireflyframework.saga.persistence.impl.InMemoryDurableStore;
import org.fireflyframework.saga.persistence.serialization.JsonSagaExecutionSerializer;
import org.fireflyframework.saga.persistence.serialization.SagaExecutionSerializer;
import org.fireflyframework.saga.registry.SagaDefinition;
import org.fireflyframework.saga.registry.SagaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Spring configuration for the Saga Orchestrator, imported by
 * {@link org.fireflyframework.saga.annotations.EnableSagaOrchestrator}.
 * <p>
 * Every {@link SagaEvents} bean in the context receives lifecycle callbacks, in bean order,
 * followed by the bridge to the {@link SagaEventPublisher}.
 */
@Configuration
@EnableConfigurationProperties(SagaOrchestratorProperties.class)
public class SagaOrchestratorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SagaOrchestratorConfiguration.class);

    static final String PREFIX = "firefly.saga.orchestrator";

    @Bean
    @ConditionalOnMissingBean
    public SagaRegistry sagaRegistry(ObjectProvider<SagaDefinition> definitions) {
        List<SagaDefinition> declared = definitions.orderedStream().collect(Collectors.toList());
        if (!declared.isEmpty()) {
            log.info("Registering {} saga definition bean(s)", declared.size());
        }
        return new SagaRegistry(declared);
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaExecutionSerializer sagaExecutionSerializer() {
        return new JsonSagaExecutionSerializer();
    }

    @Bean
    @ConditionalOnMissingBean(DurableStore.class)
    @ConditionalOnProperty(prefix = PREFIX + ".persistence", name = "provider", havingValue = "in-memory", matchIfMissing = true)
    public DurableStore inMemoryDurableStore() {
        return new InMemoryDurableStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaExecutionStore sagaExecutionStore(DurableStore durableStore,
                                                 SagaExecutionSerializer serializer,
                                                 SagaOrchestratorProperties properties) {
        SagaOrchestratorProperties.PersistenceProperties persistence = properties.getPersistence();
        log.info("Saga executions stored in {} store with key prefix '{}' (retention {})",
                durableStore.getStoreType(), persistence.getKeyPrefix(), persistence.getRetention());
        return new SagaExecutionStore(durableStore, serializer, persistence.getKeyPrefix(),
                persistence.getRetention(), persistence.getInFlightTtl());
    }

    @Bean(destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = "sagaWorkerScheduler")
    public Scheduler sagaWorkerScheduler(SagaOrchestratorProperties properties) {
        return SagaOrchestrator.newWorkerScheduler(properties.getWorker());
    }

    @Bean
    @ConditionalOnMissingBean(SagaEventPublisher.class)
    public SagaEventPublisher sagaEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new ApplicationEventSagaEventPublisher(applicationEventPublisher);
    }

    @Bean
    @ConditionalOnProperty(prefix = PREFIX + ".observability", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public SagaLoggerEvents sagaLoggerEvents() {
        return new SagaLoggerEvents();
    }

    @Bean
    public SagaOrchestrator sagaOrchestrator(SagaRegistry registry,
                                             SagaExecutionStore store,
                                             ObjectProvider<SagaEvents> sinks,
                                             SagaEventPublisher publisher,
                                             SagaOrchestratorProperties properties,
                                             Scheduler sagaWorkerScheduler) {
        List<SagaEvents> delegates = new ArrayList<>(sinks.orderedStream().collect(Collectors.toList()));
        delegates.add(new PublishingSagaEvents(publisher));
        return new SagaOrchestrator(registry, store, new CompositeSagaEvents(delegates), properties,
                sagaWorkerScheduler, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaRecoveryService sagaRecoveryService(SagaExecutionStore store, SagaOrchestrator orchestrator) {
        return new SagaRecoveryService(store, orchestrator);
    }

    @Bean
    @ConditionalOnProperty(prefix = PREFIX + ".recovery", name = "enabled", havingValue = "true")
    public SagaRecoveryStartupListener sagaRecoveryStartupListener(SagaRecoveryService recoveryService) {
        return new SagaRecoveryStartupListener(recoveryService);
    }

    @Bean
    @ConditionalOnProperty(prefix = PREFIX + ".persistence", name = "cleanup-enabled", havingValue = "true", matchIfMissing = true)
    public SagaCleanupScheduler sagaCleanupScheduler(SagaOrchestrator orchestrator, SagaOrchestratorProperties properties) {
        SagaOrchestratorProperties.PersistenceProperties persistence = properties.getPersistence();
        return new SagaCleanupScheduler(orchestrator, persistence.getRetention(), persistence.getCleanupInterval());
    }

    @Configuration
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    static class MicrometerConfiguration {
        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnProperty(prefix = PREFIX + ".observability", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
        public SagaMicrometerEvents sagaMicrometerEvents(MeterRegistry registry) {
            return new SagaMicrometerEvents(registry);
        }
    }

    @Configuration
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.AbstractHealthIndicator")
    static class HealthConfiguration {
        @Bean
        @ConditionalOnMissingBean
        public SagaOrchestratorHealthIndicator sagaOrchestratorHealthIndicator(SagaOrchestrator orchestrator) {
            return new SagaOrchestratorHealthIndicator(orchestrator);
        }
    }
}

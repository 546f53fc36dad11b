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

package org.fireflyframework.saga.observability;

import org.fireflyframework.saga.core.SagaStatistics;
import org.fireflyframework.saga.engine.SagaOrchestrator;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;

import java.time.Duration;
import java.util.Locale;

/**
 * Spring Boot Actuator health indicator for the saga orchestrator.
 * <p>
 * DOWN when the durable store does not answer; the details carry the orchestrator statistics.
 */
public class SagaOrchestratorHealthIndicator extends AbstractHealthIndicator {

    private static final Duration STORE_CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final SagaOrchestrator orchestrator;

    public SagaOrchestratorHealthIndicator(SagaOrchestrator orchestrator) {
        super("Saga orchestrator health check failed");
        this.orchestrator = orchestrator;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        Boolean storeHealthy = orchestrator.getStore().isHealthy()
                .timeout(STORE_CHECK_TIMEOUT)
                .onErrorReturn(false)
                .block(STORE_CHECK_TIMEOUT.plusSeconds(1));
        if (Boolean.TRUE.equals(storeHealthy)) {
            builder.up();
        } else {
            builder.down();
        }

        SagaStatistics stats = orchestrator.getStatistics();
        builder.withDetail("store", orchestrator.getStore().getStore().getStoreType().name().toLowerCase(Locale.ROOT))
               .withDetail("store.healthy", Boolean.TRUE.equals(storeHealthy))
               .withDetail("registered.definitions", stats.registeredDefinitions())
               .withDetail("total.sagas", stats.totalSagas())
               .withDetail("running.sagas", stats.runningSagas())
               .withDetail("completed.sagas", stats.completedSagas())
               .withDetail("failed.sagas", stats.failedSagas())
               .withDetail("average.execution.time", String.format(Locale.ROOT, "%.2fms", stats.averageExecutionTimeMs()));
    }
}

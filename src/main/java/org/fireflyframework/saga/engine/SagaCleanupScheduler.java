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

package org.fireflyframework.saga.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Periodically evicts terminal executions older than the retention window.
 */
public class SagaCleanupScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SagaCleanupScheduler.class);

    private final SagaOrchestrator orchestrator;
    private final Duration retention;
    private final Duration interval;
    private volatile Disposable task;

    public SagaCleanupScheduler(SagaOrchestrator orchestrator, Duration retention, Duration interval) {
        this.orchestrator = orchestrator;
        this.retention = retention;
        this.interval = interval;
    }

    @Override
    public synchronized void start() {
        if (task != null) {
            return;
        }
        log.info("Scheduling saga cleanup every {} (retention {})", interval, retention);
        task = Flux.interval(interval, interval)
                .concatMap(tick -> orchestrator.cleanup(retention)
                        .onErrorResume(e -> {
                            log.warn("Saga cleanup run failed", e);
                            return Mono.just(0L);
                        }))
                .subscribe(count -> log.debug("Saga cleanup evicted {} execution(s)", count));
    }

    @Override
    public synchronized void stop() {
        if (task != null) {
            task.dispose();
            task = null;
        }
    }

    @Override
    public boolean isRunning() {
        return task != null && !task.isDisposed();
    }
}

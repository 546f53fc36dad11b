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

import org.fireflyframework.saga.engine.SagaRecoveryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * Resumes in-flight sagas once the application is ready to serve.
 */
public class SagaRecoveryStartupListener {

    private static final Logger log = LoggerFactory.getLogger(SagaRecoveryStartupListener.class);

    private final SagaRecoveryService recoveryService;

    public SagaRecoveryStartupListener(SagaRecoveryService recoveryService) {
        this.recoveryService = recoveryService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        recoveryService.recoverInFlightSagas()
                .subscribe(
                        result -> log.info("Startup saga recovery finished: {}", result),
                        error -> log.error("Startup saga recovery failed", error));
    }
}

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default logger-based implementation of SagaEvents.
 * <p>
 * Logs every lifecycle event as a single-line JSON object so that log aggregation
 * systems can parse it.
 * <ul>
 *   <li>INFO - normal lifecycle events</li>
 *   <li>WARN - retries and compensations that start</li>
 *   <li>ERROR - step, compensation and orchestrator failures</li>
 * </ul>
 */
public class SagaLoggerEvents implements SagaEvents {

    private static final Logger log = LoggerFactory.getLogger(SagaLoggerEvents.class);

    @Override
    public void onSagaRegistered(String definitionId, int stepCount) {
        log.info("{{\"saga_event\":\"saga_registered\",\"saga_name\":\"{}\",\"steps\":\"{}\"}}",
                definitionId, stepCount);
    }

    @Override
    public void onSagaStarted(String definitionId, String sagaId) {
        log.info("{{\"saga_event\":\"saga_started\",\"saga_name\":\"{}\",\"saga_id\":\"{}\"}}",
                definitionId, sagaId);
    }

    @Override
    public void onStepExecuted(String definitionId, String sagaId, String stepId, int attempts, long latencyMs) {
        log.info("{{\"saga_event\":\"step_executed\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\",\"attempts\":\"{}\",\"latency_ms\":\"{}\"}}",
                definitionId, sagaId, stepId, attempts, latencyMs);
    }

    @Override
    public void onStepCompleted(String definitionId, String sagaId, String stepId, int stepIndex) {
        log.info("{{\"saga_event\":\"step_completed\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\",\"step_index\":\"{}\"}}",
                definitionId, sagaId, stepId, stepIndex);
    }

    @Override
    public void onStepFailed(String definitionId, String sagaId, String stepId, Throwable error) {
        log.error("{{\"saga_event\":\"step_failed\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\",\"error_class\":\"{}\",\"error_message\":\"{}\"}}",
                definitionId, sagaId, stepId, errorClass(error), errorMessage(error));
    }

    @Override
    public void onStepRetry(String definitionId, String sagaId, String stepId, int attempt, Throwable error) {
        log.warn("{{\"saga_event\":\"step_retry\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\",\"attempt\":\"{}\",\"error_class\":\"{}\",\"error_message\":\"{}\"}}",
                definitionId, sagaId, stepId, attempt, errorClass(error), errorMessage(error));
    }

    @Override
    public void onCompensationStarted(String definitionId, String sagaId, int stepsToCompensate) {
        log.warn("{{\"saga_event\":\"compensation_started\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"steps\":\"{}\"}}",
                definitionId, sagaId, stepsToCompensate);
    }

    @Override
    public void onStepCompensated(String definitionId, String sagaId, String stepId) {
        log.info("{{\"saga_event\":\"step_compensated\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\"}}",
                definitionId, sagaId, stepId);
    }

    @Override
    public void onCompensationFailed(String definitionId, String sagaId, String stepId, Throwable error) {
        log.error("{{\"saga_event\":\"compensation_failed\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\",\"error_class\":\"{}\",\"error_message\":\"{}\"}}",
                definitionId, sagaId, stepId, errorClass(error), errorMessage(error));
    }

    @Override
    public void onSagaCompleted(String definitionId, String sagaId, long durationMs) {
        log.info("{{\"saga_event\":\"saga_completed\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"duration_ms\":\"{}\"}}",
                definitionId, sagaId, durationMs);
    }

    @Override
    public void onSagaFailed(String definitionId, String sagaId, Throwable error) {
        log.error("{{\"saga_event\":\"saga_failed\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"error_class\":\"{}\",\"error_message\":\"{}\"}}",
                definitionId, sagaId, errorClass(error), errorMessage(error));
    }

    @Override
    public void onSagaCompensated(String definitionId, String sagaId, Throwable cause, long durationMs) {
        log.warn("{{\"saga_event\":\"saga_compensated\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"cause_class\":\"{}\",\"cause_message\":\"{}\",\"duration_ms\":\"{}\"}}",
                definitionId, sagaId, errorClass(cause), errorMessage(cause), durationMs);
    }

    private static String errorClass(Throwable error) {
        return error != null ? error.getClass().getSimpleName() : "";
    }

    private static String errorMessage(Throwable error) {
        if (error == null || error.getMessage() == null) {
            return "";
        }
        return error.getMessage().replace("\"", "'");
    }
}

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

/**
 * Observability hook for saga lifecycle events.
 * Provide your own Spring bean of this type to export metrics, traces or logs.
 * A default logger-based implementation is provided: {@link SagaLoggerEvents}.
 * <p>
 * Callbacks are fire-and-forget. The orchestrator invokes them on its worker threads and
 * ignores (after logging) anything they throw, so implementations must not block for long.
 */
public interface SagaEvents {

    /** A definition was registered with the orchestrator. */
    default void onSagaRegistered(String definitionId, int stepCount) {}

    default void onSagaStarted(String definitionId, String sagaId) {}

    /** A step action succeeded; {@code attempts} counts the first attempt. */
    default void onStepExecuted(String definitionId, String sagaId, String stepId, int attempts, long latencyMs) {}

    /** The completion of a step was persisted. */
    default void onStepCompleted(String definitionId, String sagaId, String stepId, int stepIndex) {}

    /** A step failed for good (critical, or retries exhausted). */
    default void onStepFailed(String definitionId, String sagaId, String stepId, Throwable error) {}

    /** A failed attempt is about to be retried; {@code attempt} is the attempt that failed. */
    default void onStepRetry(String definitionId, String sagaId, String stepId, int attempt, Throwable error) {}

    default void onCompensationStarted(String definitionId, String sagaId, int stepsToCompensate) {}

    default void onStepCompensated(String definitionId, String sagaId, String stepId) {}

    default void onCompensationFailed(String definitionId, String sagaId, String stepId, Throwable error) {}

    default void onSagaCompleted(String definitionId, String sagaId, long durationMs) {}

    /** An orchestrator-level fault ended the saga without compensation. */
    default void onSagaFailed(String definitionId, String sagaId, Throwable error) {}

    /** The reverse pass finished; {@code cause} is the error that triggered it. */
    default void onSagaCompensated(String definitionId, String sagaId, Throwable cause, long durationMs) {}
}

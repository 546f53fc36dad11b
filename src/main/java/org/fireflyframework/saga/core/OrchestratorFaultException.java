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

package org.fireflyframework.saga.core;

/**
 * Failure of the orchestrator's own machinery (durable store, serialization, bookkeeping)
 * as opposed to a failure of a step action. A saga hit by this fault goes straight to
 * {@link SagaStatus#FAILED} without compensation.
 */
public class OrchestratorFaultException extends SagaException {

    public OrchestratorFaultException(String message) {
        super(message);
    }

    public OrchestratorFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}

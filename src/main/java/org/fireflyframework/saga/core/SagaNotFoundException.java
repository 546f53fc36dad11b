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
 * Raised for an unknown saga definition id or an unknown saga execution id.
 */
public class SagaNotFoundException extends SagaException {

    private final String id;

    public SagaNotFoundException(String message, String id) {
        super(message);
        this.id = id;
    }

    public static SagaNotFoundException definition(String definitionId) {
        return new SagaNotFoundException("Saga definition not found: " + definitionId, definitionId);
    }

    public static SagaNotFoundException execution(String sagaId) {
        return new SagaNotFoundException("Saga execution not found: " + sagaId, sagaId);
    }

    public String getId() {
        return id;
    }
}

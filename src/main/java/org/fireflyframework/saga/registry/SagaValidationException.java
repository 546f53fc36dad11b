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

package org.fireflyframework.saga.registry;

import org.fireflyframework.saga.core.SagaException;

import java.util.List;

/**
 * Thrown when a saga definition is malformed at registration time.
 * Carries every problem found, not only the first one.
 */
public class SagaValidationException extends SagaException {

    private final String definitionId;
    private final List<String> problems;

    public SagaValidationException(String definitionId, List<String> problems) {
        super(buildMessage(definitionId, problems));
        this.definitionId = definitionId;
        this.problems = List.copyOf(problems);
    }

    private static String buildMessage(String definitionId, List<String> problems) {
        StringBuilder sb = new StringBuilder();
        sb.append("Invalid saga definition '").append(definitionId).append("': ");
        for (int i = 0; i < problems.size(); i++) {
            if (i > 0) {
                sb.append("; ");
            }
            sb.append(problems.get(i));
        }
        return sb.toString();
    }

    public String getDefinitionId() {
        return definitionId;
    }

    public List<String> getProblems() {
        return problems;
    }
}

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

import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks applied to every definition before it is registered.
 */
final class SagaDefinitionValidator {

    private SagaDefinitionValidator() {
    }

    static void validate(SagaDefinition definition) {
        if (definition == null) {
            throw new SagaValidationException(null, List.of("definition is null"));
        }
        List<String> problems = new ArrayList<>();
        if (!StringUtils.hasText(definition.getId())) {
            problems.add("id is required");
        }
        if (!StringUtils.hasText(definition.getName())) {
            problems.add("name is required");
        }
        if (definition.getSteps().isEmpty()) {
            problems.add("at least one step is required");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < definition.getSteps().size(); i++) {
            SagaStep step = definition.getSteps().get(i);
            String label = step.getId() != null ? "step '" + step.getId() + "'" : "step #" + i;
            if (!StringUtils.hasText(step.getId())) {
                problems.add(label + " has no id");
            } else if (!seen.add(step.getId())) {
                problems.add("duplicate step id '" + step.getId() + "'");
            }
            if (!StringUtils.hasText(step.getName())) {
                problems.add(label + " has no name");
            }
            if (step.getAction() == null) {
                problems.add(label + " has no action");
            }
            if (step.getCompensation() == null) {
                problems.add(label + " has no compensation");
            }
            if (step.getTimeout() != null && (step.getTimeout().isNegative() || step.getTimeout().isZero())) {
                problems.add(label + " timeout must be positive");
            }
            if (step.getRetries() != null && step.getRetries() < 0) {
                problems.add(label + " retries must not be negative");
            }
        }
        if (!problems.isEmpty()) {
            throw new SagaValidationException(definition.getId(), problems);
        }
    }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable description of a saga: an ordered list of steps plus optional terminal hooks.
 * Steps run in list order and are compensated in reverse order.
 */
public final class SagaDefinition {

    private final String id;
    private final String name;
    private final List<SagaStep> steps;
    private final SagaCompletionHook onComplete;
    private final SagaFailureHook onFailed;

    public SagaDefinition(String id,
                          String name,
                          List<SagaStep> steps,
                          SagaCompletionHook onComplete,
                          SagaFailureHook onFailed) {
        this.id = id;
        this.name = name;
        this.steps = steps != null
                ? Collections.unmodifiableList(new ArrayList<>(steps))
                : List.of();
        this.onComplete = onComplete;
        this.onFailed = onFailed;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public List<SagaStep> getSteps() { return steps; }
    public int size() { return steps.size(); }
    public Optional<SagaCompletionHook> getOnComplete() { return Optional.ofNullable(onComplete); }
    public Optional<SagaFailureHook> getOnFailed() { return Optional.ofNullable(onFailed); }

    public Optional<SagaStep> stepById(String stepId) {
        for (SagaStep step : steps) {
            if (step.getId() != null && step.getId().equals(stepId)) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "SagaDefinition{id='" + id + "', name='" + name + "', steps=" + steps.size() + '}';
    }
}

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

import java.time.Duration;

/**
 * One step of a saga definition: a forward action paired with its compensation.
 * <p>
 * {@code timeout} and {@code retries} are optional; when {@code null} the orchestrator defaults
 * apply. A critical step is never retried.
 */
public final class SagaStep {

    private final String id;
    private final String name;
    private final StepAction action;
    private final StepCompensation compensation;
    private final Duration timeout;
    private final Integer retries;
    private final boolean critical;

    public SagaStep(String id,
                    String name,
                    StepAction action,
                    StepCompensation compensation,
                    Duration timeout,
                    Integer retries,
                    boolean critical) {
        this.id = id;
        this.name = name;
        this.action = action;
        this.compensation = compensation;
        this.timeout = timeout;
        this.retries = retries;
        this.critical = critical;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public StepAction getAction() { return action; }
    public StepCompensation getCompensation() { return compensation; }
    public Duration getTimeout() { return timeout; }
    public Integer getRetries() { return retries; }
    public boolean isCritical() { return critical; }

    @Override
    public String toString() {
        return "SagaStep{id='" + id + "', name='" + name + "', timeout=" + timeout
                + ", retries=" + retries + ", critical=" + critical + '}';
    }
}

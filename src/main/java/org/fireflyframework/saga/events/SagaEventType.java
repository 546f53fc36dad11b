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

package org.fireflyframework.saga.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle event kinds, with the wire names carried by published envelopes.
 */
public enum SagaEventType {

    SAGA_REGISTERED("saga_registered"),
    SAGA_STARTED("saga_started"),
    STEP_EXECUTED("step_executed"),
    STEP_COMPLETED("step_completed"),
    STEP_FAILED("step_failed"),
    STEP_RETRY("step_retry"),
    COMPENSATION_STARTED("compensation_started"),
    STEP_COMPENSATED("step_compensated"),
    COMPENSATION_FAILED("compensation_failed"),
    SAGA_COMPLETED("saga_completed"),
    SAGA_FAILED("saga_failed"),
    SAGA_COMPENSATED("saga_compensated");

    private final String wireName;

    SagaEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a saga execution.
 * <p>
 * Allowed transitions:
 * <pre>
 * RUNNING      -> COMPLETED | COMPENSATING | FAILED
 * COMPENSATING -> COMPENSATED | FAILED
 * FAILED       -> RUNNING (retry)
 * COMPENSATED  -> RUNNING (retry)
 * </pre>
 * Persisted records carry the lowercase wire value ({@code running}, {@code completed}, ...).
 */
public enum SagaStatus {

    RUNNING,
    COMPLETED,
    FAILED,
    COMPENSATING,
    COMPENSATED;

    /**
     * Whether no further progress happens without an explicit retry.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == COMPENSATED;
    }

    /**
     * Whether a worker should continue this execution after a restart.
     */
    public boolean isInFlight() {
        return this == RUNNING || this == COMPENSATING;
    }

    /**
     * Statuses accepted by {@code retrySaga}.
     */
    public boolean isRetriable() {
        return this == FAILED || this == COMPENSATED;
    }

    public boolean canTransitionTo(SagaStatus target) {
        if (target == null) {
            return false;
        }
        switch (this) {
            case RUNNING:
                return target == COMPLETED || target == COMPENSATING || target == FAILED;
            case COMPENSATING:
                return target == COMPENSATED || target == FAILED;
            case FAILED:
            case COMPENSATED:
                return target == RUNNING;
            default:
                return false;
        }
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SagaStatus fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        return SagaStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

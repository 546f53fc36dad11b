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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional caller attributes for {@code startSaga}.
 */
public final class SagaOptions {

    private static final SagaOptions NONE = builder().build();

    private final String tenantId;
    private final String userId;
    private final String correlationId;
    private final Map<String, Object> metadata;

    private SagaOptions(Builder builder) {
        this.tenantId = builder.tenantId;
        this.userId = builder.userId;
        this.correlationId = builder.correlationId;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static SagaOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTenantId() { return tenantId; }
    public String getUserId() { return userId; }
    /** Correlation id; {@code null} means the saga id is used. */
    public String getCorrelationId() { return correlationId; }
    public Map<String, Object> getMetadata() { return metadata; }

    public static final class Builder {
        private String tenantId;
        private String userId;
        private String correlationId;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder metadata(String key, Object value) {
            if (key != null && value != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public Builder metadata(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::metadata);
            }
            return this;
        }

        public SagaOptions build() {
            return new SagaOptions(this);
        }
    }
}

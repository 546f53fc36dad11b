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

package org.fireflyframework.saga.persistence.serialization;

import org.fireflyframework.saga.core.SagaExecution;

/**
 * Converts execution records to and from the bytes kept in the durable store.
 */
public interface SagaExecutionSerializer {

    byte[] serialize(SagaExecution execution) throws SerializationException;

    SagaExecution deserialize(byte[] data) throws SerializationException;

    /**
     * Content type identifier written alongside each record (e.g. "application/json").
     */
    String getContentType();

    String getVersion();

    boolean canDeserialize(String contentType, String version);

    /**
     * Exception thrown when serialization or deserialization fails.
     */
    class SerializationException extends Exception {
        public SerializationException(String message) {
            super(message);
        }

        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

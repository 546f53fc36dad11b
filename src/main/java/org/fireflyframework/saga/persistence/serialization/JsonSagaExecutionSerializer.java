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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.fireflyframework.saga.core.SagaExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Jackson serializer for execution records.
 * <p>
 * Each record is wrapped in an envelope carrying the content type and format version:
 * <pre>{@code {"contentType":"application/json","version":"1.0","execution":{...}}}</pre>
 * Unknown properties are ignored on read so that newer writers stay readable.
 */
public class JsonSagaExecutionSerializer implements SagaExecutionSerializer {

    private static final Logger log = LoggerFactory.getLogger(JsonSagaExecutionSerializer.class);

    static final String CONTENT_TYPE = "application/json";
    static final String VERSION = "1.0";

    private final ObjectMapper objectMapper;

    public JsonSagaExecutionSerializer() {
        this(createDefaultObjectMapper());
    }

    public JsonSagaExecutionSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] serialize(SagaExecution execution) throws SerializationException {
        try {
            return objectMapper.writeValueAsBytes(new ExecutionEnvelope(CONTENT_TYPE, VERSION, execution));
        } catch (JsonProcessingException e) {
            String message = String.format("Failed to serialize saga execution %s", execution.getSagaId());
            log.error(message, e);
            throw new SerializationException(message, e);
        }
    }

    @Override
    public SagaExecution deserialize(byte[] data) throws SerializationException {
        ExecutionEnvelope envelope;
        try {
            envelope = objectMapper.readValue(data, ExecutionEnvelope.class);
        } catch (IOException e) {
            String message = "Failed to deserialize saga execution from JSON";
            log.error(message, e);
            throw new SerializationException(message, e);
        }
        if (!canDeserialize(envelope.getContentType(), envelope.getVersion())) {
            throw new SerializationException(String.format(
                    "Incompatible serialization format: %s version %s",
                    envelope.getContentType(), envelope.getVersion()));
        }
        if (envelope.getExecution() == null) {
            throw new SerializationException("Serialized envelope carries no execution");
        }
        return envelope.getExecution();
    }

    @Override
    public String getContentType() {
        return CONTENT_TYPE;
    }

    @Override
    public String getVersion() {
        return VERSION;
    }

    @Override
    public boolean canDeserialize(String contentType, String version) {
        return CONTENT_TYPE.equals(contentType) && VERSION.equals(version);
    }

    static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // step results may be arbitrary application objects
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    private static class ExecutionEnvelope {
        private String contentType;
        private String version;
        private SagaExecution execution;

        // Default constructor for Jackson
        public ExecutionEnvelope() {}

        ExecutionEnvelope(String contentType, String version, SagaExecution execution) {
            this.contentType = contentType;
            this.version = version;
            this.execution = execution;
        }

        public String getContentType() { return contentType; }
        public void setContentType(String contentType) { this.contentType = contentType; }
        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }
        public SagaExecution getExecution() { return execution; }
        public void setExecution(SagaExecution execution) { this.execution = execution; }
    }
}

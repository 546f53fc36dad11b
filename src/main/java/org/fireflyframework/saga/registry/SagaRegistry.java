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

import org.fireflyframework.saga.core.SagaNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the saga definitions known to an orchestrator, keyed by definition id.
 * <p>
 * Definitions are validated on registration. Registering an id again replaces the previous
 * definition. Executions look their definition up by id at every step, so definitions are
 * meant to be registered once at startup.
 */
public class SagaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SagaRegistry.class);

    private final Map<String, SagaDefinition> sagas = new ConcurrentHashMap<>();

    public SagaRegistry() {
    }

    public SagaRegistry(Collection<SagaDefinition> definitions) {
        if (definitions != null) {
            definitions.forEach(this::register);
        }
    }

    /**
     * @return {@code true} when an earlier definition with the same id was replaced
     * @throws SagaValidationException if the definition is malformed
     */
    public boolean register(SagaDefinition definition) {
        SagaDefinitionValidator.validate(definition);
        SagaDefinition previous = sagas.put(definition.getId(), definition);
        if (previous != null) {
            log.warn("Saga definition '{}' re-registered; previous definition replaced", definition.getId());
        } else {
            log.debug("Registered saga definition '{}' with {} step(s)", definition.getId(), definition.size());
        }
        return previous != null;
    }

    public SagaDefinition getDefinition(String id) {
        SagaDefinition def = id != null ? sagas.get(id) : null;
        if (def == null) {
            throw SagaNotFoundException.definition(id);
        }
        return def;
    }

    public boolean hasDefinition(String id) {
        return id != null && sagas.containsKey(id);
    }

    public Collection<SagaDefinition> getAll() {
        return Collections.unmodifiableCollection(sagas.values());
    }

    public int size() {
        return sagas.size();
    }
}

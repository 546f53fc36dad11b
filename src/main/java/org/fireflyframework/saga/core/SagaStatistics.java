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

/**
 * Aggregate view over the executions known to an orchestrator instance.
 *
 * @param totalSagas              executions currently held in memory
 * @param runningSagas            executions in {@link SagaStatus#RUNNING}
 * @param completedSagas          executions in {@link SagaStatus#COMPLETED}
 * @param failedSagas             executions in {@link SagaStatus#FAILED} or {@link SagaStatus#COMPENSATED}
 * @param averageExecutionTimeMs  mean execution time over executions that recorded one, 0 if none did
 * @param registeredDefinitions   number of registered saga definitions
 */
public record SagaStatistics(long totalSagas,
                             long runningSagas,
                             long completedSagas,
                             long failedSagas,
                             double averageExecutionTimeMs,
                             int registeredDefinitions) {
}

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

package org.fireflyframework.saga.engine;

import org.fireflyframework.saga.observability.SagaEvents;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Records lifecycle callbacks as {@code "event:detail"} strings and lets tests wait for sagas to finish.
 */
public class RecordingSagaEvents implements SagaEvents {

    public final List<String> calls = new CopyOnWriteArrayList<>();
    public final List<Throwable> compensationCauses = new CopyOnWriteArrayList<>();
    private final Map<String, Integer> finishes = new HashMap<>();

    @Override
    public void onSagaRegistered(String definitionId, int stepCount) {
        calls.add("saga_registered:" + definitionId);
    }

    @Override
    public void onSagaStarted(String definitionId, String sagaId) {
        calls.add("saga_started:" + definitionId);
    }

    @Override
    public void onStepCompleted(String definitionId, String sagaId, String stepId, int stepIndex) {
        calls.add("step_completed:" + stepId);
    }

    @Override
    public void onStepFailed(String definitionId, String sagaId, String stepId, Throwable error) {
        calls.add("step_failed:" + stepId);
    }

    @Override
    public void onStepRetry(String definitionId, String sagaId, String stepId, int attempt, Throwable error) {
        calls.add("step_retry:" + stepId + ":" + attempt);
    }

    @Override
    public void onCompensationStarted(String definitionId, String sagaId, int stepsToCompensate) {
        calls.add("compensation_started:" + stepsToCompensate);
    }

    @Override
    public void onStepCompensated(String definitionId, String sagaId, String stepId) {
        calls.add("step_compensated:" + stepId);
    }

    @Override
    public void onCompensationFailed(String definitionId, String sagaId, String stepId, Throwable error) {
        calls.add("compensation_failed:" + stepId);
    }

    @Override
    public void onSagaCompleted(String definitionId, String sagaId, long durationMs) {
        calls.add("saga_completed:" + definitionId);
        finished(sagaId);
    }

    @Override
    public void onSagaFailed(String definitionId, String sagaId, Throwable error) {
        calls.add("saga_failed:" + definitionId);
        finished(sagaId);
    }

    @Override
    public void onSagaCompensated(String definitionId, String sagaId, Throwable cause, long durationMs) {
        calls.add("saga_compensated:" + definitionId);
        compensationCauses.add(cause);
        finished(sagaId);
    }

    public List<String> callsStartingWith(String prefix) {
        return calls.stream().filter(c -> c.startsWith(prefix)).collect(Collectors.toList());
    }

    public void awaitFinished(String sagaId) throws InterruptedException {
        awaitFinished(sagaId, 1, Duration.ofSeconds(10));
    }

    /**
     * Blocks until the saga reached a terminal outcome {@code times} times.
     */
    public synchronized void awaitFinished(String sagaId, int times, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (finishes.getOrDefault(sagaId, 0) < times) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new AssertionError("Saga " + sagaId + " did not finish " + times + " time(s) within "
                        + timeout + "; events so far: " + new ArrayList<>(calls));
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
    }

    private synchronized void finished(String sagaId) {
        finishes.merge(sagaId, 1, Integer::sum);
        notifyAll();
    }
}

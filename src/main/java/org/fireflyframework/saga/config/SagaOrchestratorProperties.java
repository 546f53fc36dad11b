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

package org.fireflyframework.saga.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties for the Saga Orchestrator.
 * These properties can be configured via application.properties or application.yml.
 *
 * Example configuration:
 * <pre>
 * firefly.saga.orchestrator.default-step-timeout=30s
 * firefly.saga.orchestrator.default-step-retries=3
 * firefly.saga.orchestrator.retry.initial-backoff=1s
 * firefly.saga.orchestrator.retry.jitter=false
 * firefly.saga.orchestrator.worker.thread-cap=50
 * firefly.saga.orchestrator.persistence.provider=redis
 * firefly.saga.orchestrator.persistence.key-prefix=saga:
 * firefly.saga.orchestrator.persistence.retention=7d
 * firefly.saga.orchestrator.persistence.redis.host=localhost
 * firefly.saga.orchestrator.persistence.redis.port=6379
 * firefly.saga.orchestrator.persistence.redis.database=6
 * firefly.saga.orchestrator.recovery.enabled=true
 * </pre>
 */
@ConfigurationProperties(prefix = "firefly.saga.orchestrator")
public class SagaOrchestratorProperties {

    /**
     * Timeout applied to steps that do not declare one. Also bounds their compensation.
     */
    private Duration defaultStepTimeout = Duration.ofSeconds(30);

    /**
     * Retries applied to non-critical steps that do not declare a retry count.
     */
    private int defaultStepRetries = 3;

    @NestedConfigurationProperty
    private RetryProperties retry = new RetryProperties();

    @NestedConfigurationProperty
    private WorkerProperties worker = new WorkerProperties();

    @NestedConfigurationProperty
    private PersistenceProperties persistence = new PersistenceProperties();

    @NestedConfigurationProperty
    private RecoveryProperties recovery = new RecoveryProperties();

    @NestedConfigurationProperty
    private ObservabilityProperties observability = new ObservabilityProperties();

    // Getters and setters
    public Duration getDefaultStepTimeout() {
        return defaultStepTimeout;
    }

    public void setDefaultStepTimeout(Duration defaultStepTimeout) {
        this.defaultStepTimeout = defaultStepTimeout;
    }

    public int getDefaultStepRetries() {
        return defaultStepRetries;
    }

    public void setDefaultStepRetries(int defaultStepRetries) {
        this.defaultStepRetries = defaultStepRetries;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }

    public WorkerProperties getWorker() {
        return worker;
    }

    public void setWorker(WorkerProperties worker) {
        this.worker = worker;
    }

    public PersistenceProperties getPersistence() {
        return persistence;
    }

    public void setPersistence(PersistenceProperties persistence) {
        this.persistence = persistence;
    }

    public RecoveryProperties getRecovery() {
        return recovery;
    }

    public void setRecovery(RecoveryProperties recovery) {
        this.recovery = recovery;
    }

    public ObservabilityProperties getObservability() {
        return observability;
    }

    public void setObservability(ObservabilityProperties observability) {
        this.observability = observability;
    }

    /**
     * Step retry backoff configuration.
     */
    public static class RetryProperties {

        /**
         * Delay before the first retry; doubled for every further retry.
         */
        private Duration initialBackoff = Duration.ofSeconds(1);

        /**
         * Whether to spread retry delays randomly around the exponential schedule.
         */
        private boolean jitter = false;

        /**
         * Relative spread of the jitter (0..1).
         */
        private double jitterFactor = 0.5d;

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }
    }

    /**
     * Background worker pool configuration.
     */
    public static class WorkerProperties {

        /**
         * Maximum number of worker threads.
         */
        private int threadCap = 50;

        /**
         * Maximum number of tasks queued once every worker thread is busy.
         */
        private int queuedTaskCap = 100_000;

        private String threadNamePrefix = "saga-orchestrator";

        public int getThreadCap() {
            return threadCap;
        }

        public void setThreadCap(int threadCap) {
            this.threadCap = threadCap;
        }

        public int getQueuedTaskCap() {
            return queuedTaskCap;
        }

        public void setQueuedTaskCap(int queuedTaskCap) {
            this.queuedTaskCap = queuedTaskCap;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Durable store configuration.
     */
    public static class PersistenceProperties {

        /**
         * Store implementation: "in-memory" or "redis".
         */
        private String provider = "in-memory";

        /**
         * Prefix of every key written by the orchestrator.
         */
        private String keyPrefix = "saga:";

        /**
         * How long terminal executions are kept.
         */
        private Duration retention = Duration.ofDays(7);

        /**
         * Expiry of in-flight executions; unset keeps them until they finish.
         */
        private Duration inFlightTtl;

        /**
         * Whether terminal executions are periodically evicted from memory and the store.
         */
        private boolean cleanupEnabled = true;

        private Duration cleanupInterval = Duration.ofHours(1);

        @NestedConfigurationProperty
        private RedisProperties redis = new RedisProperties();

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public Duration getInFlightTtl() {
            return inFlightTtl;
        }

        public void setInFlightTtl(Duration inFlightTtl) {
            this.inFlightTtl = inFlightTtl;
        }

        public boolean isCleanupEnabled() {
            return cleanupEnabled;
        }

        public void setCleanupEnabled(boolean cleanupEnabled) {
            this.cleanupEnabled = cleanupEnabled;
        }

        public Duration getCleanupInterval() {
            return cleanupInterval;
        }

        public void setCleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
        }

        public RedisProperties getRedis() {
            return redis;
        }

        public void setRedis(RedisProperties redis) {
            this.redis = redis;
        }
    }

    /**
     * Redis connection used when {@code persistence.provider=redis}.
     */
    public static class RedisProperties {

        private String host = "localhost";

        private int port = 6379;

        /**
         * Redis logical database; saga records are kept apart from other data by default.
         */
        private int database = 6;

        private String password;

        private Duration commandTimeout = Duration.ofSeconds(10);

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getDatabase() {
            return database;
        }

        public void setDatabase(int database) {
            this.database = database;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public Duration getCommandTimeout() {
            return commandTimeout;
        }

        public void setCommandTimeout(Duration commandTimeout) {
            this.commandTimeout = commandTimeout;
        }
    }

    /**
     * Recovery of in-flight executions at startup.
     */
    public static class RecoveryProperties {

        /**
         * Whether in-flight executions found in the store are resumed once the application is ready.
         */
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class ObservabilityProperties {

        private boolean loggingEnabled = true;

        private boolean metricsEnabled = true;

        public boolean isLoggingEnabled() {
            return loggingEnabled;
        }

        public void setLoggingEnabled(boolean loggingEnabled) {
            this.loggingEnabled = loggingEnabled;
        }

        public boolean isMetricsEnabled() {
            return metricsEnabled;
        }

        public void setMetricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
        }
    }
}

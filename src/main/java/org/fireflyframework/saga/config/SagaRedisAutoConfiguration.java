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

import org.fireflyframework.saga.persistence.DurableStore;
import org.fireflyframework.saga.persistence.impl.RedisDurableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Auto-configuration for the Redis durable store.
 * <p>
 * Only loaded when Redis classes are available on the classpath and
 * {@code firefly.saga.orchestrator.persistence.provider=redis}. A connection factory declared by
 * the application takes precedence over the one built from the orchestrator properties.
 */
@AutoConfiguration(before = {RedisAutoConfiguration.class, RedisReactiveAutoConfiguration.class})
@EnableConfigurationProperties(SagaOrchestratorProperties.class)
@ConditionalOnClass({RedisConnectionFactory.class, ReactiveRedisTemplate.class})
@ConditionalOnProperty(prefix = "firefly.saga.orchestrator.persistence", name = "provider", havingValue = "redis")
public class SagaRedisAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SagaRedisAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(RedisConnectionFactory.class)
    public LettuceConnectionFactory sagaRedisConnectionFactory(SagaOrchestratorProperties properties) {
        SagaOrchestratorProperties.RedisProperties redis = properties.getPersistence().getRedis();
        log.info("Configuring Redis connection factory for saga persistence: {}:{} (database {})",
                redis.getHost(), redis.getPort(), redis.getDatabase());
        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(redis.getHost(), redis.getPort());
        server.setDatabase(redis.getDatabase());
        if (redis.getPassword() != null) {
            server.setPassword(RedisPassword.of(redis.getPassword()));
        }
        LettuceClientConfiguration client = LettuceClientConfiguration.builder()
                .commandTimeout(redis.getCommandTimeout())
                .build();
        LettuceConnectionFactory factory = new LettuceConnectionFactory(server, client);
        factory.setValidateConnection(true);
        return factory;
    }

    @Bean
    @ConditionalOnMissingBean(name = "sagaReactiveRedisTemplate")
    public ReactiveRedisTemplate<String, byte[]> sagaReactiveRedisTemplate(ReactiveRedisConnectionFactory connectionFactory) {
        log.debug("Configuring reactive Redis template for saga persistence");
        return new ReactiveRedisTemplate<>(connectionFactory, serializationContext());
    }

    @Bean
    @ConditionalOnMissingBean(DurableStore.class)
    public DurableStore redisDurableStore(ReactiveRedisTemplate<String, byte[]> sagaReactiveRedisTemplate,
                                          SagaOrchestratorProperties properties) {
        return new RedisDurableStore(sagaReactiveRedisTemplate, properties.getPersistence().getKeyPrefix());
    }

    static RedisSerializationContext<String, byte[]> serializationContext() {
        return RedisSerializationContext
                .<String, byte[]>newSerializationContext()
                .key(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .value(RedisSerializationContext.SerializationPair.fromSerializer(RedisSerializer.byteArray()))
                .hashKey(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .hashValue(RedisSerializationContext.SerializationPair.fromSerializer(RedisSerializer.byteArray()))
                .build();
    }
}

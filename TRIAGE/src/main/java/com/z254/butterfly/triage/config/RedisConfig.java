package com.z254.butterfly.triage.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.triage.domain.repository.AlertRepository;
import com.z254.butterfly.triage.domain.repository.GroupSnapshotRepository;
import com.z254.butterfly.triage.domain.repository.RedisAlertRepository;
import com.z254.butterfly.triage.domain.repository.RedisGroupSnapshotRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Clock;

/**
 * Redis-backed group and alert stores, active with {@code triage.persistence.store=redis}.
 * Values are JSON written with the application {@link ObjectMapper}.
 */
@Configuration
@ConditionalOnProperty(name = "triage.persistence.store", havingValue = "redis")
public class RedisConfig {

    @Bean
    public ReactiveRedisTemplate<String, String> triageRedisTemplate(
            ReactiveRedisConnectionFactory connectionFactory) {
        StringRedisSerializer serializer = new StringRedisSerializer();

        RedisSerializationContext<String, String> context = RedisSerializationContext
                .<String, String>newSerializationContext(serializer)
                .value(serializer)
                .build();

        return new ReactiveRedisTemplate<>(connectionFactory, context);
    }

    @Bean
    public GroupSnapshotRepository redisGroupSnapshotRepository(ReactiveRedisTemplate<String, String> triageRedisTemplate,
                                                                ObjectMapper objectMapper,
                                                                TriageProperties properties,
                                                                Clock clock) {
        TriageProperties.Persistence persistence = properties.getPersistence();
        return new RedisGroupSnapshotRepository(triageRedisTemplate, objectMapper,
                persistence.getRedisKeyPrefix(), persistence.getTimeout(), clock);
    }

    @Bean
    public AlertRepository redisAlertRepository(ReactiveRedisTemplate<String, String> triageRedisTemplate,
                                                ObjectMapper objectMapper,
                                                TriageProperties properties) {
        TriageProperties.Persistence persistence = properties.getPersistence();
        return new RedisAlertRepository(triageRedisTemplate, objectMapper,
                persistence.getRedisKeyPrefix(), persistence.getTimeout(), persistence.getAlertRetention());
    }
}

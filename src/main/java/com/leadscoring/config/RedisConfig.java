package com.leadscoring.config;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Redis for read caching and for consumer idempotency keys.
 *
 * CACHE REGIONS:
 * ==============
 * - scores:      current ScoreRecord per prospect (TTL 10 min, evicted by every recompute)
 * - assignments: assignment history per prospect (TTL 30 min, evicted by every recompute)
 *
 * Idempotency keys are written through the RedisTemplate by IdempotencyService (7 days).
 */
@Configuration
@EnableCaching
@Slf4j
public class RedisConfig {

    public static final String SCORES_CACHE = "scores";
    public static final String ASSIGNMENTS_CACHE = "assignments";

    @Bean
    public RedisTemplate<String, Object> redisTemplate(
            RedisConnectionFactory connectionFactory,
            ObjectMapper objectMapper) {

        RedisTemplate<String, Object> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        StringRedisSerializer stringSerializer = new StringRedisSerializer();
        template.setKeySerializer(stringSerializer);
        template.setHashKeySerializer(stringSerializer);

        GenericJackson2JsonRedisSerializer jsonSerializer = jsonSerializer(objectMapper);
        template.setValueSerializer(jsonSerializer);
        template.setHashValueSerializer(jsonSerializer);

        template.afterPropertiesSet();

        log.info("Configured RedisTemplate with JSON serialization");
        return template;
    }

    /**
     * Score reads are frequent (dashboards, sequence enrollment) and only change on recompute,
     * so they are cached and evicted explicitly. transactionAware() delays the eviction until
     * the recompute transaction commits.
     */
    @Bean
    public CacheManager cacheManager(
            RedisConnectionFactory connectionFactory,
            ObjectMapper objectMapper) {

        RedisCacheConfiguration defaultConfig = RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(Duration.ofMinutes(10))
            .disableCachingNullValues()
            .serializeKeysWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                    new StringRedisSerializer()))
            .serializeValuesWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                    jsonSerializer(objectMapper)));

        Map<String, RedisCacheConfiguration> cacheConfigurations = new HashMap<>();

        cacheConfigurations.put(SCORES_CACHE, defaultConfig
            .entryTtl(Duration.ofMinutes(10))
            .prefixCacheNameWith("lead:"));

        cacheConfigurations.put(ASSIGNMENTS_CACHE, defaultConfig
            .entryTtl(Duration.ofMinutes(30))
            .prefixCacheNameWith("lead:"));

        RedisCacheManager cacheManager = RedisCacheManager.builder(connectionFactory)
            .cacheDefaults(defaultConfig)
            .withInitialCacheConfigurations(cacheConfigurations)
            .transactionAware()
            .build();

        log.info("Configured RedisCacheManager with regions: {} (10m), {} (30m)", SCORES_CACHE, ASSIGNMENTS_CACHE);
        return cacheManager;
    }

    /**
     * Cached values are read back without a target type, so every value carries its class name.
     */
    private static GenericJackson2JsonRedisSerializer jsonSerializer(ObjectMapper objectMapper) {
        ObjectMapper typed = objectMapper.copy();
        typed.activateDefaultTyping(typed.getPolymorphicTypeValidator(),
                ObjectMapper.DefaultTyping.EVERYTHING, JsonTypeInfo.As.PROPERTY);
        return new GenericJackson2JsonRedisSerializer(typed);
    }
}

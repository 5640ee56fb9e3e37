package com.fueltrack.archival.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fueltrack.archival.dto.ArchivalStats;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis cache configuration.
 *
 * <p>
 * Caches:
 * <ul>
 * <li>{@value #STATS_CACHE}: archival statistics snapshot, evicted after every run and restore</li>
 * </ul>
 */
@Configuration
@EnableCaching
public class CacheConfig {

        public static final String STATS_CACHE = "archivalStats";

        @Bean
        public RedisCacheManager cacheManager(RedisConnectionFactory factory) {
                ObjectMapper mapper = new ObjectMapper()
                                .registerModule(new JavaTimeModule())
                                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

                RedisCacheConfiguration defaults = RedisCacheConfiguration.defaultCacheConfig()
                                .entryTtl(Duration.ofHours(1))
                                .serializeKeysWith(RedisSerializationContext.SerializationPair
                                                .fromSerializer(new StringRedisSerializer()))
                                .disableCachingNullValues();

                // Typed serializer, so no class hints are stored next to the values
                RedisCacheConfiguration stats = defaults
                                .entryTtl(Duration.ofMinutes(5))
                                .serializeValuesWith(RedisSerializationContext.SerializationPair
                                                .fromSerializer(new Jackson2JsonRedisSerializer<>(mapper,
                                                                ArchivalStats.class)));

                return RedisCacheManager.builder(factory)
                                .cacheDefaults(defaults)
                                .withCacheConfiguration(STATS_CACHE, stats)
                                .transactionAware()
                                .build();
        }
}

package com.intention.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intention.cache.CacheSweeper;
import com.intention.cache.InMemoryResponseCacheStore;
import com.intention.cache.RedisResponseCacheStore;
import com.intention.cache.ResponseCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Clock;

/**
 * Response cache backend selection.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    private final IntentionProperties properties;

    public CacheConfiguration(IntentionProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnProperty(prefix = "intention.cache", name = "backend", havingValue = "memory", matchIfMissing = true)
    public ResponseCacheStore inMemoryResponseCacheStore(Clock clock) {
        log.info("Using in-memory response cache (maxSize={})", properties.getCache().getMaxSize());
        return new InMemoryResponseCacheStore(properties.getCache().getMaxSize(), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "intention.cache", name = "backend", havingValue = "redis")
    public ResponseCacheStore redisResponseCacheStore(
            @Qualifier("cacheRedisTemplate") RedisTemplate<String, byte[]> cacheRedisTemplate,
            ObjectMapper objectMapper,
            Clock clock) {
        log.info("Using Redis response cache");
        return new RedisResponseCacheStore(cacheRedisTemplate, objectMapper, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "intention.cache", name = "sweep-interval")
    public CacheSweeper cacheSweeper(ResponseCacheStore store) {
        log.info("Expired-entry sweep every {}", properties.getCache().getSweepInterval());
        return new CacheSweeper(store);
    }
}

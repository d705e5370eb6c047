package com.newsdigest.pipeline.config;

import com.newsdigest.pipeline.service.routing.CaffeineSummaryCache;
import com.newsdigest.pipeline.service.routing.RedisSummaryCache;
import com.newsdigest.pipeline.service.routing.SummaryCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Summary cache selection.
 *
 * - digest.cache.type=memory (default): local Caffeine cache
 * - digest.cache.type=redis: Redis cache shared between instances
 */
@Configuration
@Slf4j
public class SummaryCacheConfig {

    @Bean
    @ConditionalOnProperty(name = "digest.cache.type", havingValue = "memory", matchIfMissing = true)
    public SummaryCache caffeineSummaryCache(DigestPipelineProperties properties) {
        DigestPipelineProperties.Cache cache = properties.getCache();
        log.info("Using Caffeine summary cache (maxSize={}, ttl={})", cache.getMaximumSize(), cache.getTtl());
        return new CaffeineSummaryCache(cache.getMaximumSize(), cache.getTtl());
    }

    @Bean
    @ConditionalOnProperty(name = "digest.cache.type", havingValue = "redis")
    public SummaryCache redisSummaryCache(DigestPipelineProperties properties, StringRedisTemplate redisTemplate) {
        log.info("Using Redis summary cache (ttl={})", properties.getCache().getTtl());
        return new RedisSummaryCache(redisTemplate, properties.getCache().getTtl());
    }
}

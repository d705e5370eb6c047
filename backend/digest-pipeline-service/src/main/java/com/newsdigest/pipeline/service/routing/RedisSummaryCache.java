package com.newsdigest.pipeline.service.routing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed summary cache.
 *
 * Key: newsdigest:summary:{articleId}
 * Redis errors are logged and count as a miss.
 */
@Slf4j
public class RedisSummaryCache implements SummaryCache {

    static final String KEY_PREFIX = "newsdigest:summary:";

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public RedisSummaryCache(StringRedisTemplate redisTemplate, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    @Override
    public Optional<String> lookup(String articleId) {
        try {
            String cached = redisTemplate.opsForValue().get(KEY_PREFIX + articleId);
            log.debug("Summary cache {} for article {}", cached != null ? "HIT" : "MISS", articleId);
            return Optional.ofNullable(cached);
        } catch (Exception e) {
            log.warn("Error reading summary cache for {}: {}", articleId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void store(String articleId, String summary) {
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + articleId, summary, ttl);
        } catch (Exception e) {
            log.warn("Error caching summary for {}: {}", articleId, e.getMessage());
        }
    }
}

package com.ecommerce.analytics.health;

import com.ecommerce.analytics.cache.CacheResilienceService;
import com.ecommerce.analytics.cache.RemoteCacheClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 分析缓存健康检查
 * Redis 不可用时业务按未命中降级，报告 DEGRADED 而非 DOWN
 */
@Slf4j
@Component("analyticsCacheHealthIndicator")
@RequiredArgsConstructor
public class CacheHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Redis unavailable, serving without cache");

    static final String PROBE_KEY = "analytics:health:probe";

    private final RemoteCacheClient cacheClient;
    private final CacheResilienceService resilienceService;

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        RemoteCacheClient.CacheStatistics stats = cacheClient.stats();
        details.put("connected", stats.connected());
        details.put("hitRate", stats.hitRate());
        details.put("circuitBreaker", resilienceService.getState().name());

        boolean healthy;
        try {
            // set + exists，不经过 get 以免计入命中统计
            healthy = cacheClient.set(PROBE_KEY, System.currentTimeMillis(), Duration.ofSeconds(10))
                && cacheClient.exists(PROBE_KEY);
        } catch (Exception e) {
            log.error("Redis health check failed", e);
            details.put("error", e.getMessage());
            healthy = false;
        }
        details.put("redis", healthy ? "UP" : "DOWN");

        if (healthy) {
            return Health.up().withDetails(details).build();
        }
        return Health.status(DEGRADED).withDetails(details).build();
    }
}

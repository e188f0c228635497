package com.ecommerce.analytics.monitor;

import com.ecommerce.analytics.cache.RemoteCacheClient;
import com.ecommerce.analytics.config.AnalyticsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 缓存运行状态巡检
 */
@Slf4j
@Component
public class CachePerformanceMonitor {

    private final RemoteCacheClient cacheClient;
    private final double hitRateThreshold;

    public CachePerformanceMonitor(RemoteCacheClient cacheClient, AnalyticsProperties properties) {
        this.cacheClient = cacheClient;
        this.hitRateThreshold = properties.getMonitor().getHitRateThreshold();
    }

    /**
     * 每小时检查命中率，低于阈值告警
     *
     * @return 是否低于阈值
     */
    @Scheduled(cron = "${analytics.monitor.hit-rate-cron:0 0 * * * ?}")
    public boolean checkHitRate() {
        RemoteCacheClient.CacheStatistics stats = cacheClient.stats();
        if (stats.totalRequests() == 0) {
            log.debug("No cache traffic since last reset");
            return false;
        }
        if (stats.hitRate() < hitRateThreshold) {
            log.warn("Cache hit rate {} below threshold {} (hits={}, misses={})",
                String.format("%.2f%%", stats.hitRate() * 100),
                String.format("%.0f%%", hitRateThreshold * 100),
                stats.hits(), stats.misses());
            return true;
        }
        log.info("Cache hit rate {} (hits={}, misses={})",
            String.format("%.2f%%", stats.hitRate() * 100), stats.hits(), stats.misses());
        return false;
    }

    /**
     * Redis 断开后定期重连
     */
    @Scheduled(fixedDelayString = "${analytics.monitor.reconnect-interval-ms:30000}")
    public void probeConnection() {
        if (!cacheClient.isConnected() && cacheClient.reconnectIfNeeded()) {
            log.info("Redis cache connection restored");
        }
    }
}

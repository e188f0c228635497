package com.ecommerce.analytics.controller;

import com.ecommerce.analytics.cache.CacheResilienceService;
import com.ecommerce.analytics.cache.RemoteCacheClient;
import com.ecommerce.analytics.dto.ApiResponse;
import com.ecommerce.analytics.init.DashboardCacheWarmer;
import com.ecommerce.analytics.invalidation.CacheInvalidationService;
import com.ecommerce.analytics.ratelimit.SlidingWindowRateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 缓存运维管理 API
 */
@Slf4j
@RestController
@RequestMapping("/api/cache/admin")
@RequiredArgsConstructor
public class CacheAdminController {

    private final RemoteCacheClient cacheClient;
    private final CacheInvalidationService invalidationService;
    private final CacheResilienceService resilienceService;
    private final SlidingWindowRateLimiter rateLimiter;
    private final DashboardCacheWarmer cacheWarmer;

    /**
     * 缓存命中统计、熔断器状态、限流窗口数
     */
    @GetMapping("/stats")
    public ApiResponse<Map<String, Object>> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("cache", cacheClient.stats());
        stats.put("resilience", resilienceService.getStats());
        stats.put("rateLimiterTrackedWindows", rateLimiter.trackedCount());
        return ApiResponse.success(stats);
    }

    @PostMapping("/stats/reset")
    public ApiResponse<Void> resetStats() {
        cacheClient.resetStats();
        return ApiResponse.success(null);
    }

    /**
     * 按业务域失效，不传 id 表示该域全部
     */
    @PostMapping("/invalidate/{domain}")
    public ApiResponse<Map<String, Object>> invalidate(@PathVariable String domain,
                                                       @RequestParam(required = false) String id) {
        long removed = switch (domain) {
            case "dashboard" -> invalidationService.invalidateDashboard();
            case "product" -> invalidationService.invalidateProduct(id);
            case "customer" -> invalidationService.invalidateCustomer(id);
            case "sales-rep" -> invalidationService.invalidateSalesRep(id);
            case "category" -> invalidationService.invalidateCategory(id);
            case "trends" -> invalidationService.invalidateTrends();
            case "realtime" -> invalidationService.invalidateRealtime();
            default -> throw new IllegalArgumentException("Unknown cache domain: " + domain);
        };
        log.info("Manual invalidation: domain={}, id={}, removed={}", domain, id, removed);
        return ApiResponse.success(removedResult(removed));
    }

    @PostMapping("/events/materialized-view/{viewName}")
    public ApiResponse<Map<String, Object>> materializedViewRefreshed(@PathVariable String viewName) {
        return ApiResponse.success(removedResult(invalidationService.onMaterializedViewRefreshed(viewName)));
    }

    /**
     * 清空 analytics 命名空间
     */
    @DeleteMapping("/clear")
    public ApiResponse<Map<String, Object>> clearAll() {
        return ApiResponse.success(removedResult(invalidationService.clearAll()));
    }

    @GetMapping("/ttl")
    public ApiResponse<Map<String, Object>> ttl(@RequestParam String key) {
        Duration remaining = cacheClient.ttlRemaining(key);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("key", key);
        result.put("exists", cacheClient.exists(key));
        result.put("ttlSeconds", remaining == null ? null : remaining.getSeconds());
        return ApiResponse.success(result);
    }

    /**
     * 手动触发仪表盘预热
     */
    @PostMapping("/warmup")
    public ApiResponse<Map<String, Object>> warmup() {
        int warmed = cacheWarmer.warmDashboard();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("warmed", warmed);
        return ApiResponse.success(result);
    }

    private static Map<String, Object> removedResult(long removed) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("removed", removed);
        return result;
    }
}

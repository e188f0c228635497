package com.ecommerce.analytics.init;

import com.ecommerce.analytics.cache.memo.CacheBypass;
import com.ecommerce.analytics.service.AnalyticsQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 仪表盘缓存预热
 * 启动完成后强制刷新常用区间的总览、收入趋势与 Top 商品
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DashboardCacheWarmer {

    static final List<String> WARM_RANGES = List.of("7d", "30d", "90d");

    // 预热 Top 商品数量
    static final int TOP_PRODUCTS_LIMIT = 5;

    private final AnalyticsQueryService queryService;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!queryService.isAvailable()) {
            log.info("No analytics data source registered, skipping cache warmup");
            return;
        }
        warmDashboard();
    }

    /**
     * 单项失败只记录告警，不影响其余预热
     *
     * @return 成功预热的条目数
     */
    public int warmDashboard() {
        log.info(">>> Starting dashboard cache warmup...");
        long startTime = System.currentTimeMillis();
        int warmed = 0;

        try (CacheBypass ignored = CacheBypass.open()) {
            for (String range : WARM_RANGES) {
                warmed += warm("overview " + range, () -> queryService.getDashboardOverview(range));
                warmed += warm("revenue trend " + range, () -> queryService.getRevenueTrend(range));
                warmed += warm("top products " + range, () -> queryService.getTopProducts(range, TOP_PRODUCTS_LIMIT));
            }
        }

        log.info(">>> Dashboard cache warmup completed: {} entries in {} ms",
            warmed, System.currentTimeMillis() - startTime);
        return warmed;
    }

    private int warm(String name, Runnable loader) {
        try {
            loader.run();
            return 1;
        } catch (Exception e) {
            log.warn("Cache warmup failed for {}: {}", name, e.getMessage());
            return 0;
        }
    }
}

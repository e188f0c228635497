package com.ecommerce.analytics.controller;

import com.ecommerce.analytics.cache.CacheResilienceService;
import com.ecommerce.analytics.cache.RemoteCacheClient;
import com.ecommerce.analytics.init.DashboardCacheWarmer;
import com.ecommerce.analytics.invalidation.CacheInvalidationService;
import com.ecommerce.analytics.ratelimit.SlidingWindowRateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 缓存运维接口测试
 */
@WebMvcTest(CacheAdminController.class)
class CacheAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RemoteCacheClient cacheClient;

    @MockBean
    private CacheInvalidationService invalidationService;

    @MockBean
    private CacheResilienceService resilienceService;

    @MockBean
    private SlidingWindowRateLimiter rateLimiter;

    @MockBean
    private DashboardCacheWarmer cacheWarmer;

    @Test
    @DisplayName("查询统计 - 命中率、熔断器、限流窗口")
    void testGetStats() throws Exception {
        when(cacheClient.stats()).thenReturn(new RemoteCacheClient.CacheStatistics(3, 1, 0.75, true));
        when(resilienceService.getStats()).thenReturn(
            new CacheResilienceService.ResilienceStats("CLOSED", -1.0f, 0, 0));
        when(rateLimiter.trackedCount()).thenReturn(4);

        mockMvc.perform(get("/api/cache/admin/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(0))
            .andExpect(jsonPath("$.data.cache.hits").value(3))
            .andExpect(jsonPath("$.data.cache.hitRate").value(0.75))
            .andExpect(jsonPath("$.data.cache.connected").value(true))
            .andExpect(jsonPath("$.data.resilience.state").value("CLOSED"))
            .andExpect(jsonPath("$.data.rateLimiterTrackedWindows").value(4));
    }

    @Test
    @DisplayName("重置统计")
    void testResetStats() throws Exception {
        mockMvc.perform(post("/api/cache/admin/stats/reset"))
            .andExpect(status().isOk());

        verify(cacheClient).resetStats();
    }

    @Test
    @DisplayName("按商品 id 失效")
    void testInvalidateProduct() throws Exception {
        when(invalidationService.invalidateProduct("42")).thenReturn(3L);

        mockMvc.perform(post("/api/cache/admin/invalidate/product").param("id", "42"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.removed").value(3));
    }

    @Test
    @DisplayName("不传 id - 失效整个销售代表域")
    void testInvalidateAllSalesReps() throws Exception {
        when(invalidationService.invalidateSalesRep(null)).thenReturn(7L);

        mockMvc.perform(post("/api/cache/admin/invalidate/sales-rep"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.removed").value(7));
    }

    @Test
    @DisplayName("失效趋势与实时指标")
    void testInvalidateTrendsAndRealtime() throws Exception {
        when(invalidationService.invalidateTrends()).thenReturn(3L);
        when(invalidationService.invalidateRealtime()).thenReturn(1L);

        mockMvc.perform(post("/api/cache/admin/invalidate/trends"))
            .andExpect(jsonPath("$.data.removed").value(3));
        mockMvc.perform(post("/api/cache/admin/invalidate/realtime"))
            .andExpect(jsonPath("$.data.removed").value(1));
    }

    @Test
    @DisplayName("未知业务域 - 400")
    void testInvalidateUnknownDomain() throws Exception {
        mockMvc.perform(post("/api/cache/admin/invalidate/inventory"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400));

        verifyNoInteractions(invalidationService);
    }

    @Test
    @DisplayName("物化视图刷新事件")
    void testMaterializedViewRefreshed() throws Exception {
        when(invalidationService.onMaterializedViewRefreshed("mv_daily_sales")).thenReturn(23L);

        mockMvc.perform(post("/api/cache/admin/events/materialized-view/mv_daily_sales"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.removed").value(23));
    }

    @Test
    @DisplayName("清空命名空间")
    void testClearAll() throws Exception {
        when(invalidationService.clearAll()).thenReturn(12L);

        mockMvc.perform(delete("/api/cache/admin/clear"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.removed").value(12));
    }

    @Test
    @DisplayName("查询 Key 剩余 TTL")
    void testTtl() throws Exception {
        when(cacheClient.ttlRemaining("analytics:realtime_metrics")).thenReturn(Duration.ofSeconds(42));
        when(cacheClient.exists("analytics:realtime_metrics")).thenReturn(true);

        mockMvc.perform(get("/api/cache/admin/ttl").param("key", "analytics:realtime_metrics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.key").value("analytics:realtime_metrics"))
            .andExpect(jsonPath("$.data.exists").value(true))
            .andExpect(jsonPath("$.data.ttlSeconds").value(42));
    }

    @Test
    @DisplayName("缺少 key 参数 - 400")
    void testTtl_missingKey() throws Exception {
        mockMvc.perform(get("/api/cache/admin/ttl"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("手动预热")
    void testWarmup() throws Exception {
        when(cacheWarmer.warmDashboard()).thenReturn(9);

        mockMvc.perform(post("/api/cache/admin/warmup"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.warmed").value(9));
    }
}

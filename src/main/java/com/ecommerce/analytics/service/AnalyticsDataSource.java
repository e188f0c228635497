package com.ecommerce.analytics.service;

import com.ecommerce.analytics.dto.DashboardOverviewDTO;
import com.ecommerce.analytics.dto.DateRange;
import com.ecommerce.analytics.dto.EntityPerformanceDTO;
import com.ecommerce.analytics.dto.RealtimeMetricsDTO;
import com.ecommerce.analytics.dto.RevenueMetricsDTO;
import com.ecommerce.analytics.dto.TopProductDTO;
import com.ecommerce.analytics.dto.TrendPointDTO;

import java.util.List;

/**
 * 分析数据源，由宿主应用提供（通常是数据库聚合查询）
 * 缓存未命中时才会被调用
 */
public interface AnalyticsDataSource {

    DashboardOverviewDTO dashboardOverview(DateRange range);

    RevenueMetricsDTO revenueMetrics(DateRange range);

    EntityPerformanceDTO productPerformance(String productId, String period);

    EntityPerformanceDTO customerMetrics(String customerId, String period);

    EntityPerformanceDTO salesRepPerformance(String salesRepId, String period);

    EntityPerformanceDTO categoryPerformance(String categoryId, String period);

    List<TrendPointDTO> revenueTrend(String period);

    RealtimeMetricsDTO realtimeMetrics();

    List<TopProductDTO> topProducts(String period, int limit);
}

package com.ecommerce.analytics.service;

import com.ecommerce.analytics.cache.key.CacheKeys;
import com.ecommerce.analytics.cache.key.KeyStrategy;
import com.ecommerce.analytics.cache.memo.CacheDecorators;
import com.ecommerce.analytics.cache.memo.CachePolicy;
import com.ecommerce.analytics.cache.memo.Computation;
import com.ecommerce.analytics.config.AnalyticsProperties;
import com.ecommerce.analytics.dto.DashboardOverviewDTO;
import com.ecommerce.analytics.dto.DateRange;
import com.ecommerce.analytics.dto.EntityPerformanceDTO;
import com.ecommerce.analytics.dto.RealtimeMetricsDTO;
import com.ecommerce.analytics.dto.RevenueMetricsDTO;
import com.ecommerce.analytics.dto.TopProductDTO;
import com.ecommerce.analytics.dto.TrendPointDTO;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.function.BiFunction;

/**
 * 带缓存的分析查询门面
 * 每个查询都是装饰过的 {@link Computation}，未命中时回源 {@link AnalyticsDataSource}
 */
@Service
public class AnalyticsQueryService {

    private static final String TODAY = "today";

    private final ObjectProvider<AnalyticsDataSource> dataSourceProvider;

    private final Computation<DashboardOverviewDTO> dashboardOverview;
    private final Computation<RevenueMetricsDTO> revenueMetrics;
    private final Computation<EntityPerformanceDTO> productPerformance;
    private final Computation<EntityPerformanceDTO> customerMetrics;
    private final Computation<EntityPerformanceDTO> salesRepPerformance;
    private final Computation<EntityPerformanceDTO> categoryPerformance;
    private final Computation<List<TrendPointDTO>> revenueTrend;
    private final Computation<RealtimeMetricsDTO> realtimeMetrics;
    private final Computation<List<TopProductDTO>> topProducts;

    public AnalyticsQueryService(CacheDecorators decorators,
                                 ObjectProvider<AnalyticsDataSource> dataSourceProvider,
                                 AnalyticsProperties properties,
                                 Clock clock) {
        this.dataSourceProvider = dataSourceProvider;

        AnalyticsProperties.Ttl ttl = properties.getCache().getTtl();

        this.dashboardOverview = decorators.cached(
            CachePolicy.forType(DashboardOverviewDTO.class)
                .keyStrategy(KeyStrategy.template(CacheKeys.DASHBOARD_OVERVIEW, "date_range"))
                .ttl(Duration.ofSeconds(ttl.getDashboard()))
                .build(),
            args -> dataSource().dashboardOverview(DateRange.parse((String) args[0], clock)));

        // 任意起止日期，Key 由参数哈希派生
        this.revenueMetrics = decorators.cacheResult("revenue_metrics",
            CachePolicy.forType(RevenueMetricsDTO.class)
                .ttl(Duration.ofSeconds(ttl.getDashboard()))
                .build(),
            args -> dataSource().revenueMetrics(new DateRange(
                LocalDate.parse((String) args[0]), LocalDate.parse((String) args[1]), null)));

        this.productPerformance = entity(decorators,
            KeyStrategy.template(CacheKeys.PRODUCT_PERFORMANCE, "product_id", "period"),
            ttl.getProduct(), (id, period) -> dataSource().productPerformance(id, period));
        this.customerMetrics = entity(decorators,
            KeyStrategy.template(CacheKeys.CUSTOMER_METRICS, "customer_id", "period"),
            ttl.getCustomer(), (id, period) -> dataSource().customerMetrics(id, period));
        this.salesRepPerformance = entity(decorators,
            KeyStrategy.template(CacheKeys.SALES_REP_PERFORMANCE, "sales_rep_id", "period"),
            ttl.getSalesRep(), (id, period) -> dataSource().salesRepPerformance(id, period));
        this.categoryPerformance = entity(decorators,
            KeyStrategy.template(CacheKeys.CATEGORY_PERFORMANCE, "category_id", "period"),
            ttl.getProduct(), (id, period) -> dataSource().categoryPerformance(id, period));

        // 当天趋势仍在变化，不缓存
        this.revenueTrend = decorators.conditionalCache(
            CachePolicy.forType(new TypeReference<List<TrendPointDTO>>() {})
                .keyStrategy(KeyStrategy.template(CacheKeys.REVENUE_TRENDS, "period"))
                .ttl(Duration.ofSeconds(ttl.getTrend()))
                .build(),
            args -> !TODAY.equalsIgnoreCase(String.valueOf(args[0])),
            args -> dataSource().revenueTrend((String) args[0]));

        this.realtimeMetrics = decorators.cached(
            CachePolicy.forType(RealtimeMetricsDTO.class)
                .keyStrategy(KeyStrategy.template(CacheKeys.REALTIME_METRICS))
                .ttl(Duration.ofSeconds(ttl.getRealtime()))
                .build(),
            args -> dataSource().realtimeMetrics());

        this.topProducts = decorators.cacheListResult(
            CachePolicy.forType(new TypeReference<List<TopProductDTO>>() {})
                .keyStrategy(KeyStrategy.template(CacheKeys.TOP_PRODUCTS, "limit", "period"))
                .ttl(Duration.ofSeconds(ttl.getProduct()))
                .build(),
            properties.getCache().getTopProductsMaxItems(),
            args -> dataSource().topProducts((String) args[1], (Integer) args[0]));
    }

    public DashboardOverviewDTO getDashboardOverview(String dateRange) {
        return dashboardOverview.compute(dateRange);
    }

    public RevenueMetricsDTO getRevenueMetrics(LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("End date " + end + " is before start date " + start);
        }
        return revenueMetrics.compute(start.toString(), end.toString());
    }

    public EntityPerformanceDTO getProductPerformance(String productId, String period) {
        return productPerformance.compute(productId, period);
    }

    public EntityPerformanceDTO getCustomerMetrics(String customerId, String period) {
        return customerMetrics.compute(customerId, period);
    }

    public EntityPerformanceDTO getSalesRepPerformance(String salesRepId, String period) {
        return salesRepPerformance.compute(salesRepId, period);
    }

    public EntityPerformanceDTO getCategoryPerformance(String categoryId, String period) {
        return categoryPerformance.compute(categoryId, period);
    }

    public List<TrendPointDTO> getRevenueTrend(String period) {
        return revenueTrend.compute(period);
    }

    public RealtimeMetricsDTO getRealtimeMetrics() {
        return realtimeMetrics.compute();
    }

    public List<TopProductDTO> getTopProducts(String period, int limit) {
        return topProducts.compute(limit, period);
    }

    /**
     * 宿主是否提供了数据源
     */
    public boolean isAvailable() {
        return dataSourceProvider.getIfAvailable() != null;
    }

    private AnalyticsDataSource dataSource() {
        return dataSourceProvider.getObject();
    }

    private static Computation<EntityPerformanceDTO> entity(CacheDecorators decorators,
                                                            KeyStrategy keyStrategy, long ttlSeconds,
                                                            BiFunction<String, String, EntityPerformanceDTO> loader) {
        return decorators.cached(
            CachePolicy.forType(EntityPerformanceDTO.class)
                .keyStrategy(keyStrategy)
                .ttl(Duration.ofSeconds(ttlSeconds))
                .build(),
            args -> loader.apply(String.valueOf(args[0]), String.valueOf(args[1])));
    }
}

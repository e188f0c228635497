package com.ecommerce.analytics.invalidation;

import com.ecommerce.analytics.cache.RemoteCacheClient;
import com.ecommerce.analytics.cache.key.KeyTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static com.ecommerce.analytics.cache.key.CacheKeys.*;

/**
 * 缓存依赖失效服务
 * 写操作提交成功后由业务方同步调用对应的 on* 钩子，按业务域批量删除受影响的缓存
 *
 * <p>单域方法的 id 为 null 时删除该域全部实体缓存及其聚合（Top 榜单、分群、留存等）。
 */
@Service
public class CacheInvalidationService {

    private static final Logger log = LoggerFactory.getLogger(CacheInvalidationService.class);

    private final RemoteCacheClient cacheClient;

    public CacheInvalidationService(RemoteCacheClient cacheClient) {
        this.cacheClient = cacheClient;
    }

    // ========== 单域失效 ==========

    /**
     * 仪表盘总览及其派生视图（销售总览、利润、毛利分析）
     */
    public long invalidateDashboard() {
        return deleteAll(List.of(
            DASHBOARD_OVERVIEW.wildcard(),
            SALES_OVERVIEW.wildcard(),
            PROFITABILITY.wildcard(),
            MARGIN_ANALYSIS.wildcard()
        ));
    }

    public long invalidateProduct(@Nullable Object productId) {
        return invalidateEntity(PRODUCT_PERFORMANCE, "product_id", productId,
            PRODUCT_INSIGHTS, TOP_PRODUCTS);
    }

    public long invalidateCustomer(@Nullable Object customerId) {
        return invalidateEntity(CUSTOMER_METRICS, "customer_id", customerId,
            CUSTOMER_SEGMENTS, CUSTOMER_RETENTION, TOP_CUSTOMERS);
    }

    public long invalidateSalesRep(@Nullable Object salesRepId) {
        return invalidateEntity(SALES_REP_PERFORMANCE, "sales_rep_id", salesRepId,
            TOP_SALES_REPS);
    }

    public long invalidateCategory(@Nullable Object categoryId) {
        return invalidateEntity(CATEGORY_PERFORMANCE, "category_id", categoryId,
            CATEGORY_BREAKDOWN);
    }

    public long invalidateTrends() {
        return deleteAll(List.of(
            REVENUE_TRENDS.wildcard(),
            PROFIT_TRENDS.wildcard(),
            ORDER_TRENDS.wildcard()
        ));
    }

    public long invalidateRealtime() {
        return deleteAll(List.of(REALTIME_METRICS.wildcard()));
    }

    // ========== 业务事件钩子 ==========

    public long onOrderCreated(Object orderId, @Nullable Object customerId) {
        long removed = invalidateDashboard()
            + invalidateCustomer(customerId)
            + invalidateTrends()
            + invalidateRealtime();
        log.info("Order created, invalidated {} cache keys: orderId={}, customerId={}",
            removed, orderId, customerId);
        return removed;
    }

    /**
     * 状态未变化时只刷新实时指标
     */
    public long onOrderUpdated(Object orderId, @Nullable Object customerId, boolean statusChanged) {
        long removed = 0;
        if (statusChanged) {
            removed += invalidateDashboard()
                + invalidateCustomer(customerId)
                + invalidateTrends();
        }
        removed += invalidateRealtime();
        log.info("Order updated, invalidated {} cache keys: orderId={}, statusChanged={}",
            removed, orderId, statusChanged);
        return removed;
    }

    public long onProductUpdated(Object productId, @Nullable Object categoryId) {
        long removed = invalidateProduct(productId)
            + invalidateCategory(categoryId)
            + invalidateDashboard();
        log.info("Product updated, invalidated {} cache keys: productId={}", removed, productId);
        return removed;
    }

    public long onCustomerUpdated(Object customerId) {
        long removed = invalidateCustomer(customerId) + invalidateDashboard();
        log.info("Customer updated, invalidated {} cache keys: customerId={}", removed, customerId);
        return removed;
    }

    public long onSalesRepUpdated(Object salesRepId) {
        long removed = invalidateSalesRep(salesRepId) + invalidateDashboard();
        log.info("Sales rep updated, invalidated {} cache keys: salesRepId={}", removed, salesRepId);
        return removed;
    }

    /**
     * 物化视图刷新后所有分析结果都可能变化
     */
    public long onMaterializedViewRefreshed(String viewName) {
        long removed = invalidateDashboard()
            + invalidateProduct(null)
            + invalidateCustomer(null)
            + invalidateSalesRep(null)
            + invalidateCategory(null)
            + invalidateTrends();
        log.info("Materialized view {} refreshed, invalidated {} cache keys", viewName, removed);
        return removed;
    }

    /**
     * 清空整个 analytics 命名空间，仅供运维全量刷新使用
     */
    public long clearAll() {
        long removed = cacheClient.clearNamespace();
        log.warn("All analytics cache cleared, {} keys removed", removed);
        return removed;
    }

    private long invalidateEntity(KeyTemplate template, String idName, @Nullable Object id,
                                  KeyTemplate... aggregates) {
        List<String> patterns = new ArrayList<>();
        if (id == null) {
            patterns.add(template.wildcard());
            for (KeyTemplate aggregate : aggregates) {
                patterns.add(aggregate.wildcard());
            }
        } else {
            patterns.add(template.pattern(idName, id));
        }
        return deleteAll(patterns);
    }

    private long deleteAll(List<String> patterns) {
        long removed = 0;
        for (String pattern : patterns) {
            removed += cacheClient.deletePattern(pattern);
        }
        return removed;
    }
}

package com.ecommerce.analytics.cache.key;

import java.util.List;

/**
 * 分析服务缓存 Key 目录
 * 任意模板的固定前缀都不会被其他模板的通配模式匹配
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static final String NAMESPACE = "analytics";

    // ========== 仪表盘 ==========
    public static final KeyTemplate DASHBOARD_OVERVIEW = KeyTemplate.of("analytics:dashboard:overview:{date_range}");
    public static final KeyTemplate REALTIME_METRICS = KeyTemplate.of("analytics:realtime_metrics");
    public static final KeyTemplate SALES_OVERVIEW = KeyTemplate.of("analytics:sales_overview:{date_range}");
    public static final KeyTemplate PROFITABILITY = KeyTemplate.of("analytics:profitability:{period}");
    public static final KeyTemplate MARGIN_ANALYSIS = KeyTemplate.of("analytics:margin:{group_by}:{period}");

    // ========== 商品 ==========
    public static final KeyTemplate PRODUCT_PERFORMANCE = KeyTemplate.of("analytics:product:{product_id}:{period}");
    public static final KeyTemplate PRODUCT_INSIGHTS = KeyTemplate.of("analytics:product_insights:{period}:{sort}");
    public static final KeyTemplate TOP_PRODUCTS = KeyTemplate.of("analytics:top_products:{limit}:{period}");

    // ========== 品类 ==========
    public static final KeyTemplate CATEGORY_PERFORMANCE = KeyTemplate.of("analytics:category:{category_id}:{period}");
    public static final KeyTemplate CATEGORY_BREAKDOWN = KeyTemplate.of("analytics:category_breakdown:{period}");

    // ========== 客户 ==========
    public static final KeyTemplate CUSTOMER_METRICS = KeyTemplate.of("analytics:customer:{customer_id}:{period}");
    public static final KeyTemplate CUSTOMER_SEGMENTS = KeyTemplate.of("analytics:customer_segments");
    public static final KeyTemplate CUSTOMER_RETENTION = KeyTemplate.of("analytics:customer_retention:{period}");
    public static final KeyTemplate TOP_CUSTOMERS = KeyTemplate.of("analytics:top_customers:{limit}:{period}");

    // ========== 销售代表 ==========
    public static final KeyTemplate SALES_REP_PERFORMANCE = KeyTemplate.of("analytics:sales_rep:{sales_rep_id}:{period}");
    public static final KeyTemplate TOP_SALES_REPS = KeyTemplate.of("analytics:top_sales_reps:{limit}:{period}");

    // ========== 趋势 ==========
    public static final KeyTemplate REVENUE_TRENDS = KeyTemplate.of("analytics:revenue_trends:{period}");
    public static final KeyTemplate PROFIT_TRENDS = KeyTemplate.of("analytics:profit_trends:{period}");
    public static final KeyTemplate ORDER_TRENDS = KeyTemplate.of("analytics:order_trends:{period}");

    /** 自动派生 Key 前缀（参数哈希） */
    public static final String MEMO_PREFIX = NAMESPACE + ":memo";

    /** 整个命名空间 */
    public static final String NAMESPACE_PATTERN = NAMESPACE + ":*";

    private static final List<KeyTemplate> ALL = List.of(
        DASHBOARD_OVERVIEW, REALTIME_METRICS, SALES_OVERVIEW, PROFITABILITY, MARGIN_ANALYSIS,
        PRODUCT_PERFORMANCE, PRODUCT_INSIGHTS, TOP_PRODUCTS,
        CATEGORY_PERFORMANCE, CATEGORY_BREAKDOWN,
        CUSTOMER_METRICS, CUSTOMER_SEGMENTS, CUSTOMER_RETENTION, TOP_CUSTOMERS,
        SALES_REP_PERFORMANCE, TOP_SALES_REPS,
        REVENUE_TRENDS, PROFIT_TRENDS, ORDER_TRENDS
    );

    public static List<KeyTemplate> all() {
        return ALL;
    }
}

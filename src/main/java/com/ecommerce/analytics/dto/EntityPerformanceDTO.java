package com.ecommerce.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 单个商品 / 客户 / 销售代表 / 品类在某周期内的表现
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityPerformanceDTO {

    /** product / customer / sales_rep / category */
    private String entityType;
    private String entityId;
    private String name;
    private String period;
    private long totalOrders;
    private BigDecimal totalRevenue;
    private BigDecimal totalProfit;
    private double profitMarginPercentage;
}

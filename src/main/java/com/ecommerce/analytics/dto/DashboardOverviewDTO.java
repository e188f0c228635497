package com.ecommerce.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 仪表盘总览
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardOverviewDTO {

    private String dateRange;
    private BigDecimal totalRevenue;
    private BigDecimal totalProfit;
    private double profitMarginPercentage;
    private long totalOrders;
    private long completedOrders;
    private BigDecimal avgOrderValue;
    private long activeCustomers;
    private Instant generatedAt;
}

package com.ecommerce.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 收入指标
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevenueMetricsDTO {

    private LocalDate startDate;
    private LocalDate endDate;
    private BigDecimal totalRevenue;
    private BigDecimal totalProfit;
    private double profitMarginPercentage;
}

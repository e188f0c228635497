package com.ecommerce.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 实时指标（最近一小时）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeMetricsDTO {

    private long ordersLastHour;
    private BigDecimal revenueLastHour;
    private long activeCustomers;
    private long pendingOrders;
    private Instant timestamp;
}

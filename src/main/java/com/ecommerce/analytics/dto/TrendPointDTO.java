package com.ecommerce.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 趋势图单日数据点
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendPointDTO {

    private LocalDate date;
    private BigDecimal revenue;
    private BigDecimal profit;
    private long orders;
}

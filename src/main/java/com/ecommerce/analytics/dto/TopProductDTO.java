package com.ecommerce.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopProductDTO {

    private Long productId;
    private String productName;
    private String categoryName;
    private long timesSold;
    private BigDecimal totalRevenue;
    private BigDecimal totalProfit;
}

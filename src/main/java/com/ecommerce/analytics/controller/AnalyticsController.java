package com.ecommerce.analytics.controller;

import com.ecommerce.analytics.dto.ApiResponse;
import com.ecommerce.analytics.dto.DashboardOverviewDTO;
import com.ecommerce.analytics.dto.EntityPerformanceDTO;
import com.ecommerce.analytics.dto.RealtimeMetricsDTO;
import com.ecommerce.analytics.dto.RevenueMetricsDTO;
import com.ecommerce.analytics.dto.TopProductDTO;
import com.ecommerce.analytics.dto.TrendPointDTO;
import com.ecommerce.analytics.service.AnalyticsQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * 分析看板查询 API
 */
@Tag(name = "Analytics", description = "销售分析看板查询API")
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsQueryService queryService;

    @Operation(summary = "获取仪表盘总览", description = "range 取值 today 或 Nd，如 7d、30d")
    @GetMapping("/dashboard/overview")
    public ApiResponse<DashboardOverviewDTO> dashboardOverview(@RequestParam(defaultValue = "30d") String range) {
        return ApiResponse.success(queryService.getDashboardOverview(range));
    }

    @Operation(summary = "按起止日期获取收入指标")
    @GetMapping("/revenue")
    public ApiResponse<RevenueMetricsDTO> revenue(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return ApiResponse.success(queryService.getRevenueMetrics(start, end));
    }

    @Operation(summary = "获取商品表现")
    @GetMapping("/products/{productId}")
    public ApiResponse<EntityPerformanceDTO> product(@PathVariable String productId,
                                                     @RequestParam(defaultValue = "30d") String period) {
        return ApiResponse.success(queryService.getProductPerformance(productId, period));
    }

    @Operation(summary = "获取客户指标")
    @GetMapping("/customers/{customerId}")
    public ApiResponse<EntityPerformanceDTO> customer(@PathVariable String customerId,
                                                      @RequestParam(defaultValue = "30d") String period) {
        return ApiResponse.success(queryService.getCustomerMetrics(customerId, period));
    }

    @Operation(summary = "获取销售代表业绩")
    @GetMapping("/sales-reps/{salesRepId}")
    public ApiResponse<EntityPerformanceDTO> salesRep(@PathVariable String salesRepId,
                                                      @RequestParam(defaultValue = "30d") String period) {
        return ApiResponse.success(queryService.getSalesRepPerformance(salesRepId, period));
    }

    @Operation(summary = "获取品类表现")
    @GetMapping("/categories/{categoryId}")
    public ApiResponse<EntityPerformanceDTO> category(@PathVariable String categoryId,
                                                      @RequestParam(defaultValue = "30d") String period) {
        return ApiResponse.success(queryService.getCategoryPerformance(categoryId, period));
    }

    @Operation(summary = "获取收入趋势", description = "当天趋势不走缓存")
    @GetMapping("/trends/revenue")
    public ApiResponse<List<TrendPointDTO>> revenueTrend(@RequestParam(defaultValue = "30d") String period) {
        return ApiResponse.success(queryService.getRevenueTrend(period));
    }

    @Operation(summary = "获取最近一小时实时指标")
    @GetMapping("/realtime")
    public ApiResponse<RealtimeMetricsDTO> realtime() {
        return ApiResponse.success(queryService.getRealtimeMetrics());
    }

    @Operation(summary = "获取 Top 商品")
    @GetMapping("/products/top")
    public ApiResponse<List<TopProductDTO>> topProducts(@RequestParam(defaultValue = "30d") String period,
                                                        @RequestParam(defaultValue = "10") int limit) {
        return ApiResponse.success(queryService.getTopProducts(period, limit));
    }
}

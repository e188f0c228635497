package com.ecommerce.analytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分析服务缓存与限流配置属性类
 */
@Data
@Component
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    /** 缓存配置 */
    private Cache cache = new Cache();

    /** 限流配置 */
    private RateLimit rateLimit = new RateLimit();

    /** Redis 连接配置 */
    private Redis redis = new Redis();

    /** 监控配置 */
    private Monitor monitor = new Monitor();

    @Data
    public static class Cache {
        /** 各业务域 TTL */
        private Ttl ttl = new Ttl();
        /** 同 Key 并发未命中是否合并为一次计算 */
        private boolean singleFlight = true;
        /** Top 商品列表缓存的最大条数 */
        private int topProductsMaxItems = 50;
    }

    @Data
    public static class Ttl {
        /** 仪表盘（秒） */
        private long dashboard = 300;
        /** 商品（秒） */
        private long product = 600;
        /** 客户（秒） */
        private long customer = 600;
        /** 销售代表（秒） */
        private long salesRep = 600;
        /** 趋势（秒） */
        private long trend = 900;
        /** 实时指标（秒） */
        private long realtime = 60;
    }

    @Data
    public static class RateLimit {
        /** 是否开启限流 */
        private boolean enabled = true;
        /** 默认窗口内最大请求数 */
        private int defaultLimit = 100;
        /** 滑动窗口长度（秒） */
        private int windowSeconds = 60;
        /** 按路径覆盖的限额 */
        private Map<String, Integer> endpointLimits = new LinkedHashMap<>();
        /** 豁免路径前缀 */
        private List<String> exemptPaths = new ArrayList<>(List.of(
            "/docs", "/redoc", "/openapi.json", "/swagger-ui", "/v3/api-docs", "/actuator/health"));
        /** 过期窗口记录清理周期（秒） */
        private int cleanupIntervalSeconds = 60;

        public int limitFor(String endpoint) {
            return endpointLimits.getOrDefault(endpoint, defaultLimit);
        }

        public boolean isExempt(String path) {
            return exemptPaths.stream().anyMatch(path::startsWith);
        }

        public Duration window() {
            return Duration.ofSeconds(windowSeconds);
        }
    }

    @Data
    public static class Redis {
        /** 连接池最大连接数 */
        private int maxConnections = 50;
        /** 连接池最小空闲连接数 */
        private int minIdle = 5;
        /** 命令超时，超时按未命中处理 */
        private Duration commandTimeout = Duration.ofMillis(500);
    }

    @Data
    public static class Monitor {
        /** 命中率告警阈值 */
        private double hitRateThreshold = 0.7;
    }
}

package com.ecommerce.analytics.ratelimit;

/**
 * 限流判定结果
 *
 * @param allowed      是否放行
 * @param currentCount 窗口内请求数（放行时包含本次）
 * @param resetSeconds 被拒绝时距离窗口腾出名额的秒数，放行时为 0
 */
public record RateLimitDecision(boolean allowed, int currentCount, long resetSeconds) {

    public static RateLimitDecision admitted(int currentCount) {
        return new RateLimitDecision(true, currentCount, 0);
    }

    public static RateLimitDecision rejected(int currentCount, long resetSeconds) {
        return new RateLimitDecision(false, currentCount, resetSeconds);
    }
}

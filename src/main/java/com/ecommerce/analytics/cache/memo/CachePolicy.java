package com.ecommerce.analytics.cache.memo;

import com.ecommerce.analytics.cache.key.KeyStrategy;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.Builder;
import lombok.Getter;

import java.lang.reflect.Type;
import java.time.Duration;

/**
 * 缓存策略：结果类型、Key 策略、TTL、是否合并并发未命中
 */
@Getter
@Builder(toBuilder = true)
public class CachePolicy<R> {

    /** 缓存值反序列化目标类型 */
    private final Type resultType;

    /** Key 策略，自动派生 Key 的装饰器可为空 */
    private final KeyStrategy keyStrategy;

    /** 为空表示永不过期 */
    private final Duration ttl;

    @Builder.Default
    private final boolean singleFlight = true;

    public static <R> CachePolicyBuilder<R> forType(Class<R> type) {
        return CachePolicy.<R>builder().resultType(type);
    }

    public static <R> CachePolicyBuilder<R> forType(TypeReference<R> type) {
        return CachePolicy.<R>builder().resultType(type.getType());
    }
}

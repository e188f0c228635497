package com.ecommerce.analytics.cache.memo;

/**
 * 可被缓存装饰的计算
 */
@FunctionalInterface
public interface Computation<R> {

    R compute(Object... args);
}

package com.ecommerce.analytics.cache.memo;

/**
 * 当前线程跳过缓存读取（强制刷新），计算结果仍会写回
 * <pre>
 * try (CacheBypass ignored = CacheBypass.open()) {
 *     overview.compute("7d");
 * }
 * </pre>
 */
public final class CacheBypass implements AutoCloseable {

    private static final ThreadLocal<int[]> DEPTH = ThreadLocal.withInitial(() -> new int[1]);

    private boolean closed;

    private CacheBypass() {
        DEPTH.get()[0]++;
    }

    public static CacheBypass open() {
        return new CacheBypass();
    }

    public static boolean isActive() {
        return DEPTH.get()[0] > 0;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        int[] depth = DEPTH.get();
        if (--depth[0] <= 0) {
            DEPTH.remove();
        }
    }
}

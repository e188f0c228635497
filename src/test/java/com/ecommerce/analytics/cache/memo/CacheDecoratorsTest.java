package com.ecommerce.analytics.cache.memo;

import com.ecommerce.analytics.cache.RemoteCacheClient;
import com.ecommerce.analytics.cache.key.CacheKeyGenerator;
import com.ecommerce.analytics.cache.key.CacheKeys;
import com.ecommerce.analytics.cache.key.KeyFormatException;
import com.ecommerce.analytics.cache.key.KeyStrategy;
import com.ecommerce.analytics.config.AnalyticsProperties;
import com.ecommerce.analytics.support.InMemoryCacheClient;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * 缓存装饰器单元测试
 */
class CacheDecoratorsTest {

    private InMemoryCacheClient cache;
    private CacheDecorators decorators;
    private AtomicInteger calls;

    private final CachePolicy<String> productPolicy = CachePolicy.forType(String.class)
        .keyStrategy(KeyStrategy.template(CacheKeys.PRODUCT_PERFORMANCE, "product_id", "period"))
        .ttl(Duration.ofSeconds(600))
        .build();

    @BeforeEach
    void setUp() {
        cache = new InMemoryCacheClient();
        decorators = newDecorators(cache.client(), true);
        calls = new AtomicInteger();
    }

    private static CacheDecorators newDecorators(RemoteCacheClient client, boolean singleFlight) {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getCache().setSingleFlight(singleFlight);
        return new CacheDecorators(client, new CacheKeyGenerator(new ObjectMapper()), properties);
    }

    @Test
    @DisplayName("同参数第二次调用命中缓存，只计算一次")
    void testCached_computesOncePerKey() {
        Computation<String> f = decorators.cached(productPolicy,
            args -> "perf-" + args[0] + "-" + calls.incrementAndGet());

        assertEquals("perf-42-1", f.compute(42, "daily"));
        assertEquals("perf-42-1", f.compute(42, "daily"));

        assertEquals(1, calls.get());
        assertTrue(cache.contains("analytics:product:42:daily"));
        assertEquals(Duration.ofSeconds(600), cache.ttl("analytics:product:42:daily"));
    }

    @Test
    @DisplayName("不同参数各自计算、各自缓存")
    void testCached_distinctArgs() {
        Computation<String> f = decorators.cached(productPolicy, args -> "v" + calls.incrementAndGet());

        f.compute(1, "daily");
        f.compute(2, "daily");
        f.compute(1, "weekly");

        assertEquals(3, calls.get());
        assertEquals(3, cache.size());
    }

    @Test
    @DisplayName("缺少 Key 参数 - KeyFormatException 透传，不调用计算")
    void testCached_keyFormatError() {
        Computation<String> f = decorators.cached(productPolicy, args -> "v" + calls.incrementAndGet());

        assertThrows(KeyFormatException.class, () -> f.compute(42));
        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("计算异常原样透传，不写缓存")
    void testCached_exceptionPropagates() {
        IllegalStateException boom = new IllegalStateException("db down");
        Computation<String> f = decorators.cached(productPolicy, args -> {
            calls.incrementAndGet();
            throw boom;
        });

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> f.compute(42, "daily"));
        assertSame(boom, thrown);
        assertEquals(0, cache.size());
        assertEquals(0, decorators.inFlightCount());
    }

    @Test
    @DisplayName("null 结果返回但不写缓存，下次仍会计算")
    void testCached_nullNotStored() {
        Computation<String> f = decorators.cached(productPolicy, args -> {
            calls.incrementAndGet();
            return null;
        });

        assertNull(f.compute(42, "daily"));
        assertNull(f.compute(42, "daily"));
        assertEquals(2, calls.get());
        assertEquals(0, cache.writes());
    }

    @Test
    @DisplayName("自动派生 Key - 相同参数值得到相同 Key，位于 analytics:memo 下")
    void testCacheResult_autoKey() {
        Computation<Integer> f = decorators.cacheResult("revenue_metrics",
            CachePolicy.forType(Integer.class).ttl(Duration.ofSeconds(300)).build(),
            args -> calls.incrementAndGet());

        assertEquals(1, f.compute("2024-01-01", "2024-01-31"));
        assertEquals(1, f.compute("2024-01-01", "2024-01-31"));
        assertEquals(2, f.compute("2024-02-01", "2024-02-29"));

        assertEquals(2, cache.size());
        assertTrue(cache.entries().keySet().stream()
            .allMatch(k -> k.matches("analytics:memo:revenue_metrics:[0-9a-f]{32}")));
    }

    @Test
    @DisplayName("列表结果超过上限 - 返回与写入的都是截断后的列表")
    void testCacheListResult_truncates() {
        CachePolicy<List<Integer>> policy = CachePolicy.forType(new TypeReference<List<Integer>>() {})
            .keyStrategy(KeyStrategy.template(CacheKeys.TOP_PRODUCTS, "limit", "period"))
            .build();
        Computation<List<Integer>> f = decorators.cacheListResult(policy, 3,
            args -> IntStream.rangeClosed(1, 10).boxed().collect(Collectors.toList()));

        List<Integer> result = f.compute(10, "7d");

        assertEquals(List.of(1, 2, 3), result);
        assertEquals(List.of(1, 2, 3), cache.value("analytics:top_products:10:7d"));
    }

    @Test
    @DisplayName("列表未超过上限 - 原样返回")
    void testCacheListResult_shortList() {
        Computation<List<Integer>> f = decorators.cacheListResult("top",
            CachePolicy.forType(new TypeReference<List<Integer>>() {}).build(), 5,
            args -> List.of(1, 2));

        assertEquals(List.of(1, 2), f.compute("7d"));
    }

    @Test
    @DisplayName("条件不满足时直接计算，不读不写缓存")
    void testConditionalCache() {
        Computation<String> f = decorators.conditionalCache(
            CachePolicy.forType(String.class)
                .keyStrategy(KeyStrategy.template(CacheKeys.REVENUE_TRENDS, "period"))
                .build(),
            args -> !"today".equals(args[0]),
            args -> "trend-" + calls.incrementAndGet());

        f.compute("today");
        f.compute("today");
        assertEquals(2, calls.get());
        assertFalse(cache.contains("analytics:revenue_trends:today"));

        f.compute("7d");
        f.compute("7d");
        assertEquals(3, calls.get());
        assertTrue(cache.contains("analytics:revenue_trends:7d"));
    }

    @Test
    @DisplayName("写操作成功后按模式失效")
    void testInvalidateOnChange_success() {
        cache.put("analytics:product:1:daily", "a");
        cache.put("analytics:product:1:weekly", "b");
        cache.put("analytics:product:2:daily", "c");

        Computation<String> update = decorators.invalidateOnChange(
            args -> List.of(CacheKeys.PRODUCT_PERFORMANCE.pattern("product_id", args[0])),
            args -> "updated");

        assertEquals("updated", update.compute(1));
        assertFalse(cache.contains("analytics:product:1:daily"));
        assertFalse(cache.contains("analytics:product:1:weekly"));
        assertTrue(cache.contains("analytics:product:2:daily"));
    }

    @Test
    @DisplayName("写操作失败 - 不执行失效")
    void testInvalidateOnChange_failure() {
        cache.put("analytics:dashboard:overview:7d", "a");
        Computation<String> update = decorators.invalidateOnChange(
            List.of(CacheKeys.DASHBOARD_OVERVIEW.wildcard()),
            args -> {
                throw new IllegalStateException("rollback");
            });

        assertThrows(IllegalStateException.class, () -> update.compute());
        assertTrue(cache.contains("analytics:dashboard:overview:7d"));
        verify(cache.client(), never()).deletePattern(anyString());
    }

    @Test
    @DisplayName("Redis 不可用 - 每次都计算，结果正常返回")
    void testDisconnectedClient_alwaysComputes() {
        RemoteCacheClient client = mock(RemoteCacheClient.class);
        when(client.get(anyString(), any(Type.class))).thenReturn(null);
        when(client.set(anyString(), any(), any())).thenReturn(false);
        CacheDecorators offline = newDecorators(client, true);

        Computation<String> f = offline.cached(productPolicy, args -> "v" + calls.incrementAndGet());

        assertEquals("v1", f.compute(42, "daily"));
        assertEquals("v2", f.compute(42, "daily"));
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("CacheBypass 作用域内跳过读取并刷新缓存")
    void testBypass_forcesRefresh() {
        Computation<String> f = decorators.cached(productPolicy, args -> "v" + calls.incrementAndGet());
        f.compute(42, "daily");

        try (CacheBypass ignored = CacheBypass.open()) {
            assertTrue(CacheBypass.isActive());
            assertEquals("v2", f.compute(42, "daily"));
        }

        assertFalse(CacheBypass.isActive());
        assertEquals("v2", f.compute(42, "daily"));
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("并发未命中同一 Key - 只计算一次，所有调用方拿到同一结果")
    void testSingleFlight_dedupesConcurrentMisses() throws Exception {
        int threads = 8;
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Computation<String> f = decorators.cached(productPolicy, args -> {
            calls.incrementAndGet();
            started.countDown();
            try {
                assertTrue(release.await(5, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "shared";
        });

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<String>> futures = new ArrayList<>();
            futures.add(executor.submit(() -> f.compute(42, "daily")));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            for (int i = 1; i < threads; i++) {
                futures.add(executor.submit(() -> f.compute(42, "daily")));
            }
            // 让其余线程进入等待，晚到的线程会直接命中缓存
            Thread.sleep(100);
            release.countDown();

            for (Future<String> future : futures) {
                assertEquals("shared", future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, calls.get());
        assertEquals(0, decorators.inFlightCount());
    }

    @Test
    @DisplayName("关闭合并后并发未命中各自计算")
    void testSingleFlight_disabledPerPolicy() {
        CachePolicy<String> policy = productPolicy.toBuilder().singleFlight(false).build();
        Computation<String> f = decorators.cached(policy, args -> "v" + calls.incrementAndGet());

        assertEquals("v1", f.compute(7, "daily"));
        assertFalse(policy.isSingleFlight());
        assertEquals(0, decorators.inFlightCount());
    }
}

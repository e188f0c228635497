package com.ecommerce.analytics.cache.memo;

import com.ecommerce.analytics.cache.RemoteCacheClient;
import com.ecommerce.analytics.cache.key.CacheKeyGenerator;
import com.ecommerce.analytics.cache.key.CacheKeys;
import com.ecommerce.analytics.cache.key.KeyStrategy;
import com.ecommerce.analytics.config.AnalyticsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 缓存旁路装饰器
 * 每个装饰结果本身也是 {@link Computation}，可以继续组合
 *
 * <p>Redis 不可用时装饰器退化为直接计算；计算抛出的异常原样透传，失败结果不缓存。
 */
@Component
public class CacheDecorators {

    private static final Logger log = LoggerFactory.getLogger(CacheDecorators.class);

    private final RemoteCacheClient cacheClient;
    private final CacheKeyGenerator keyGenerator;
    private final boolean singleFlightEnabled;

    // 同 Key 正在进行的计算
    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    public CacheDecorators(RemoteCacheClient cacheClient,
                           CacheKeyGenerator keyGenerator,
                           AnalyticsProperties properties) {
        this.cacheClient = cacheClient;
        this.keyGenerator = keyGenerator;
        this.singleFlightEnabled = properties.getCache().isSingleFlight();
    }

    /**
     * 按策略中的 Key 策略缓存
     */
    public <R> Computation<R> cached(CachePolicy<R> policy, Computation<R> f) {
        KeyStrategy strategy = Objects.requireNonNull(policy.getKeyStrategy(), "policy.keyStrategy");
        return args -> memoize(strategy.keyFor(args), policy, f, args);
    }

    /**
     * 策略未指定 Key 策略时，按参数哈希派生 keyPrefix:md5
     */
    public <R> Computation<R> cached(String keyPrefix, CachePolicy<R> policy, Computation<R> f) {
        return cached(withDefaultKey(keyPrefix, policy), f);
    }

    /**
     * 自动派生 Key：analytics:memo:{identity}:{md5}
     */
    public <R> Computation<R> cacheResult(String identity, CachePolicy<R> policy, Computation<R> f) {
        return cached(memoPrefix(identity), policy, f);
    }

    /**
     * 列表结果超过 maxItems 时截断，写入与返回的都是截断后的列表
     */
    public <E> Computation<List<E>> cacheListResult(CachePolicy<List<E>> policy, int maxItems,
                                                    Computation<List<E>> f) {
        return cached(policy, truncating(maxItems, f));
    }

    public <E> Computation<List<E>> cacheListResult(String identity, CachePolicy<List<E>> policy, int maxItems,
                                                    Computation<List<E>> f) {
        return cached(withDefaultKey(memoPrefix(identity), policy), truncating(maxItems, f));
    }

    /**
     * 条件不满足时直接计算，不读不写缓存
     */
    public <R> Computation<R> conditionalCache(CachePolicy<R> policy, Predicate<Object[]> condition,
                                               Computation<R> f) {
        Computation<R> cachedF = cached(policy, f);
        return args -> condition.test(args) ? cachedF.compute(args) : f.compute(args);
    }

    public <R> Computation<R> conditionalCache(String identity, CachePolicy<R> policy,
                                               Predicate<Object[]> condition, Computation<R> f) {
        return conditionalCache(withDefaultKey(memoPrefix(identity), policy), condition, f);
    }

    /**
     * 计算成功后删除给定模式的缓存；计算抛异常时不删除
     */
    public <R> Computation<R> invalidateOnChange(List<String> patterns, Computation<R> f) {
        List<String> fixed = List.copyOf(patterns);
        return invalidateOnChange(args -> fixed, f);
    }

    /**
     * 失效模式依赖调用参数
     */
    public <R> Computation<R> invalidateOnChange(Function<Object[], ? extends Collection<String>> patterns,
                                                 Computation<R> f) {
        return args -> {
            R result = f.compute(args);
            long removed = 0;
            for (String pattern : patterns.apply(args)) {
                removed += cacheClient.deletePattern(pattern);
            }
            log.debug("Write completed, invalidated {} cache keys", removed);
            return result;
        };
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private <R> R memoize(String key, CachePolicy<R> policy, Computation<R> f, Object[] args) {
        if (CacheBypass.isActive()) {
            log.debug("Cache bypass active, recomputing: {}", key);
        } else {
            R cached = cacheClient.get(key, policy.getResultType());
            if (cached != null) {
                log.debug("Cache hit: {}", key);
                return cached;
            }
            log.debug("Cache miss: {}", key);
        }

        if (singleFlightEnabled && policy.isSingleFlight()) {
            return computeSingleFlight(key, policy, f, args);
        }
        return computeAndStore(key, policy, f, args);
    }

    private <R> R computeAndStore(String key, CachePolicy<R> policy, Computation<R> f, Object[] args) {
        R result = f.compute(args);
        // null 结果不写入，读取时与未命中无法区分
        if (result != null) {
            cacheClient.set(key, result, policy.getTtl());
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private <R> R computeSingleFlight(String key, CachePolicy<R> policy, Computation<R> f, Object[] args) {
        CompletableFuture<Object> created = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            log.debug("Joining in-flight computation: {}", key);
            return (R) await(existing);
        }

        try {
            R result = computeAndStore(key, policy, f, args);
            created.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            created.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, created);
        }
    }

    private static Object await(CompletableFuture<Object> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private <R> CachePolicy<R> withDefaultKey(String keyPrefix, CachePolicy<R> policy) {
        if (policy.getKeyStrategy() != null) {
            return policy;
        }
        return policy.toBuilder()
            .keyStrategy(KeyStrategy.hashed(keyPrefix, keyGenerator))
            .build();
    }

    private static String memoPrefix(String identity) {
        return CacheKeys.MEMO_PREFIX + ":" + identity;
    }

    private static <E> Computation<List<E>> truncating(int maxItems, Computation<List<E>> f) {
        return args -> {
            List<E> result = f.compute(args);
            if (result != null && maxItems > 0 && result.size() > maxItems) {
                return new ArrayList<>(result.subList(0, maxItems));
            }
            return result;
        };
    }
}

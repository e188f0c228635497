package com.ecommerce.analytics.cache;

import com.ecommerce.analytics.cache.key.CacheKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Redis 缓存客户端
 * 值以 JSON 文本存储；Redis 不可用、超时、熔断、编解码失败一律按未命中处理，不向调用方抛出
 */
@Service
public class RemoteCacheClient {

    private static final Logger log = LoggerFactory.getLogger(RemoteCacheClient.class);

    // SCAN 每批返回数量提示
    private static final long SCAN_BATCH = 500;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final CacheResilienceService resilienceService;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    private volatile boolean connected;

    public RemoteCacheClient(StringRedisTemplate redisTemplate,
                             ObjectMapper objectMapper,
                             CacheResilienceService resilienceService,
                             MeterRegistry meterRegistry) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.resilienceService = resilienceService;

        FunctionCounter.builder("analytics.cache.hits", hits, LongAdder::doubleValue)
            .description("Cache hits")
            .register(meterRegistry);
        FunctionCounter.builder("analytics.cache.misses", misses, LongAdder::doubleValue)
            .description("Cache misses")
            .register(meterRegistry);
        Gauge.builder("analytics.cache.hit_rate", this, c -> c.stats().hitRate())
            .description("Cache hit rate since last reset")
            .register(meterRegistry);
    }

    /**
     * 启动时探测 Redis，失败则保持断开状态，所有操作按未命中降级
     */
    @PostConstruct
    public void connect() {
        try {
            redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
            connected = true;
            log.info("Redis cache connected");
        } catch (Exception e) {
            connected = false;
            log.warn("Redis cache unavailable, running without cache: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void disconnect() {
        connected = false;
        log.info("Redis cache disconnected");
    }

    /**
     * 断开状态下重新探测
     */
    public boolean reconnectIfNeeded() {
        if (!connected) {
            connect();
        }
        return connected;
    }

    public boolean isConnected() {
        return connected;
    }

    // ========== 读 ==========

    public <T> T get(String key, Class<T> type) {
        return doGet(key, objectMapper.constructType(type));
    }

    public <T> T get(String key, TypeReference<T> type) {
        return doGet(key, objectMapper.constructType(type));
    }

    public <T> T get(String key, Type type) {
        return doGet(key, objectMapper.constructType(type));
    }

    private <T> T doGet(String key, JavaType type) {
        if (!connected) {
            misses.increment();
            return null;
        }

        String raw = resilienceService.executeRedisWithProtection(
            () -> redisTemplate.opsForValue().get(key),
            () -> null
        );
        if (raw == null) {
            misses.increment();
            return null;
        }

        try {
            T value = objectMapper.readValue(raw, type);
            if (value == null) {
                // JSON null 与未命中不可区分
                misses.increment();
                return null;
            }
            hits.increment();
            return value;
        } catch (JsonProcessingException e) {
            log.error("Cache value decode error, key: {}, type: {}", key, type, e);
            misses.increment();
            return null;
        }
    }

    /**
     * 异步获取缓存
     */
    public <T> CompletableFuture<T> getAsync(String key, Type type) {
        return CompletableFuture.supplyAsync(() -> get(key, type));
    }

    // ========== 写 ==========

    /**
     * 写入缓存，ttl 为空或非正数表示永不过期
     */
    public boolean set(String key, Object value, Duration ttl) {
        if (!connected) {
            return false;
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Cache value encode error, key: {}", key, e);
            return false;
        }

        return resilienceService.executeRedisWithProtection(() -> {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                redisTemplate.opsForValue().set(key, json);
            } else {
                redisTemplate.opsForValue().set(key, json, ttl);
            }
            return true;
        }, () -> false);
    }

    // ========== 删除 ==========

    public boolean delete(String key) {
        if (!connected) {
            return false;
        }
        return resilienceService.executeRedisWithProtection(
            () -> Boolean.TRUE.equals(redisTemplate.delete(key)),
            () -> false
        );
    }

    /**
     * 按 glob 模式删除：SCAN MATCH 收集后一次 DEL
     */
    public long deletePattern(String pattern) {
        if (!connected) {
            return 0;
        }

        long removed = resilienceService.executeRedisWithProtection(() -> {
            Set<String> keys = scanKeys(pattern);
            if (keys.isEmpty()) {
                return 0L;
            }
            Long count = redisTemplate.delete(keys);
            return count == null ? 0L : count;
        }, () -> 0L);

        if (removed > 0) {
            log.info("Deleted {} cache keys matching {}", removed, pattern);
        } else {
            log.debug("No cache keys matching {}", pattern);
        }
        return removed;
    }

    private Set<String> scanKeys(String pattern) {
        Set<String> keys = redisTemplate.execute((RedisCallback<Set<String>>) connection -> {
            Set<String> found = new LinkedHashSet<>();
            ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
            try (Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
                while (cursor.hasNext()) {
                    found.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            }
            return found;
        });
        return keys == null ? Set.of() : keys;
    }

    /**
     * 清空整个 analytics 命名空间（运维操作）
     */
    public long clearNamespace() {
        return deletePattern(CacheKeys.NAMESPACE_PATTERN);
    }

    // ========== 查询 ==========

    public boolean exists(String key) {
        if (!connected) {
            return false;
        }
        return resilienceService.executeRedisWithProtection(
            () -> Boolean.TRUE.equals(redisTemplate.hasKey(key)),
            () -> false
        );
    }

    /**
     * 剩余存活时间，Key 不存在或未设置过期返回 null
     */
    public Duration ttlRemaining(String key) {
        if (!connected) {
            return null;
        }
        Long seconds = resilienceService.executeRedisWithProtection(
            () -> redisTemplate.getExpire(key, TimeUnit.SECONDS),
            () -> null
        );
        if (seconds == null || seconds < 0) {
            return null;
        }
        return Duration.ofSeconds(seconds);
    }

    // ========== 统计 ==========

    public CacheStatistics stats() {
        long h = hits.sum();
        long m = misses.sum();
        long total = h + m;
        double hitRate = total == 0 ? 0.0 : (double) h / total;
        return new CacheStatistics(h, m, hitRate, connected);
    }

    public void resetStats() {
        hits.reset();
        misses.reset();
        log.info("Cache statistics reset");
    }

    /**
     * 缓存统计
     */
    public record CacheStatistics(
        long hits,
        long misses,
        double hitRate,
        boolean connected
    ) {
        public long totalRequests() {
            return hits + misses;
        }
    }
}

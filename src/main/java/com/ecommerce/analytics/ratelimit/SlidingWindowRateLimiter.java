package com.ecommerce.analytics.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存滑动窗口限流器，按 (客户端, 接口) 独立计数
 * 单个 Key 的 裁剪/判定/追加 在 ConcurrentHashMap.compute 内完成，并发下不会超发
 */
public class SlidingWindowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final Clock clock;
    private final long cleanupIntervalMillis;
    private final ConcurrentHashMap<WindowKey, WindowRecord> windows = new ConcurrentHashMap<>();
    private final AtomicLong lastCleanup;

    public SlidingWindowRateLimiter(Clock clock, Duration cleanupInterval) {
        this.clock = clock;
        this.cleanupIntervalMillis = cleanupInterval.toMillis();
        this.lastCleanup = new AtomicLong(clock.millis());
    }

    /**
     * 判定本次请求是否放行，放行时计入窗口
     */
    public RateLimitDecision isAllowed(String clientId, String endpoint, int limit, Duration window) {
        long now = clock.millis();
        maybeCleanup(now);

        long windowMillis = window.toMillis();
        RateLimitDecision[] decision = new RateLimitDecision[1];

        windows.compute(new WindowKey(clientId, endpoint), (key, existing) -> {
            WindowRecord record = existing != null ? existing : new WindowRecord();
            record.windowMillis = windowMillis;
            record.prune(now - windowMillis);

            int count = record.total;
            if (count >= limit) {
                decision[0] = RateLimitDecision.rejected(count, resetSeconds(record, now, windowMillis));
            } else {
                record.append(now);
                decision[0] = RateLimitDecision.admitted(count + 1);
            }
            return record.isEmpty() ? null : record;
        });

        return decision[0];
    }

    /**
     * 清理所有过期观测，删除空记录，返回删除的记录数
     */
    public int cleanup() {
        long now = clock.millis();
        int[] removed = new int[1];
        for (WindowKey key : windows.keySet()) {
            windows.computeIfPresent(key, (k, record) -> {
                record.prune(now - record.windowMillis);
                if (record.isEmpty()) {
                    removed[0]++;
                    return null;
                }
                return record;
            });
        }
        if (removed[0] > 0) {
            log.debug("Rate limiter cleanup removed {} idle windows, {} tracked", removed[0], windows.size());
        }
        return removed[0];
    }

    public int trackedCount() {
        return windows.size();
    }

    private void maybeCleanup(long now) {
        long last = lastCleanup.get();
        if (now - last >= cleanupIntervalMillis && lastCleanup.compareAndSet(last, now)) {
            cleanup();
        }
    }

    private static long resetSeconds(WindowRecord record, long now, long windowMillis) {
        long untilFree = record.isEmpty() ? windowMillis : record.oldest() + windowMillis - now;
        return Math.max(1, (untilFree + 999) / 1000);
    }

    private record WindowKey(String clientId, String endpoint) {}

    /**
     * 按时间顺序的 (时间戳, 次数) 观测，同一毫秒合并
     * 只在 compute 回调内访问
     */
    private static final class WindowRecord {

        private final Deque<long[]> observations = new ArrayDeque<>();
        private int total;
        private long windowMillis;

        void prune(long cutoff) {
            while (!observations.isEmpty() && observations.peekFirst()[0] <= cutoff) {
                total -= (int) observations.pollFirst()[1];
            }
        }

        void append(long timestamp) {
            long[] last = observations.peekLast();
            if (last != null && last[0] == timestamp) {
                last[1]++;
            } else {
                observations.addLast(new long[]{timestamp, 1});
            }
            total++;
        }

        long oldest() {
            return observations.peekFirst()[0];
        }

        boolean isEmpty() {
            return observations.isEmpty();
        }
    }
}

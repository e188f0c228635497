package com.ecommerce.analytics.cache;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Redis 调用熔断保护
 * 熔断打开期间直接走兜底（未命中 / false / 0），不再等待命令超时
 */
@Service
public class CacheResilienceService {

    private static final Logger log = LoggerFactory.getLogger(CacheResilienceService.class);

    public static final String REDIS_BREAKER = "redis";

    private static final float FAILURE_RATE_THRESHOLD = 50.0f;
    private static final int SLOW_CALL_RATE_THRESHOLD = 80;
    private static final Duration SLOW_CALL_DURATION_THRESHOLD = Duration.ofMillis(200);
    private static final int MINIMUM_CALLS = 10;
    private static final Duration WAIT_DURATION_IN_OPEN_STATE = Duration.ofSeconds(30);

    private final CircuitBreaker redisCircuitBreaker;

    public CacheResilienceService(MeterRegistry meterRegistry) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .failureRateThreshold(FAILURE_RATE_THRESHOLD)
            .slowCallRateThreshold(SLOW_CALL_RATE_THRESHOLD)
            .slowCallDurationThreshold(SLOW_CALL_DURATION_THRESHOLD)
            .minimumNumberOfCalls(MINIMUM_CALLS)
            .waitDurationInOpenState(WAIT_DURATION_IN_OPEN_STATE)
            .permittedNumberOfCallsInHalfOpenState(5)
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(100)
            .build();

        this.redisCircuitBreaker = CircuitBreakerRegistry.of(config).circuitBreaker(REDIS_BREAKER);

        redisCircuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Redis circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()));

        Gauge.builder("analytics.cache.circuit.state", redisCircuitBreaker, cb -> cb.getState().getOrder())
            .tag("name", REDIS_BREAKER)
            .description("Redis circuit breaker state (0=closed, 1=open, 2=half-open)")
            .register(meterRegistry);
    }

    /**
     * 带熔断保护的 Redis 调用，任何失败都返回兜底值
     */
    public <T> T executeRedisWithProtection(Supplier<T> action, Supplier<T> fallback) {
        try {
            return CircuitBreaker.decorateSupplier(redisCircuitBreaker, action).get();
        } catch (CallNotPermittedException e) {
            log.debug("Redis circuit open, skipping call");
            return fallback.get();
        } catch (Exception e) {
            log.warn("Redis operation failed, using fallback: {}", e.getMessage());
            return fallback.get();
        }
    }

    public CircuitBreaker.State getState() {
        return redisCircuitBreaker.getState();
    }

    public ResilienceStats getStats() {
        CircuitBreaker.Metrics metrics = redisCircuitBreaker.getMetrics();
        return new ResilienceStats(
            redisCircuitBreaker.getState().name(),
            metrics.getFailureRate(),
            metrics.getNumberOfFailedCalls(),
            metrics.getNumberOfNotPermittedCalls()
        );
    }

    /**
     * 熔断器统计
     */
    public record ResilienceStats(
        String state,
        float failureRate,
        int failedCalls,
        long notPermittedCalls
    ) {}
}

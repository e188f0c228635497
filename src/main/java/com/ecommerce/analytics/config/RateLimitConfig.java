package com.ecommerce.analytics.config;

import com.ecommerce.analytics.ratelimit.ClientIdentityResolver;
import com.ecommerce.analytics.ratelimit.RateLimitingFilter;
import com.ecommerce.analytics.ratelimit.SlidingWindowRateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import java.time.Clock;
import java.time.Duration;

/**
 * 限流组件装配
 */
@Configuration
public class RateLimitConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SlidingWindowRateLimiter slidingWindowRateLimiter(Clock clock,
                                                             AnalyticsProperties properties,
                                                             MeterRegistry meterRegistry) {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(clock,
            Duration.ofSeconds(properties.getRateLimit().getCleanupIntervalSeconds()));
        Gauge.builder("analytics.ratelimit.tracked", limiter, SlidingWindowRateLimiter::trackedCount)
            .description("Client/endpoint windows currently tracked")
            .register(meterRegistry);
        return limiter;
    }

    @Bean
    public ClientIdentityResolver clientIdentityResolver() {
        return new ClientIdentityResolver();
    }

    /**
     * 限流过滤器尽量靠前执行
     */
    @Bean
    public FilterRegistrationBean<RateLimitingFilter> rateLimitingFilter(SlidingWindowRateLimiter limiter,
                                                                         ClientIdentityResolver resolver,
                                                                         AnalyticsProperties properties,
                                                                         ObjectMapper objectMapper,
                                                                         Clock clock,
                                                                         MeterRegistry meterRegistry) {
        FilterRegistrationBean<RateLimitingFilter> registration = new FilterRegistrationBean<>(
            new RateLimitingFilter(limiter, resolver, properties, objectMapper, clock, meterRegistry));
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        registration.addUrlPatterns("/*");
        registration.setName("rateLimitingFilter");
        return registration;
    }
}

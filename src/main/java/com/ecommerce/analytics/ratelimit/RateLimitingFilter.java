package com.ecommerce.analytics.ratelimit;

import com.ecommerce.analytics.config.AnalyticsProperties;
import com.ecommerce.analytics.dto.ApiResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 接口限流过滤器
 * 超限时在过滤器层直接返回 429，不进入 Controller
 *
 * <p>通过 FilterRegistrationBean 注册，不声明为 @Component。
 */
@Slf4j
public class RateLimitingFilter extends OncePerRequestFilter {

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";
    public static final String HEADER_RETRY_AFTER = "Retry-After";

    private final SlidingWindowRateLimiter rateLimiter;
    private final ClientIdentityResolver identityResolver;
    private final AnalyticsProperties.RateLimit settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Counter rejectedCounter;

    public RateLimitingFilter(SlidingWindowRateLimiter rateLimiter,
                              ClientIdentityResolver identityResolver,
                              AnalyticsProperties properties,
                              ObjectMapper objectMapper,
                              Clock clock,
                              MeterRegistry meterRegistry) {
        this.rateLimiter = rateLimiter;
        this.identityResolver = identityResolver;
        this.settings = properties.getRateLimit();
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.rejectedCounter = Counter.builder("analytics.ratelimit.rejected")
            .description("Requests rejected by the rate limiter")
            .register(meterRegistry);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !settings.isEnabled() || settings.isExempt(endpointOf(request));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String endpoint = endpointOf(request);
        String clientId = identityResolver.resolve(request);
        int limit = settings.limitFor(endpoint);
        Duration window = settings.window();

        RateLimitDecision decision = rateLimiter.isAllowed(clientId, endpoint, limit, window);
        long nowSeconds = clock.instant().getEpochSecond();

        if (!decision.allowed()) {
            handleRateLimitExceeded(response, decision, limit, nowSeconds);
            log.debug("Rate limit exceeded: client={}, endpoint={}, count={}, retryAfter={}s",
                clientId, endpoint, decision.currentCount(), decision.resetSeconds());
            return;
        }

        response.setHeader(HEADER_LIMIT, String.valueOf(limit));
        response.setHeader(HEADER_REMAINING, String.valueOf(Math.max(0, limit - decision.currentCount())));
        response.setHeader(HEADER_RESET, String.valueOf(nowSeconds + window.getSeconds()));

        filterChain.doFilter(request, response);
    }

    private void handleRateLimitExceeded(HttpServletResponse response, RateLimitDecision decision,
                                         int limit, long nowSeconds) throws IOException {
        rejectedCounter.increment();

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.setHeader(HEADER_LIMIT, String.valueOf(limit));
        response.setHeader(HEADER_REMAINING, "0");
        response.setHeader(HEADER_RESET, String.valueOf(nowSeconds + decision.resetSeconds()));
        response.setHeader(HEADER_RETRY_AFTER, String.valueOf(decision.resetSeconds()));

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("retryAfter", decision.resetSeconds());
        detail.put("currentCount", decision.currentCount());
        detail.put("limit", limit);

        ApiResponse<Map<String, Object>> body = ApiResponse.tooManyRequests(
            "Rate limit exceeded. Try again in " + decision.resetSeconds() + " seconds.", detail);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }

    private static String endpointOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}

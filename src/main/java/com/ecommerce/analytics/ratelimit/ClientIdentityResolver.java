package com.ecommerce.analytics.ratelimit;

import jakarta.servlet.http.HttpServletRequest;

import java.security.Principal;

/**
 * 限流客户端标识解析
 * 优先级：登录用户 > API Key > X-Forwarded-For 首跳 > 连接地址 > User-Agent 哈希
 */
public class ClientIdentityResolver {

    public static final String USER_ID_ATTRIBUTE = "userId";
    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    public String resolve(HttpServletRequest request) {
        Object userId = request.getAttribute(USER_ID_ATTRIBUTE);
        if (userId != null) {
            return "user:" + userId;
        }
        Principal principal = request.getUserPrincipal();
        if (principal != null && hasText(principal.getName())) {
            return "user:" + principal.getName();
        }

        String apiKey = request.getHeader(API_KEY_HEADER);
        if (hasText(apiKey)) {
            return "key:" + apiKey.trim();
        }

        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (hasText(forwarded)) {
            // 逗号分隔的代理链，取第一跳
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return "ip:" + first;
            }
        }

        String remoteAddr = request.getRemoteAddr();
        if (hasText(remoteAddr)) {
            return "ip:" + remoteAddr;
        }

        String userAgent = request.getHeader("User-Agent");
        String ua = hasText(userAgent) ? userAgent : "unknown";
        return "ua:" + Integer.toHexString(ua.hashCode());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

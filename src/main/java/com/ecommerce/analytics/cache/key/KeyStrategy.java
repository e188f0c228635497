package com.ecommerce.analytics.cache.key;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 由调用参数推导缓存 Key
 */
@FunctionalInterface
public interface KeyStrategy {

    String keyFor(Object... args);

    /**
     * 位置参数按顺序绑定到模板占位符
     */
    static KeyStrategy template(KeyTemplate template, String... parameterNames) {
        return args -> {
            Map<String, Object> params = new LinkedHashMap<>();
            for (int i = 0; i < parameterNames.length; i++) {
                params.put(parameterNames[i], i < args.length ? args[i] : null);
            }
            return template.format(params);
        };
    }

    /**
     * 参数规范化 JSON 的 MD5 作为 Key 后缀
     */
    static KeyStrategy hashed(String prefix, CacheKeyGenerator generator) {
        return args -> generator.generate(prefix, args);
    }
}

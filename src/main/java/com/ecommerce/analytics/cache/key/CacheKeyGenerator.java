package com.ecommerce.analytics.cache.key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

/**
 * 基于参数哈希的 Key 生成器
 * 相同参数值（含 Map 键顺序不同）得到相同 Key
 */
@Component
public class CacheKeyGenerator {

    private final ObjectMapper canonicalMapper;

    public CacheKeyGenerator(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String generate(String prefix, Object... args) {
        Object[] values = args == null ? new Object[0] : args;
        String canonical;
        try {
            canonical = canonicalMapper.writeValueAsString(Map.of("args", Arrays.asList(values)));
        } catch (JsonProcessingException e) {
            throw new KeyFormatException("Cannot encode cache key arguments under " + prefix, e);
        }
        return prefix + ":" + DigestUtils.md5DigestAsHex(canonical.getBytes(StandardCharsets.UTF_8));
    }
}

package com.ecommerce.analytics.cache.key;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 参数哈希 Key 生成测试
 */
class CacheKeyGeneratorTest {

    private final CacheKeyGenerator generator = new CacheKeyGenerator(new ObjectMapper());

    @Test
    @DisplayName("相同参数生成相同 Key，格式为 前缀:32位md5")
    void testDeterministic() {
        String first = generator.generate("analytics:memo:revenue", "2024-01-01", "2024-01-31");
        String second = generator.generate("analytics:memo:revenue", "2024-01-01", "2024-01-31");

        assertEquals(first, second);
        assertTrue(first.matches("analytics:memo:revenue:[0-9a-f]{32}"), first);
    }

    @Test
    @DisplayName("参数不同或顺序不同 - Key 不同")
    void testDistinctArgs() {
        String a = generator.generate("p", "7d", 10);
        String b = generator.generate("p", "7d", 11);
        String c = generator.generate("p", 10, "7d");

        assertNotEquals(a, b);
        assertNotEquals(a, c);
    }

    @Test
    @DisplayName("Map 参数与插入顺序无关")
    void testMapOrderIndependent() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("period", "7d");
        first.put("limit", 10);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("limit", 10);
        second.put("period", "7d");

        assertEquals(generator.generate("p", first), generator.generate("p", second));
    }

    @Test
    @DisplayName("无参数与 null 参数可用")
    void testEmptyAndNullArgs() {
        String empty = generator.generate("p");
        String withNull = generator.generate("p", (Object) null);

        assertNotNull(empty);
        assertNotEquals(empty, withNull);
    }

    @Test
    @DisplayName("不可序列化的参数 - 抛出 KeyFormatException")
    void testUnencodableArgument() {
        assertThrows(KeyFormatException.class, () -> generator.generate("p", new Object()));
    }
}

package com.ecommerce.analytics.cache.key;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 缓存 Key 模板
 * 形如 analytics:product:{product_id}:{period}，占位符仅允许小写字母与下划线
 */
public final class KeyTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    private final String template;
    private final List<String> placeholders;

    private KeyTemplate(String template, List<String> placeholders) {
        this.template = template;
        this.placeholders = placeholders;
    }

    public static KeyTemplate of(String template) {
        Objects.requireNonNull(template, "template");
        List<String> names = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return new KeyTemplate(template, Collections.unmodifiableList(names));
    }

    /**
     * 生成具体 Key，所有占位符都必须有非空取值，多余参数忽略
     */
    public String format(Map<String, ?> params) {
        return substitute(params, true);
    }

    /**
     * 按 name, value, name, value... 成对传参
     */
    public String format(Object... namePairs) {
        return format(pairs(namePairs));
    }

    /**
     * 生成通配模式，未提供的占位符替换为 *
     */
    public String pattern(Map<String, ?> params) {
        return substitute(params, false);
    }

    public String pattern(Object... namePairs) {
        return pattern(pairs(namePairs));
    }

    /**
     * 全部占位符替换为 *
     */
    public String wildcard() {
        return substitute(Collections.emptyMap(), false);
    }

    /**
     * 第一个占位符之前的固定前缀
     */
    public String fixedPrefix() {
        int idx = template.indexOf('{');
        return idx < 0 ? template : template.substring(0, idx);
    }

    public String namespace() {
        int idx = template.indexOf(':');
        return idx < 0 ? template : template.substring(0, idx);
    }

    public List<String> placeholders() {
        return placeholders;
    }

    public String template() {
        return template;
    }

    private String substitute(Map<String, ?> params, boolean strict) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder(template.length() + 16);
        while (matcher.find()) {
            String name = matcher.group(1);
            Object value = params == null ? null : params.get(name);
            String replacement;
            if (value == null) {
                if (strict) {
                    throw new KeyFormatException(
                        "Missing value for placeholder '" + name + "' in key template " + template);
                }
                replacement = "*";
            } else {
                replacement = String.valueOf(value);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static Map<String, Object> pairs(Object... namePairs) {
        if (namePairs.length % 2 != 0) {
            throw new KeyFormatException("Key parameters must be given as name/value pairs");
        }
        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 0; i < namePairs.length; i += 2) {
            params.put(String.valueOf(namePairs[i]), namePairs[i + 1]);
        }
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyTemplate other)) return false;
        return template.equals(other.template);
    }

    @Override
    public int hashCode() {
        return template.hashCode();
    }

    @Override
    public String toString() {
        return template;
    }
}

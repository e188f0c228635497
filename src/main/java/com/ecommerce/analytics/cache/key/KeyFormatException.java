package com.ecommerce.analytics.cache.key;

/**
 * Key 模板参数缺失或参数无法编码
 */
public class KeyFormatException extends IllegalArgumentException {

    public KeyFormatException(String message) {
        super(message);
    }

    public KeyFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.ecommerce.analytics.dto;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 统计日期区间（闭区间）
 *
 * @param label 原始区间标识，如 7d、30d、today，用于拼装缓存 Key
 */
public record DateRange(LocalDate start, LocalDate end, String label) {

    private static final Pattern DAYS = Pattern.compile("(\\d{1,4})d");

    public static DateRange lastDays(int days, Clock clock) {
        LocalDate today = LocalDate.now(clock);
        return new DateRange(today.minusDays(days - 1L), today, days + "d");
    }

    /**
     * 解析 today / Nd 形式的区间
     */
    public static DateRange parse(String label, Clock clock) {
        if (label == null) {
            throw new IllegalArgumentException("Date range is required");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        if ("today".equals(normalized)) {
            LocalDate today = LocalDate.now(clock);
            return new DateRange(today, today, "today");
        }
        Matcher matcher = DAYS.matcher(normalized);
        if (matcher.matches()) {
            int days = Integer.parseInt(matcher.group(1));
            if (days > 0) {
                return lastDays(days, clock);
            }
        }
        throw new IllegalArgumentException("Unsupported date range: " + label);
    }
}

package com.uniclass.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 订阅套餐档位，决定限流、月度配额与缓存 TTL 的默认值。
 */
public enum PlanTier {

    FREE(10, 1_000L, 3_600L),
    STARTER(60, 10_000L, 86_400L),
    PROFESSIONAL(300, 100_000L, 86_400L),
    ENTERPRISE(1_000, 1_000_000L, 86_400L);

    /** 每分钟请求上限 */
    private final int requestsPerMinute;

    /** 每月查询上限 */
    private final long monthlyQueries;

    /** 结果缓存 TTL（秒） */
    private final long cacheTtlSeconds;

    PlanTier(int requestsPerMinute, long monthlyQueries, long cacheTtlSeconds) {
        this.requestsPerMinute = requestsPerMinute;
        this.monthlyQueries = monthlyQueries;
        this.cacheTtlSeconds = cacheTtlSeconds;
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    public long getMonthlyQueries() {
        return monthlyQueries;
    }

    public long getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    /** 小写形式，如 "professional"，与存储和接口中的取值一致 */
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 解析套餐名，未知或为空时按 free 处理。
     */
    public static PlanTier fromValue(String value) {
        if (value == null || value.isBlank()) {
            return FREE;
        }
        for (PlanTier tier : values()) {
            if (tier.name().equalsIgnoreCase(value.trim())) {
                return tier;
            }
        }
        return FREE;
    }

    /**
     * 升级建议：下一档套餐，已是最高档时返回 null。
     */
    public PlanTier next() {
        int idx = ordinal() + 1;
        return idx < values().length ? values()[idx] : null;
    }
}

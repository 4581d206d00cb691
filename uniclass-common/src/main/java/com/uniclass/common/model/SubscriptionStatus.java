package com.uniclass.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 租户订阅状态。
 */
public enum SubscriptionStatus {

    ACTIVE, TRIALING, PAST_DUE, CANCELED, INCOMPLETE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 欠费或已取消的租户一律拒绝鉴权 */
    public boolean isBlocked() {
        return this == PAST_DUE || this == CANCELED;
    }

    public static SubscriptionStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ACTIVE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

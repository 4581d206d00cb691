package com.uniclass.gateway.quota;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 租户当月配额状态。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaStatus {

    private long used;

    private long limit;

    private long remaining;

    /** 已用百分比，保留两位小数 */
    private double percentageUsed;

    /** 下个自然月第一刻（UTC） */
    private Instant resetDate;

    private boolean exceeded;

    /**
     * 根据用量与上限计算完整状态。
     */
    public static QuotaStatus of(long used, long limit, Instant resetDate) {
        return QuotaStatus.builder()
                .used(used)
                .limit(limit)
                .remaining(Math.max(0, limit - used))
                .percentageUsed(percentage(used, limit))
                .resetDate(resetDate)
                .exceeded(used >= limit)
                .build();
    }

    static double percentage(long used, long limit) {
        if (limit <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(used)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(limit), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    /**
     * 用量是否达到提醒阈值（百分比）。
     */
    public boolean reachedThreshold(double thresholdPercent) {
        return percentageUsed >= thresholdPercent;
    }

    /**
     * 生成配额响应头。
     */
    public Map<String, String> toHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Quota-Limit", String.valueOf(limit));
        headers.put("X-Quota-Remaining", String.valueOf(remaining));
        headers.put("X-Quota-Reset", resetDate.toString());
        return headers;
    }
}

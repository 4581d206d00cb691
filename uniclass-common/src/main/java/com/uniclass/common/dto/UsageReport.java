package com.uniclass.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 当月用量与限流概况。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UsageReport {

    @Builder.Default
    private String period = "current_month";

    private String planTier;

    private long totalQueries;

    private long quotaLimit;

    private long quotaRemaining;

    private Instant quotaReset;

    private double percentageUsed;

    /** 用量达到提醒阈值 */
    private boolean quotaWarning;

    /** 建议升级的套餐，仅在达到提醒阈值时给出 */
    private String upgradeSuggestion;

    private int rateLimit;

    /** 当前窗口内已用请求数 */
    private long rateLimitUsed;

    private int rateLimitWindowSeconds;
}

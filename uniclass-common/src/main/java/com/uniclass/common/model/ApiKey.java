package com.uniclass.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * API Key 记录。只保存摘要与展示前缀，明文仅在创建时返回一次。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ApiKey {

    private String id;

    private String tenantId;

    private String userId;

    private String name;

    /** SHA-256 十六进制摘要 */
    private String keyHash;

    /** 展示用前缀，如 "uc_live_a1b2" */
    private String keyPrefix;

    private List<String> scopes;

    /** 单 Key 限流覆盖值，为空时使用套餐默认值 */
    private Integer rateLimitOverride;

    private Instant expiresAt;

    /** 最近使用时间，尽力更新，仅供参考 */
    private Instant lastUsedAt;

    /** 只能 true -> false，吊销后不可恢复 */
    @Builder.Default
    private boolean active = true;

    private Instant createdAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}

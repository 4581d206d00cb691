package com.uniclass.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 租户：计费主体，也是限流、配额、缓存的隔离单元。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Tenant {

    /** 旧版共享密钥对应的合成租户 ID */
    public static final String LEGACY_ID = "legacy";

    private String id;

    private String name;

    @Builder.Default
    private PlanTier planTier = PlanTier.FREE;

    @Builder.Default
    private SubscriptionStatus subscriptionStatus = SubscriptionStatus.ACTIVE;

    /**
     * 旧版共享密钥鉴权通过后使用的合成租户（professional 档）。
     */
    public static Tenant legacy() {
        return Tenant.builder()
                .id(LEGACY_ID)
                .name("Legacy")
                .planTier(PlanTier.PROFESSIONAL)
                .subscriptionStatus(SubscriptionStatus.ACTIVE)
                .build();
    }
}

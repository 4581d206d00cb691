package com.uniclass.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Table;

/**
 * API Key 记录，只存摘要。时间字段为 epoch 毫秒。
 */
@Table("t_api_key")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyEntity implements Persistable<String> {

    @Id
    private String id;

    private String tenantId;
    private String userId;
    private String name;
    private String keyHash;
    private String keyPrefix;

    /** 逗号分隔 */
    private String scopes;

    private Integer rateLimitOverride;
    private Long expiresAt;
    private Long lastUsedAt;

    /** 1 有效，0 已吊销 */
    @Builder.Default
    private Integer active = 1;

    private Long createdAt;

    @Transient
    private boolean newEntity;

    @Override
    public boolean isNew() {
        return newEntity;
    }
}

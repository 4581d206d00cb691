package com.uniclass.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 租户。ID 由应用生成，新建时需标记 newEntity 以执行 INSERT。
 */
@Table("t_tenant")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantEntity implements Persistable<String> {

    @Id
    private String id;

    private String name;

    /** free / starter / professional / enterprise */
    private String planTier;

    /** active / trialing / past_due / canceled / incomplete */
    private String subscriptionStatus;

    /** epoch 毫秒 */
    private Long createdAt;

    @Transient
    private boolean newEntity;

    @Override
    public boolean isNew() {
        return newEntity;
    }
}

package com.uniclass.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 租户月度查询计数，id = tenantId:yyyy-MM。只通过 upsert 语句写入。
 */
@Table("t_monthly_usage")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyUsageEntity {

    @Id
    private String id;

    private String tenantId;

    /** yyyy-MM（UTC） */
    private String month;

    private Long queryCount;
}

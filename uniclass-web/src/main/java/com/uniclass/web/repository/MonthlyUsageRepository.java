package com.uniclass.web.repository;

import com.uniclass.web.entity.MonthlyUsageEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

public interface MonthlyUsageRepository extends CrudRepository<MonthlyUsageEntity, String> {

    /** 单条语句完成累加，并发写入不会丢失计数 */
    @Modifying
    @Query("INSERT INTO t_monthly_usage (id, tenant_id, month, query_count) VALUES (:id, :tenantId, :month, :count) "
            + "ON CONFLICT(id) DO UPDATE SET query_count = query_count + :count")
    int increment(String id, String tenantId, String month, long count);
}

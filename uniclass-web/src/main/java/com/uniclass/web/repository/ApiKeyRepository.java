package com.uniclass.web.repository;

import com.uniclass.web.entity.ApiKeyEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;
import java.util.Optional;

public interface ApiKeyRepository extends CrudRepository<ApiKeyEntity, String> {

    Optional<ApiKeyEntity> findByKeyHash(String keyHash);

    /** 租户名下全部 Key，最新的在前 */
    @Query("SELECT * FROM t_api_key WHERE tenant_id = :tenantId ORDER BY created_at DESC")
    List<ApiKeyEntity> findByTenant(String tenantId);

    @Modifying
    @Query("UPDATE t_api_key SET last_used_at = :lastUsedAt WHERE id = :id")
    int touchLastUsed(String id, long lastUsedAt);

    /** 只做 1 -> 0 */
    @Modifying
    @Query("UPDATE t_api_key SET active = 0 WHERE id = :id")
    int deactivate(String id);
}

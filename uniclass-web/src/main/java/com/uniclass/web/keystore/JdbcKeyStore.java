package com.uniclass.web.keystore;

import com.uniclass.common.exception.KeyStoreException;
import com.uniclass.common.model.ApiKey;
import com.uniclass.common.model.PlanTier;
import com.uniclass.common.model.SubscriptionStatus;
import com.uniclass.common.model.Tenant;
import com.uniclass.common.util.IdGenerator;
import com.uniclass.gateway.keystore.KeyStore;
import com.uniclass.web.entity.ApiKeyEntity;
import com.uniclass.web.entity.MonthlyUsageEntity;
import com.uniclass.web.entity.TenantEntity;
import com.uniclass.web.repository.ApiKeyRepository;
import com.uniclass.web.repository.MonthlyUsageRepository;
import com.uniclass.web.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 基于 Spring Data JDBC 的 KeyStore，数据落在 SQLite。
 * <p>
 * 数据库异常统一转换为 {@link KeyStoreException}，由上层决定 fail-open 还是 fail-closed。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "uniclass.keystore.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcKeyStore implements KeyStore {

    private final TenantRepository tenantRepo;
    private final ApiKeyRepository apiKeyRepo;
    private final MonthlyUsageRepository usageRepo;
    private final Clock clock;

    // ==================== 租户 ====================

    @Override
    public Optional<Tenant> lookupTenant(String tenantId) {
        return call("查询租户", () -> tenantRepo.findById(tenantId).map(JdbcKeyStore::toTenant));
    }

    @Override
    public Tenant saveTenant(Tenant tenant) {
        return call("保存租户", () -> {
            boolean isNew = tenant.getId() == null || !tenantRepo.existsById(tenant.getId());
            String id = tenant.getId() != null ? tenant.getId() : IdGenerator.withPrefix("tnt");
            TenantEntity entity = TenantEntity.builder()
                    .id(id)
                    .name(tenant.getName())
                    .planTier(tenant.getPlanTier().value())
                    .subscriptionStatus(tenant.getSubscriptionStatus().value())
                    .createdAt(clock.millis())
                    .newEntity(isNew)
                    .build();
            if (!isNew) {
                tenantRepo.findById(id).ifPresent(existing -> entity.setCreatedAt(existing.getCreatedAt()));
            }
            return toTenant(tenantRepo.save(entity));
        });
    }

    // ==================== API Key ====================

    @Override
    public Optional<ApiKey> lookupApiKeyByHash(String keyHash) {
        return call("按摘要查询 Key", () -> apiKeyRepo.findByKeyHash(keyHash).map(JdbcKeyStore::toApiKey));
    }

    @Override
    public void touchLastUsed(String keyId) {
        call("更新 Key 使用时间", () -> apiKeyRepo.touchLastUsed(keyId, clock.millis()));
    }

    @Override
    public ApiKey createApiKey(ApiKey apiKey) {
        return call("创建 Key", () -> insert(apiKey));
    }

    @Override
    public boolean revokeApiKey(String keyId) {
        return call("吊销 Key", () -> apiKeyRepo.deactivate(keyId) > 0);
    }

    @Override
    public List<ApiKey> listApiKeys(String tenantId) {
        return call("列举 Key", () -> apiKeyRepo.findByTenant(tenantId).stream()
                .map(JdbcKeyStore::toApiKey)
                .toList());
    }

    @Override
    @Transactional
    public ApiKey rotateApiKey(String oldKeyId, ApiKey replacement) {
        return call("轮换 Key", () -> {
            apiKeyRepo.deactivate(oldKeyId);
            return insert(replacement);
        });
    }

    // ==================== 月度用量 ====================

    @Override
    @Transactional
    public long incrementMonthlyUsage(String tenantId, YearMonth month, long count) {
        String id = usageId(tenantId, month);
        return call("累加用量", () -> {
            usageRepo.increment(id, tenantId, month.toString(), count);
            return usageRepo.findById(id).map(MonthlyUsageEntity::getQueryCount).orElse(count);
        });
    }

    @Override
    public long getMonthlyUsage(String tenantId, YearMonth month) {
        return call("查询用量", () -> usageRepo.findById(usageId(tenantId, month))
                .map(MonthlyUsageEntity::getQueryCount)
                .orElse(0L));
    }

    @Override
    public String getStoreName() {
        return "jdbc";
    }

    // ==================== 内部方法 ====================

    private ApiKey insert(ApiKey apiKey) {
        ApiKeyEntity entity = ApiKeyEntity.builder()
                .id(apiKey.getId() != null ? apiKey.getId() : IdGenerator.withPrefix("key"))
                .tenantId(apiKey.getTenantId())
                .userId(apiKey.getUserId())
                .name(apiKey.getName())
                .keyHash(apiKey.getKeyHash())
                .keyPrefix(apiKey.getKeyPrefix())
                .scopes(apiKey.getScopes() == null ? "" : String.join(",", apiKey.getScopes()))
                .rateLimitOverride(apiKey.getRateLimitOverride())
                .expiresAt(toMillis(apiKey.getExpiresAt()))
                .active(1)
                .createdAt(clock.millis())
                .newEntity(true)
                .build();
        return toApiKey(apiKeyRepo.save(entity));
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("KeyStore {}失败: {}", operation, e.getMessage());
            throw new KeyStoreException(operation + "失败: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private static String usageId(String tenantId, YearMonth month) {
        return tenantId + ":" + month;
    }

    static Tenant toTenant(TenantEntity e) {
        return Tenant.builder()
                .id(e.getId())
                .name(e.getName())
                .planTier(PlanTier.fromValue(e.getPlanTier()))
                .subscriptionStatus(SubscriptionStatus.fromValue(e.getSubscriptionStatus()))
                .build();
    }

    static ApiKey toApiKey(ApiKeyEntity e) {
        return ApiKey.builder()
                .id(e.getId())
                .tenantId(e.getTenantId())
                .userId(e.getUserId())
                .name(e.getName())
                .keyHash(e.getKeyHash())
                .keyPrefix(e.getKeyPrefix())
                .scopes(e.getScopes() == null || e.getScopes().isBlank()
                        ? List.of()
                        : Arrays.asList(e.getScopes().split(",")))
                .rateLimitOverride(e.getRateLimitOverride())
                .expiresAt(toInstant(e.getExpiresAt()))
                .lastUsedAt(toInstant(e.getLastUsedAt()))
                .active(e.getActive() != null && e.getActive() == 1)
                .createdAt(toInstant(e.getCreatedAt()))
                .build();
    }

    private static Long toMillis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : null;
    }

    private static Instant toInstant(Long millis) {
        return millis != null ? Instant.ofEpochMilli(millis) : null;
    }
}

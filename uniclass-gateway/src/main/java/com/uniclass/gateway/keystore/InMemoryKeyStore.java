package com.uniclass.gateway.keystore;

import com.uniclass.common.model.ApiKey;
import com.uniclass.common.model.Tenant;
import com.uniclass.common.util.IdGenerator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存的 KeyStore。
 * <p>
 * 进程重启后数据丢失，适用于本地开发和测试，无需数据库。
 */
@Slf4j
public class InMemoryKeyStore implements KeyStore {

    private final Clock clock;

    private final Map<String, Tenant> tenants = new ConcurrentHashMap<>();

    /** keyId -> Key */
    private final Map<String, ApiKey> keys = new ConcurrentHashMap<>();

    /** keyHash -> keyId */
    private final Map<String, String> hashIndex = new ConcurrentHashMap<>();

    /** tenantId:yyyy-MM -> 查询数 */
    private final Map<String, Long> monthlyUsage = new ConcurrentHashMap<>();

    public InMemoryKeyStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<ApiKey> lookupApiKeyByHash(String keyHash) {
        String keyId = hashIndex.get(keyHash);
        return keyId == null ? Optional.empty() : Optional.ofNullable(keys.get(keyId));
    }

    @Override
    public Optional<Tenant> lookupTenant(String tenantId) {
        return Optional.ofNullable(tenants.get(tenantId)).map(t -> t.toBuilder().build());
    }

    /** 存入副本，调用方后续修改入参或返回值都不影响已存数据 */
    @Override
    public Tenant saveTenant(Tenant tenant) {
        Tenant stored = tenant.toBuilder()
                .id(tenant.getId() != null ? tenant.getId() : IdGenerator.withPrefix("tnt"))
                .build();
        tenants.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public void touchLastUsed(String keyId) {
        keys.computeIfPresent(keyId, (id, key) -> key.toBuilder().lastUsedAt(clock.instant()).build());
    }

    @Override
    public ApiKey createApiKey(ApiKey apiKey) {
        ApiKey stored = apiKey.toBuilder()
                .id(apiKey.getId() != null ? apiKey.getId() : IdGenerator.withPrefix("key"))
                .createdAt(clock.instant())
                .active(true)
                .build();
        keys.put(stored.getId(), stored);
        hashIndex.put(stored.getKeyHash(), stored.getId());
        return stored;
    }

    @Override
    public boolean revokeApiKey(String keyId) {
        return keys.computeIfPresent(keyId, (id, key) -> key.toBuilder().active(false).build()) != null;
    }

    @Override
    public List<ApiKey> listApiKeys(String tenantId) {
        return keys.values().stream()
                .filter(k -> tenantId.equals(k.getTenantId()))
                .sorted(Comparator.comparing(ApiKey::getCreatedAt).reversed())
                .toList();
    }

    @Override
    public synchronized ApiKey rotateApiKey(String oldKeyId, ApiKey replacement) {
        revokeApiKey(oldKeyId);
        return createApiKey(replacement);
    }

    @Override
    public long incrementMonthlyUsage(String tenantId, YearMonth month, long count) {
        return monthlyUsage.merge(tenantId + ":" + month, count, Long::sum);
    }

    @Override
    public long getMonthlyUsage(String tenantId, YearMonth month) {
        return monthlyUsage.getOrDefault(tenantId + ":" + month, 0L);
    }

    @Override
    public String getStoreName() {
        return "memory";
    }
}

package com.uniclass.gateway.keystore;

import com.uniclass.common.model.ApiKey;
import com.uniclass.common.model.Tenant;

import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

/**
 * 租户、API Key 与月度用量的持久化接口。
 * <p>
 * 提供两种实现：
 * - {@link InMemoryKeyStore}：内存实现，适合本地开发与测试
 * - JdbcKeyStore（web 模块）：Spring Data JDBC 实现，数据落盘
 * <p>
 * 实现类访问底层存储失败时抛出 {@link com.uniclass.common.exception.KeyStoreException}。
 */
public interface KeyStore {

    /** 按摘要查找 Key（含已吊销的 Key，由调用方判断状态） */
    Optional<ApiKey> lookupApiKeyByHash(String keyHash);

    Optional<Tenant> lookupTenant(String tenantId);

    /** 新增或更新租户 */
    Tenant saveTenant(Tenant tenant);

    /** 更新最近使用时间 */
    void touchLastUsed(String keyId);

    /** 保存新 Key，返回带 ID 与创建时间的记录 */
    ApiKey createApiKey(ApiKey apiKey);

    /** 吊销 Key，返回是否存在该 Key */
    boolean revokeApiKey(String keyId);

    /** 租户名下全部 Key，按创建时间倒序 */
    List<ApiKey> listApiKeys(String tenantId);

    /**
     * 在同一操作内吊销旧 Key 并保存新 Key。
     */
    ApiKey rotateApiKey(String oldKeyId, ApiKey replacement);

    /** 累加某租户某月的查询数，返回累加后的值 */
    long incrementMonthlyUsage(String tenantId, YearMonth month, long count);

    long getMonthlyUsage(String tenantId, YearMonth month);

    /** 实现名称，用于日志与健康检查 */
    String getStoreName();
}

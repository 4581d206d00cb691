package com.uniclass.gateway.auth;

import com.uniclass.common.exception.ErrorCode;
import com.uniclass.common.exception.UniclassException;
import com.uniclass.common.model.ApiKey;
import com.uniclass.common.model.ApiKeySummary;
import com.uniclass.common.util.Digests;
import com.uniclass.gateway.config.GatewayProperties;
import com.uniclass.gateway.keystore.KeyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * API Key 的生成、列举、吊销与轮换。
 * <p>
 * 明文 Key 只在创建时返回一次，持久化的只有 SHA-256 摘要和 12 位展示前缀。
 */
@Slf4j
@Service
public class ApiKeyService {

    static final List<String> DEFAULT_SCOPES = List.of("search");

    private final GatewayProperties properties;
    private final KeyStore keyStore;
    private final SecureRandom random = new SecureRandom();

    public ApiKeyService(GatewayProperties properties, Optional<KeyStore> keyStore) {
        this.properties = properties;
        this.keyStore = keyStore.orElse(null);
    }

    /**
     * 是否配置了 KeyStore。未配置时只有旧版共享密钥可用，Key 管理不可用。
     */
    public boolean isAvailable() {
        return keyStore != null;
    }

    public CreatedApiKey createKey(String tenantId, String userId, String name, List<String> scopes,
                                   Integer rateLimitOverride, Instant expiresAt) {
        String rawKey = generateRawKey();
        ApiKey created = requireStore().createApiKey(newRecord(rawKey, tenantId, userId, name,
                scopes, rateLimitOverride, expiresAt));
        log.info("租户 {} 创建 Key {}（{}***）", tenantId, created.getId(), created.getKeyPrefix());
        return new CreatedApiKey(rawKey, created);
    }

    /**
     * 列举租户的 Key，不含摘要。
     */
    public List<ApiKeySummary> listKeys(String tenantId) {
        return requireStore().listApiKeys(tenantId).stream()
                .map(ApiKeySummary::from)
                .toList();
    }

    /**
     * @return Key 不存在或不属于该租户时返回 false
     */
    public boolean revokeKey(String keyId, String tenantId) {
        if (findOwnedKey(keyId, tenantId).isEmpty()) {
            return false;
        }
        boolean revoked = requireStore().revokeApiKey(keyId);
        if (revoked) {
            log.info("租户 {} 吊销 Key {}", tenantId, keyId);
        }
        return revoked;
    }

    /**
     * 吊销旧 Key 并以相同的 scopes / 限流覆盖 / 过期时间生成新 Key。
     *
     * @return Key 不存在或不属于该租户时返回 empty
     */
    public Optional<CreatedApiKey> rotateKey(String keyId, String tenantId, String userId) {
        Optional<ApiKey> owned = findOwnedKey(keyId, tenantId);
        if (owned.isEmpty()) {
            return Optional.empty();
        }
        ApiKey old = owned.get();
        String rawKey = generateRawKey();
        ApiKey replacement = newRecord(rawKey, tenantId, userId != null ? userId : old.getUserId(),
                old.getName() + " (rotated)", old.getScopes(), old.getRateLimitOverride(), old.getExpiresAt());
        ApiKey created = requireStore().rotateApiKey(keyId, replacement);
        log.info("租户 {} 轮换 Key {} -> {}", tenantId, keyId, created.getId());
        return Optional.of(new CreatedApiKey(rawKey, created));
    }

    String generateRawKey() {
        byte[] bytes = new byte[KeyFormat.RANDOM_BYTES];
        random.nextBytes(bytes);
        return KeyFormat.prefixFor(properties.isLive())
                + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private ApiKey newRecord(String rawKey, String tenantId, String userId, String name, List<String> scopes,
                             Integer rateLimitOverride, Instant expiresAt) {
        return ApiKey.builder()
                .tenantId(tenantId)
                .userId(userId)
                .name(name)
                .keyHash(Digests.sha256Hex(rawKey))
                .keyPrefix(KeyFormat.displayPrefix(rawKey))
                .scopes(scopes == null || scopes.isEmpty() ? DEFAULT_SCOPES : List.copyOf(scopes))
                .rateLimitOverride(rateLimitOverride)
                .expiresAt(expiresAt)
                .active(true)
                .build();
    }

    private Optional<ApiKey> findOwnedKey(String keyId, String tenantId) {
        return requireStore().listApiKeys(tenantId).stream()
                .filter(k -> k.getId().equals(keyId))
                .findFirst();
    }

    private KeyStore requireStore() {
        if (keyStore == null) {
            throw new UniclassException(ErrorCode.SERVICE_UNAVAILABLE, "API key management requires a key store");
        }
        return keyStore;
    }
}

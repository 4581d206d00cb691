package com.uniclass.gateway.auth;

import com.uniclass.common.exception.ErrorCode;
import com.uniclass.common.model.ApiKey;
import com.uniclass.common.model.Tenant;
import com.uniclass.common.util.Digests;
import com.uniclass.gateway.config.GatewayProperties;
import com.uniclass.gateway.keystore.KeyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Optional;

/**
 * 请求鉴权。
 * <p>
 * 依次尝试旧版共享密钥与 KeyStore 中的 API Key。
 * KeyStore 查询异常时拒绝请求；最近使用时间更新失败只记日志，不影响请求。
 */
@Slf4j
@Component
public class AuthGate {

    private static final String BEARER = "Bearer";

    private final GatewayProperties properties;
    private final KeyStore keyStore;
    private final Clock clock;

    public AuthGate(GatewayProperties properties, Optional<KeyStore> keyStore, Clock clock) {
        this.properties = properties;
        this.keyStore = keyStore.orElse(null);
        this.clock = clock;
    }

    /**
     * @param credential 裸 Key 或 Authorization 头的值（"Bearer " 前缀会被去掉）
     */
    public AuthResult authenticate(String credential) {
        String token = stripBearer(credential);
        if (token.isEmpty()) {
            return AuthResult.failure(ErrorCode.AUTH_REQUIRED, "Authentication required");
        }

        if (isLegacyKey(token)) {
            return AuthResult.success(Tenant.legacy(), null);
        }

        if (keyStore == null) {
            return AuthResult.failure(ErrorCode.INVALID_API_KEY, "Invalid API key");
        }

        if (!KeyFormat.isRecognized(token)) {
            return AuthResult.failure(ErrorCode.INVALID_API_KEY, "Invalid API key format");
        }
        if (properties.isLive() && token.startsWith(KeyFormat.TEST_PREFIX)) {
            return AuthResult.failure(ErrorCode.INVALID_API_KEY, "Test key used in live environment");
        }
        if (!properties.isLive() && token.startsWith(KeyFormat.LIVE_PREFIX)) {
            return AuthResult.failure(ErrorCode.INVALID_API_KEY, "Live key used in test environment");
        }

        try {
            return validate(token);
        } catch (RuntimeException e) {
            log.error("Key 校验失败: key={}", Digests.mask(token), e);
            return AuthResult.failure(ErrorCode.INVALID_API_KEY, "Validation failed");
        }
    }

    private AuthResult validate(String token) {
        Optional<ApiKey> found = keyStore.lookupApiKeyByHash(Digests.sha256Hex(token));
        if (found.isEmpty()) {
            log.debug("未知 Key: {}", Digests.mask(token));
            return AuthResult.failure(ErrorCode.INVALID_API_KEY, "Invalid API key");
        }
        ApiKey apiKey = found.get();
        if (!apiKey.isActive()) {
            return AuthResult.failure(ErrorCode.INVALID_API_KEY, "API key has been revoked");
        }
        if (apiKey.isExpired(clock.instant())) {
            return AuthResult.failure(ErrorCode.INVALID_API_KEY, "API key has expired");
        }

        Optional<Tenant> tenant = keyStore.lookupTenant(apiKey.getTenantId());
        if (tenant.isEmpty()) {
            log.warn("Key {} 对应的租户 {} 不存在", apiKey.getId(), apiKey.getTenantId());
            return AuthResult.failure(ErrorCode.INVALID_API_KEY, "Tenant not found");
        }
        if (tenant.get().getSubscriptionStatus().isBlocked()) {
            return AuthResult.failure(ErrorCode.INVALID_API_KEY,
                    "Subscription " + tenant.get().getSubscriptionStatus().value() + ". Please update payment.");
        }

        touchLastUsed(apiKey.getId());
        return AuthResult.success(tenant.get(), apiKey);
    }

    private void touchLastUsed(String keyId) {
        try {
            keyStore.touchLastUsed(keyId);
        } catch (RuntimeException e) {
            log.warn("更新 Key {} 最近使用时间失败: {}", keyId, e.getMessage());
        }
    }

    private boolean isLegacyKey(String token) {
        String legacy = properties.getLegacyApiKey();
        if (legacy == null || legacy.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(legacy.getBytes(StandardCharsets.UTF_8), token.getBytes(StandardCharsets.UTF_8));
    }

    private static String stripBearer(String credential) {
        if (credential == null) {
            return "";
        }
        String value = credential.trim();
        // 只有 "Bearer" 而没有凭证时视为未携带
        if (value.regionMatches(true, 0, BEARER, 0, BEARER.length())
                && (value.length() == BEARER.length() || Character.isWhitespace(value.charAt(BEARER.length())))) {
            value = value.substring(BEARER.length()).trim();
        }
        return value;
    }
}

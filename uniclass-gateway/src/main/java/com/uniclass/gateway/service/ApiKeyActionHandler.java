package com.uniclass.gateway.service;

import com.uniclass.common.dto.ApiKeyRequest;
import com.uniclass.common.dto.CreatedKeyResponse;
import com.uniclass.common.dto.GatewayResult;
import com.uniclass.common.exception.ErrorCode;
import com.uniclass.common.model.ApiKey;
import com.uniclass.common.model.ApiKeySummary;
import com.uniclass.gateway.auth.ApiKeyService;
import com.uniclass.gateway.auth.AuthResult;
import com.uniclass.gateway.auth.CreatedApiKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key 管理动作：create / list / revoke / rotate，默认 list。
 * <p>
 * KeyStore 调用异常在这里捕获并转换为对应错误码，原始信息放在 details.reason。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyActionHandler {

    static final String DEFAULT_KEY_NAME = "API Key";

    private final ApiKeyService apiKeyService;

    /**
     * @param auth 已通过鉴权的结果
     */
    public GatewayResult handle(ApiKeyRequest request, AuthResult auth) {
        if (!apiKeyService.isAvailable()) {
            return GatewayResult.error(ErrorCode.SERVICE_UNAVAILABLE,
                    "API key management requires a key store. Set uniclass.keystore.type to memory or jdbc.");
        }

        String tenantId = auth.getTenant().getId();
        String action = request.getAction() == null || request.getAction().isBlank() ? "list" : request.getAction();

        switch (action) {
            case "create":
                return create(request, auth, tenantId);
            case "list":
                return list(tenantId);
            case "revoke":
                return revoke(request, tenantId);
            case "rotate":
                return rotate(request, auth, tenantId);
            default:
                return GatewayResult.error(ErrorCode.INVALID_ACTION, "Unknown action: " + action);
        }
    }

    private GatewayResult create(ApiKeyRequest request, AuthResult auth, String tenantId) {
        String name = request.getName() == null || request.getName().isBlank() ? DEFAULT_KEY_NAME : request.getName();
        try {
            CreatedApiKey created = apiKeyService.createKey(tenantId, userIdOf(auth), name, request.getScopes(),
                    request.getRateLimitOverride(), request.getExpiresAt());
            return GatewayResult.ok(toResponse(created, null));
        } catch (RuntimeException e) {
            log.error("租户 {} 创建 Key 失败", tenantId, e);
            return GatewayResult.error(ErrorCode.CREATE_FAILED, "Failed to create key: " + e.getMessage(),
                    RequestOrchestrator.reason(e.getMessage()));
        }
    }

    private GatewayResult list(String tenantId) {
        try {
            List<ApiKeySummary> keys = apiKeyService.listKeys(tenantId);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("keys", keys);
            return GatewayResult.ok(body);
        } catch (RuntimeException e) {
            log.error("租户 {} 列举 Key 失败", tenantId, e);
            return GatewayResult.error(ErrorCode.LIST_FAILED, "Failed to list keys: " + e.getMessage(),
                    RequestOrchestrator.reason(e.getMessage()));
        }
    }

    private GatewayResult revoke(ApiKeyRequest request, String tenantId) {
        String keyId = request.getKeyId();
        if (keyId == null || keyId.isBlank()) {
            return GatewayResult.error(ErrorCode.MISSING_PARAM, "Missing 'key_id'");
        }
        try {
            if (!apiKeyService.revokeKey(keyId, tenantId)) {
                return GatewayResult.error(ErrorCode.NOT_FOUND, "Key not found");
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "revoked");
            body.put("key_id", keyId);
            return GatewayResult.ok(body);
        } catch (RuntimeException e) {
            log.error("租户 {} 吊销 Key {} 失败", tenantId, keyId, e);
            return GatewayResult.error(ErrorCode.REVOKE_FAILED, "Failed to revoke key: " + e.getMessage(),
                    RequestOrchestrator.reason(e.getMessage()));
        }
    }

    private GatewayResult rotate(ApiKeyRequest request, AuthResult auth, String tenantId) {
        String keyId = request.getKeyId();
        if (keyId == null || keyId.isBlank()) {
            return GatewayResult.error(ErrorCode.MISSING_PARAM, "Missing 'key_id'");
        }
        try {
            Optional<CreatedApiKey> rotated = apiKeyService.rotateKey(keyId, tenantId, userIdOf(auth));
            if (rotated.isEmpty()) {
                return GatewayResult.error(ErrorCode.NOT_FOUND, "Key not found");
            }
            return GatewayResult.ok(toResponse(rotated.get(), keyId));
        } catch (RuntimeException e) {
            log.error("租户 {} 轮换 Key {} 失败", tenantId, keyId, e);
            return GatewayResult.error(ErrorCode.CREATE_FAILED, "Failed to rotate key: " + e.getMessage(),
                    RequestOrchestrator.reason(e.getMessage()));
        }
    }

    /**
     * 旧版共享密钥没有对应的 Key 记录，以租户 ID 作为用户 ID。
     */
    private static String userIdOf(AuthResult auth) {
        ApiKey apiKey = auth.getApiKey();
        if (apiKey != null && apiKey.getUserId() != null) {
            return apiKey.getUserId();
        }
        return auth.getTenant().getId();
    }

    private static CreatedKeyResponse toResponse(CreatedApiKey created, String replacedKeyId) {
        ApiKey key = created.getApiKey();
        return CreatedKeyResponse.builder()
                .key(created.getRawKey())
                .id(key.getId())
                .name(key.getName())
                .prefix(key.getKeyPrefix())
                .scopes(key.getScopes())
                .rateLimitOverride(key.getRateLimitOverride())
                .createdAt(key.getCreatedAt())
                .expiresAt(key.getExpiresAt())
                .replacedKeyId(replacedKeyId)
                .build();
    }
}

package com.uniclass.gateway.auth;

import com.uniclass.common.dto.ErrorResponse;
import com.uniclass.common.exception.ErrorCode;
import com.uniclass.common.model.ApiKey;
import com.uniclass.common.model.Tenant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 鉴权结果：成功时有租户（使用 Key 鉴权时还有 Key），失败时只有错误。
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AuthResult {

    private final Tenant tenant;

    /** 旧版共享密钥鉴权时为 null */
    private final ApiKey apiKey;

    private final ErrorResponse error;

    public static AuthResult success(Tenant tenant, ApiKey apiKey) {
        return new AuthResult(tenant, apiKey, null);
    }

    public static AuthResult failure(ErrorCode code, String message) {
        return new AuthResult(null, null, ErrorResponse.of(code, message));
    }

    public boolean isAuthenticated() {
        return error == null && tenant != null;
    }

    /** Key 上配置的限流覆盖值 */
    public Integer getRateLimitOverride() {
        return apiKey != null ? apiKey.getRateLimitOverride() : null;
    }
}

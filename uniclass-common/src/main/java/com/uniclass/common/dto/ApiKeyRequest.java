package com.uniclass.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Key 管理请求：create / list / revoke / rotate。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyRequest {

    private String action;

    /** create 时的 Key 名称 */
    private String name;

    private List<String> scopes;

    private Integer rateLimitOverride;

    private Instant expiresAt;

    /** revoke / rotate 的目标 Key */
    private String keyId;
}

package com.uniclass.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Key 列表视图，不含摘要。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeySummary {

    private String id;
    private String name;
    private String prefix;
    private List<String> scopes;
    private boolean active;
    private Instant createdAt;
    private Instant lastUsedAt;
    private Instant expiresAt;

    public static ApiKeySummary from(ApiKey key) {
        return ApiKeySummary.builder()
                .id(key.getId())
                .name(key.getName())
                .prefix(key.getKeyPrefix())
                .scopes(key.getScopes())
                .active(key.isActive())
                .createdAt(key.getCreatedAt())
                .lastUsedAt(key.getLastUsedAt())
                .expiresAt(key.getExpiresAt())
                .build();
    }
}

package com.uniclass.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 新建（或轮换得到）的 Key。key 字段是唯一一次返回明文。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CreatedKeyResponse {

    public static final String SAVE_WARNING = "Save this key! It will not be shown again.";

    private String key;

    private String id;

    private String name;

    private String prefix;

    private List<String> scopes;

    private Integer rateLimitOverride;

    private Instant createdAt;

    private Instant expiresAt;

    /** 轮换时被吊销的旧 Key */
    private String replacedKeyId;

    @Builder.Default
    private String warning = SAVE_WARNING;
}

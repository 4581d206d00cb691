package com.uniclass.gateway.auth;

import com.uniclass.common.model.ApiKey;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 新建的 Key。rawKey 只在这里出现一次，不会被持久化。
 */
@Getter
@AllArgsConstructor
public class CreatedApiKey {

    private final String rawKey;

    private final ApiKey apiKey;
}

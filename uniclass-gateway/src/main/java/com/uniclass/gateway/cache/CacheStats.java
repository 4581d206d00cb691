package com.uniclass.gateway.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 租户缓存统计。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private String tenantId;

    /** 当前缓存的查询数 */
    private long cachedQueries;

    private String backend;
}

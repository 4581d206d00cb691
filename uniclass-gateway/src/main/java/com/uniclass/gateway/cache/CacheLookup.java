package com.uniclass.gateway.cache;

import com.uniclass.common.dto.SearchHit;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * 缓存查询结果。
 */
@Data
@AllArgsConstructor
public class CacheLookup {

    private static final CacheLookup MISS = new CacheLookup(false, null, null);

    private final boolean hit;

    private final List<SearchHit> data;

    private final Instant cachedAt;

    public static CacheLookup miss() {
        return MISS;
    }

    public static CacheLookup hit(List<SearchHit> data, Instant cachedAt) {
        return new CacheLookup(true, data, cachedAt);
    }
}

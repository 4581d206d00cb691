package com.uniclass.gateway.cache;

import com.uniclass.common.util.Digests;

import java.util.Locale;

/**
 * 缓存 key 计算。查询语句先去除首尾空白并转小写，大小写与空白不同的同一查询共享缓存。
 */
final class CacheKeys {

    private CacheKeys() {
    }

    static String normalize(String query) {
        return query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 租户内唯一的查询摘要，租户 id 参与摘要计算。
     */
    static String digest(String tenantId, String query, int topK) {
        return Digests.sha256Hex(tenantId + ":" + normalize(query) + ":" + topK);
    }

    /**
     * 带租户命名空间的完整 key: {prefix}{tenantId}:{digest}
     */
    static String scoped(String prefix, String tenantId, String query, int topK) {
        return tenantPrefix(prefix, tenantId) + digest(tenantId, query, topK);
    }

    static String tenantPrefix(String prefix, String tenantId) {
        return prefix + tenantId + ":";
    }
}

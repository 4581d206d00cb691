package com.uniclass.gateway.cache;

import com.uniclass.common.dto.SearchHit;
import com.uniclass.common.model.PlanTier;
import com.uniclass.gateway.config.GatewayProperties;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于内存的检索结果缓存。
 * <p>
 * 条目在读取时检查是否过期（now &lt; cachedAt + ttl），不做后台清理。
 * 超出容量时淘汰最早写入的条目：按写入顺序先进先出，读取不刷新顺序，重复写入同一 key 会排到队尾。
 * 所有操作由同一把锁串行化。
 */
@Slf4j
public class InMemoryResponseCache implements ResponseCache {

    private static final String NAMESPACE = "";

    private final GatewayProperties properties;
    private final Clock clock;
    private final Object lock = new Object();

    /** 按写入顺序排列 */
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();

    public InMemoryResponseCache(GatewayProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public CacheLookup get(String query, int topK, String tenantId) {
        String key = CacheKeys.scoped(NAMESPACE, tenantId, query, topK);
        Instant now = clock.instant();
        synchronized (lock) {
            Entry entry = entries.get(key);
            if (entry == null) {
                return CacheLookup.miss();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                return CacheLookup.miss();
            }
            return CacheLookup.hit(entry.results, entry.cachedAt);
        }
    }

    @Override
    public boolean set(String query, int topK, List<SearchHit> results, String tenantId, PlanTier planTier) {
        String key = CacheKeys.scoped(NAMESPACE, tenantId, query, topK);
        Entry entry = new Entry(tenantId, List.copyOf(results), clock.instant(),
                properties.getCache().ttlFor(planTier));
        int maxEntries = properties.getCache().getMaxEntries();
        synchronized (lock) {
            entries.remove(key);
            entries.put(key, entry);
            Iterator<Map.Entry<String, Entry>> oldest = entries.entrySet().iterator();
            while (entries.size() > maxEntries && oldest.hasNext()) {
                String evicted = oldest.next().getKey();
                oldest.remove();
                log.debug("缓存已满，淘汰最早条目 {}", evicted);
            }
        }
        return true;
    }

    @Override
    public boolean delete(String query, int topK, String tenantId) {
        String key = CacheKeys.scoped(NAMESPACE, tenantId, query, topK);
        synchronized (lock) {
            return entries.remove(key) != null;
        }
    }

    @Override
    public int clearTenant(String tenantId) {
        int removed = 0;
        synchronized (lock) {
            Iterator<Entry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().tenantId.equals(tenantId)) {
                    it.remove();
                    removed++;
                }
            }
        }
        log.info("清空租户 {} 的缓存，共 {} 条", tenantId, removed);
        return removed;
    }

    @Override
    public CacheStats stats(String tenantId) {
        Instant now = clock.instant();
        long count;
        synchronized (lock) {
            count = entries.values().stream()
                    .filter(e -> e.tenantId.equals(tenantId) && !e.isExpired(now))
                    .count();
        }
        return CacheStats.builder()
                .tenantId(tenantId)
                .cachedQueries(count)
                .backend(getBackendName())
                .build();
    }

    @Override
    public String getBackendName() {
        return "memory";
    }

    /**
     * 当前条目总数（含尚未被读到的过期条目）。
     */
    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    @AllArgsConstructor
    private static class Entry {
        private final String tenantId;
        private final List<SearchHit> results;
        private final Instant cachedAt;
        private final long ttlSeconds;

        boolean isExpired(Instant now) {
            return !now.isBefore(cachedAt.plusSeconds(ttlSeconds));
        }
    }
}

package com.uniclass.gateway.ratelimit;

import com.uniclass.common.model.PlanTier;
import com.uniclass.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存的滑动窗口限流器。
 * <p>
 * 每个 租户:套餐 维护一个请求时间戳队列，通过清理过期记录并计数来判断是否超限。
 * 同一队列的清理、计数、登记在该队列的锁内完成，并发请求不会丢失更新。
 * 精确到毫秒，内存占用与窗口内请求数成正比。
 */
@Slf4j
public class InMemoryRateLimiter implements RateLimiter {

    private final GatewayProperties properties;
    private final Clock clock;

    /** tenantId:planTier -> 请求时间戳队列（毫秒，升序） */
    private final Map<String, Deque<Long>> windows = new ConcurrentHashMap<>();

    public InMemoryRateLimiter(GatewayProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public RateLimitResult check(String tenantId, PlanTier planTier, Integer override) {
        int limit = RateLimits.effectiveLimit(properties, planTier, override);
        long windowMs = properties.getRateLimit().getWindowSeconds() * 1000L;
        Deque<Long> timestamps = windows.computeIfAbsent(RateLimits.slotKey(tenantId, planTier),
                k -> new ArrayDeque<>());

        synchronized (timestamps) {
            // 在锁内取时间，保证队列内时间戳单调递增
            long now = clock.millis();
            evictExpired(timestamps, now - windowMs);

            // 检查是否超限
            if (timestamps.size() >= limit) {
                Long first = timestamps.peekFirst();
                long oldest = first != null ? first : now;
                long retryAfter = RateLimits.retryAfterSeconds(oldest + windowMs - now);
                log.debug("租户 {} 已达速率限制 ({}/{}), {} 秒后可重试",
                        tenantId, timestamps.size(), limit, retryAfter);
                return RateLimitResult.builder()
                        .allowed(false)
                        .limit(limit)
                        .remaining(0)
                        .resetAt(Instant.ofEpochMilli(oldest + windowMs))
                        .retryAfter(retryAfter)
                        .build();
            }

            // 记录本次请求
            timestamps.addLast(now);
            return RateLimitResult.builder()
                    .allowed(true)
                    .limit(limit)
                    .remaining(limit - timestamps.size())
                    .resetAt(Instant.ofEpochMilli(timestamps.getFirst() + windowMs))
                    .build();
        }
    }

    @Override
    public long currentUsage(String tenantId, PlanTier planTier) {
        Deque<Long> timestamps = windows.get(RateLimits.slotKey(tenantId, planTier));
        if (timestamps == null) {
            return 0;
        }
        synchronized (timestamps) {
            evictExpired(timestamps, clock.millis() - properties.getRateLimit().getWindowSeconds() * 1000L);
            return timestamps.size();
        }
    }

    @Override
    public String getBackendName() {
        return "memory";
    }

    /** 清理 windowStart 及之前的记录，窗口为左开右闭 */
    private void evictExpired(Deque<Long> timestamps, long windowStart) {
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= windowStart) {
            timestamps.pollFirst();
        }
    }
}

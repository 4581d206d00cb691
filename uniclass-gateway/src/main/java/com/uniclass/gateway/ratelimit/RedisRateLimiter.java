package com.uniclass.gateway.ratelimit;

import com.uniclass.common.model.PlanTier;
import com.uniclass.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * 基于 Redis Sorted Set 的滑动窗口限流器。
 * <p>
 * 清理、计数、登记、续期在同一段 Lua 脚本中原子执行，多实例之间没有客户端竞态。
 * Redis 不可用时放行请求（fail-open），不做同步重试。
 */
@Slf4j
public class RedisRateLimiter implements RateLimiter {

    /**
     * KEYS[1] 限流 key；ARGV: 当前毫秒、窗口毫秒、上限、本次请求的唯一成员。
     * 返回 {allowed(0/1), 窗口内请求数, 窗口内最早请求的毫秒时间戳}
     */
    private static final String SLIDING_WINDOW_SCRIPT = """
            local key = KEYS[1]
            local now = tonumber(ARGV[1])
            local window = tonumber(ARGV[2])
            local limit = tonumber(ARGV[3])

            redis.call('ZREMRANGEBYSCORE', key, '-inf', now - window)
            local count = redis.call('ZCARD', key)

            local allowed = 0
            if count < limit then
                redis.call('ZADD', key, now, ARGV[4])
                count = count + 1
                allowed = 1
            end
            redis.call('PEXPIRE', key, window)

            local oldest = now
            local first = redis.call('ZRANGE', key, 0, 0, 'WITHSCORES')
            if first[2] then
                oldest = tonumber(first[2])
            end
            return {allowed, count, oldest}
            """;

    private static final RedisScript<List<Object>> SCRIPT = slidingWindowScript();

    private final StringRedisTemplate redisTemplate;
    private final GatewayProperties properties;
    private final Clock clock;

    public RedisRateLimiter(StringRedisTemplate redisTemplate, GatewayProperties properties, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public RateLimitResult check(String tenantId, PlanTier planTier, Integer override) {
        int limit = RateLimits.effectiveLimit(properties, planTier, override);
        long windowMs = properties.getRateLimit().getWindowSeconds() * 1000L;
        long now = clock.millis();
        String redisKey = redisKey(tenantId, planTier);

        List<?> reply;
        try {
            reply = redisTemplate.execute(SCRIPT, List.of(redisKey),
                    String.valueOf(now), String.valueOf(windowMs), String.valueOf(limit),
                    now + ":" + UUID.randomUUID());
        } catch (RuntimeException e) {
            log.warn("Redis 限流检查失败，放行请求: tenant={}, error={}", tenantId, e.getMessage());
            return failOpen(limit, now, windowMs);
        }
        if (reply == null || reply.size() < 3) {
            log.warn("Redis 限流脚本返回异常结果 {}，放行请求: tenant={}", reply, tenantId);
            return failOpen(limit, now, windowMs);
        }

        boolean allowed = toLong(reply.get(0)) == 1L;
        long count = toLong(reply.get(1));
        long oldest = toLong(reply.get(2));
        Instant resetAt = Instant.ofEpochMilli(oldest + windowMs);

        if (!allowed) {
            long retryAfter = RateLimits.retryAfterSeconds(oldest + windowMs - now);
            log.debug("租户 {} 已达速率限制 ({}/{}), {} 秒后可重试", tenantId, count, limit, retryAfter);
            return RateLimitResult.builder()
                    .allowed(false)
                    .limit(limit)
                    .remaining(0)
                    .resetAt(resetAt)
                    .retryAfter(retryAfter)
                    .build();
        }
        return RateLimitResult.builder()
                .allowed(true)
                .limit(limit)
                .remaining((int) Math.max(0, limit - count))
                .resetAt(resetAt)
                .build();
    }

    @Override
    public long currentUsage(String tenantId, PlanTier planTier) {
        long windowStart = clock.millis() - properties.getRateLimit().getWindowSeconds() * 1000L;
        try {
            Long count = redisTemplate.opsForZSet()
                    .count(redisKey(tenantId, planTier), windowStart + 1, Double.POSITIVE_INFINITY);
            return count != null ? count : 0;
        } catch (RuntimeException e) {
            log.warn("读取 Redis 限流用量失败: tenant={}, error={}", tenantId, e.getMessage());
            return 0;
        }
    }

    @Override
    public String getBackendName() {
        return "redis";
    }

    private String redisKey(String tenantId, PlanTier planTier) {
        return properties.getRateLimit().getKeyPrefix() + RateLimits.slotKey(tenantId, planTier);
    }

    private RateLimitResult failOpen(int limit, long now, long windowMs) {
        return RateLimitResult.builder()
                .allowed(true)
                .limit(limit)
                .remaining(Math.max(0, limit - 1))
                .resetAt(Instant.ofEpochMilli(now + windowMs))
                .build();
    }

    private static long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }

    /** Lua 返回多值数组，结果类型只能按 List 声明 */
    @SuppressWarnings("unchecked")
    private static RedisScript<List<Object>> slidingWindowScript() {
        DefaultRedisScript<?> script = new DefaultRedisScript<>(SLIDING_WINDOW_SCRIPT, List.class);
        return (RedisScript<List<Object>>) script;
    }
}

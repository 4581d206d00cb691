package com.uniclass.gateway.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 限流检查结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitResult {

    private boolean allowed;

    /** 当前生效的窗口上限 */
    private int limit;

    /** 窗口内剩余可用次数 */
    private int remaining;

    /** 窗口内最早一次请求滑出窗口的时刻 */
    private Instant resetAt;

    /** 被拒绝时距离可重试的秒数，放行时为 null */
    private Long retryAfter;

    /**
     * 生成限流响应头。
     */
    public Map<String, String> toHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-RateLimit-Limit", String.valueOf(limit));
        headers.put("X-RateLimit-Remaining", String.valueOf(remaining));
        headers.put("X-RateLimit-Reset", String.valueOf(resetAt.getEpochSecond()));
        if (!allowed && retryAfter != null) {
            headers.put("Retry-After", String.valueOf(retryAfter));
        }
        return headers;
    }
}

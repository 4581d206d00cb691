package com.uniclass.gateway.config;

import com.uniclass.common.model.PlanTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * 网关配置项。
 */
@Data
@ConfigurationProperties(prefix = "uniclass.gateway")
public class GatewayProperties {

    /** 限流与缓存的存储类型: memory（单机） / redis（分布式） */
    private String storageType = "memory";

    /** 配额存储类型: memory（单机） / keystore（持久化） */
    private String quotaStorageType = "memory";

    /** 服务环境: live / test，决定接受哪种前缀的 Key */
    private String environment = "test";

    /** 旧版共享密钥，为空表示关闭 */
    private String legacyApiKey = "";

    /** 单实例最大在途检索请求数 */
    private int maxConcurrent = 10;

    /** 单个请求的整体截止时间（秒），覆盖排队与全部检索调用 */
    private int requestTimeoutSeconds = 30;

    /** 未指定 top_k 时的默认值 */
    private int defaultTopK = 10;

    /** top_k 上限 */
    private int maxTopK = 100;

    private RateLimit rateLimit = new RateLimit();

    private Quota quota = new Quota();

    private Cache cache = new Cache();

    public boolean isLive() {
        return "live".equalsIgnoreCase(environment) || "production".equalsIgnoreCase(environment);
    }

    @Data
    public static class RateLimit {

        /** 滑动窗口大小（秒） */
        private int windowSeconds = 60;

        /** Redis key 前缀 */
        private String keyPrefix = "uniclass:ratelimit:";

        /** 按套餐覆盖每窗口请求上限，未配置的档位使用默认值 */
        private Map<PlanTier, Integer> limits = new EnumMap<>(PlanTier.class);

        public int limitFor(PlanTier tier) {
            Integer configured = limits.get(tier);
            return configured != null ? configured : tier.getRequestsPerMinute();
        }
    }

    @Data
    public static class Quota {

        /** 配额存储故障时是否放行（默认拒绝） */
        private boolean failOpen = false;

        /** 用量达到该百分比时在 usage 信息中给出提醒 */
        private double warningThreshold = 80.0;

        /** 按套餐覆盖每月查询上限 */
        private Map<PlanTier, Long> limits = new EnumMap<>(PlanTier.class);

        public long limitFor(PlanTier tier) {
            Long configured = limits.get(tier);
            return configured != null ? configured : tier.getMonthlyQueries();
        }
    }

    @Data
    public static class Cache {

        /** 内存缓存最大条目数 */
        private int maxEntries = 1000;

        /** Redis key 前缀 */
        private String keyPrefix = "uniclass:cache:";

        /** 按套餐覆盖缓存 TTL（秒） */
        private Map<PlanTier, Long> ttlSeconds = new EnumMap<>(PlanTier.class);

        public long ttlFor(PlanTier tier) {
            Long configured = ttlSeconds.get(tier);
            return configured != null ? configured : tier.getCacheTtlSeconds();
        }
    }
}

package com.uniclass.gateway.service;

import com.uniclass.common.dto.ApiKeyRequest;
import com.uniclass.common.dto.BatchSearchResponse;
import com.uniclass.common.dto.GatewayResult;
import com.uniclass.common.dto.HealthResponse;
import com.uniclass.common.dto.IndexStats;
import com.uniclass.common.dto.InfoRequest;
import com.uniclass.common.dto.SearchHit;
import com.uniclass.common.dto.SearchRequest;
import com.uniclass.common.dto.SingleSearchResponse;
import com.uniclass.common.dto.UsageReport;
import com.uniclass.common.exception.ErrorCode;
import com.uniclass.common.exception.QuotaUnavailableException;
import com.uniclass.common.exception.SearchEngineException;
import com.uniclass.common.model.PlanTier;
import com.uniclass.common.model.Tenant;
import com.uniclass.gateway.auth.AuthGate;
import com.uniclass.gateway.auth.AuthResult;
import com.uniclass.gateway.cache.CacheLookup;
import com.uniclass.gateway.cache.ResponseCache;
import com.uniclass.gateway.config.GatewayProperties;
import com.uniclass.gateway.keystore.KeyStore;
import com.uniclass.gateway.quota.QuotaStatus;
import com.uniclass.gateway.quota.QuotaTracker;
import com.uniclass.gateway.ratelimit.RateLimitResult;
import com.uniclass.gateway.ratelimit.RateLimiter;
import com.uniclass.gateway.ratelimit.RateLimits;
import com.uniclass.search.engine.SearchEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * 请求编排：鉴权 → 限流 → 参数校验 → 配额 → 缓存 / 检索 → 记录用量。
 * <p>
 * 核心策略：
 * - 用 Semaphore 控制单实例在途检索请求数，截止时间前拿不到许可则返回 SERVICE_UNAVAILABLE
 * - 限流在鉴权之后、参数校验之前检查，批量请求只计一次
 * - 配额按查询条数整体检查，批量请求不做部分放行
 * - 批量中任一查询失败则整批失败，不记录用量
 * <p>
 * 所有校验失败都以 {@link GatewayResult} 返回，不向传输层抛出异常。
 */
@Slf4j
@Service
public class RequestOrchestrator {

    static final String ACTION_SINGLE = "single";
    static final String ACTION_BATCH = "batch";

    private final AuthGate authGate;
    private final RateLimiter rateLimiter;
    private final QuotaTracker quotaTracker;
    private final ResponseCache responseCache;
    private final BoundedSearchExecutor searchExecutor;
    private final SearchEngine searchEngine;
    private final ApiKeyActionHandler apiKeyActionHandler;
    private final KeyStore keyStore;
    private final GatewayProperties properties;

    /** 在途检索请求许可 */
    private final Semaphore inFlight;

    public RequestOrchestrator(AuthGate authGate,
                               RateLimiter rateLimiter,
                               QuotaTracker quotaTracker,
                               ResponseCache responseCache,
                               BoundedSearchExecutor searchExecutor,
                               SearchEngine searchEngine,
                               ApiKeyActionHandler apiKeyActionHandler,
                               Optional<KeyStore> keyStore,
                               GatewayProperties properties) {
        this.authGate = authGate;
        this.rateLimiter = rateLimiter;
        this.quotaTracker = quotaTracker;
        this.responseCache = responseCache;
        this.searchExecutor = searchExecutor;
        this.searchEngine = searchEngine;
        this.apiKeyActionHandler = apiKeyActionHandler;
        this.keyStore = keyStore.orElse(null);
        this.properties = properties;
        this.inFlight = new Semaphore(Math.max(1, properties.getMaxConcurrent()), true);
    }

    public AuthResult authenticate(String credential) {
        return authGate.authenticate(credential);
    }

    // ==================== 检索 ====================

    /**
     * 单条 / 批量检索。
     */
    public GatewayResult handleSearch(SearchRequest request, AuthResult auth) {
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + TimeUnit.SECONDS.toNanos(properties.getRequestTimeoutSeconds());

        if (!auth.isAuthenticated()) {
            return GatewayResult.error(auth.getError());
        }

        if (!acquirePermit(deadlineNanos)) {
            log.warn("在途请求已达上限 {}，拒绝租户 {} 的请求", properties.getMaxConcurrent(), auth.getTenant().getId());
            return GatewayResult.error(ErrorCode.SERVICE_UNAVAILABLE, "Server is busy, please retry later");
        }
        try {
            SearchRequest body = request != null ? request : new SearchRequest();
            return doSearch(body, auth.getTenant(), auth.getRateLimitOverride(), startNanos, deadlineNanos);
        } catch (RuntimeException e) {
            log.error("检索请求处理异常: tenant={}", auth.getTenant().getId(), e);
            return GatewayResult.error(ErrorCode.INTERNAL_ERROR, "Internal error", reason(e.getMessage()));
        } finally {
            inFlight.release();
        }
    }

    private GatewayResult doSearch(SearchRequest request, Tenant tenant, Integer rateLimitOverride,
                                   long startNanos, long deadlineNanos) {
        String tenantId = tenant.getId();
        PlanTier plan = tenant.getPlanTier();

        RateLimitResult rate = rateLimiter.check(tenantId, plan, rateLimitOverride);
        if (!rate.isAllowed()) {
            log.debug("租户 {} 触发限流，{} 秒后可重试", tenantId, rate.getRetryAfter());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("retry_after", rate.getRetryAfter());
            return GatewayResult.error(ErrorCode.RATE_LIMITED, "Rate limit exceeded", details)
                    .withHeaders(rate.toHeaders());
        }

        String action = resolveAction(request);
        if (!ACTION_SINGLE.equals(action) && !ACTION_BATCH.equals(action)) {
            return GatewayResult.error(ErrorCode.INVALID_ACTION, "Unknown action: " + action)
                    .withHeaders(rate.toHeaders());
        }

        List<String> queries;
        if (ACTION_SINGLE.equals(action)) {
            if (isBlank(request.getQuery())) {
                return GatewayResult.error(ErrorCode.MISSING_PARAM, "Missing 'query'").withHeaders(rate.toHeaders());
            }
            queries = List.of(request.getQuery());
        } else {
            if (request.getQueries() == null || request.getQueries().isEmpty()) {
                return GatewayResult.error(ErrorCode.MISSING_PARAM, "Missing 'queries'").withHeaders(rate.toHeaders());
            }
            if (request.getQueries().stream().anyMatch(RequestOrchestrator::isBlank)) {
                return GatewayResult.error(ErrorCode.INVALID_PARAM, "'queries' must not contain blank entries")
                        .withHeaders(rate.toHeaders());
            }
            queries = request.getQueries();
        }

        int topK = request.getTopK() != null ? request.getTopK() : properties.getDefaultTopK();
        if (topK < 1 || topK > properties.getMaxTopK()) {
            return GatewayResult.error(ErrorCode.INVALID_PARAM,
                    "'top_k' must be between 1 and " + properties.getMaxTopK()).withHeaders(rate.toHeaders());
        }

        QuotaStatus quota;
        try {
            quota = quotaTracker.checkQuota(tenantId, plan);
        } catch (QuotaUnavailableException e) {
            return GatewayResult.error(ErrorCode.QUOTA_UNAVAILABLE, "Quota service unavailable", reason(e.getMessage()))
                    .withHeaders(rate.toHeaders());
        }
        if (quota.getRemaining() < queries.size()) {
            log.debug("租户 {} 配额不足: 剩余 {}，请求 {}", tenantId, quota.getRemaining(), queries.size());
            return GatewayResult.error(ErrorCode.QUOTA_EXCEEDED, "Monthly quota exceeded", quotaDetails(quota, queries.size(), plan))
                    .withHeaders(rate.toHeaders())
                    .withHeaders(quota.toHeaders());
        }

        Map<String, List<SearchHit>> results = new LinkedHashMap<>();
        int cacheHits = 0;
        try {
            for (String query : queries) {
                CacheLookup cached = responseCache.get(query, topK, tenantId);
                if (cached.isHit()) {
                    results.put(query, cached.getData());
                    cacheHits++;
                } else {
                    List<SearchHit> hits = searchExecutor.search(query, topK, deadlineNanos);
                    responseCache.set(query, topK, hits, tenantId, plan);
                    results.put(query, hits);
                }
            }
        } catch (SearchTimeoutException e) {
            return GatewayResult.error(ErrorCode.SEARCH_FAILED, "Search timed out", reason("timeout"))
                    .withHeaders(rate.toHeaders());
        } catch (SearchEngineException e) {
            log.error("租户 {} 检索失败: {}", tenantId, e.getMessage());
            return GatewayResult.error(ErrorCode.SEARCH_FAILED, "Search failed", reason(e.getMessage()))
                    .withHeaders(rate.toHeaders());
        }

        quotaTracker.recordUsage(tenantId, queries.size());
        QuotaStatus after = QuotaStatus.of(quota.getUsed() + queries.size(), quota.getLimit(), quota.getResetDate());
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        Object body;
        if (ACTION_SINGLE.equals(action)) {
            List<SearchHit> hits = results.get(queries.get(0));
            body = SingleSearchResponse.builder()
                    .query(queries.get(0))
                    .topK(topK)
                    .count(hits.size())
                    .results(hits)
                    .cached(cacheHits == 1)
                    .latencyMs(latencyMs)
                    .build();
        } else {
            body = BatchSearchResponse.builder()
                    .queries(queries)
                    .topK(topK)
                    .count(queries.size())
                    .results(results)
                    .cacheHits(cacheHits)
                    .cached(cacheHits == queries.size())
                    .latencyMs(latencyMs)
                    .build();
        }
        log.debug("租户 {} 检索完成: {} 条查询，命中缓存 {}，耗时 {}ms", tenantId, queries.size(), cacheHits, latencyMs);
        return GatewayResult.ok(body)
                .withHeaders(rate.toHeaders())
                .withHeaders(after.toHeaders());
    }

    // ==================== 信息查询 ====================

    /**
     * stats / usage / cache / clear_cache，默认 stats。
     */
    public GatewayResult handleInfo(InfoRequest request, AuthResult auth) {
        if (!auth.isAuthenticated()) {
            return GatewayResult.error(auth.getError());
        }
        Tenant tenant = auth.getTenant();
        String action = request == null || isBlank(request.getAction()) ? "stats" : request.getAction();

        switch (action) {
            case "stats":
                try {
                    return GatewayResult.ok(searchEngine.stats());
                } catch (SearchEngineException e) {
                    log.error("获取索引概况失败: {}", e.getMessage());
                    return GatewayResult.error(ErrorCode.SEARCH_FAILED, "Failed to load index stats", reason(e.getMessage()));
                }
            case "usage":
                return usage(tenant, auth.getRateLimitOverride());
            case "cache":
                return GatewayResult.ok(responseCache.stats(tenant.getId()));
            case "clear_cache":
                int deleted = responseCache.clearTenant(tenant.getId());
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("status", "cleared");
                body.put("deleted", deleted);
                return GatewayResult.ok(body);
            default:
                return GatewayResult.error(ErrorCode.INVALID_ACTION, "Unknown action: " + action);
        }
    }

    private GatewayResult usage(Tenant tenant, Integer rateLimitOverride) {
        PlanTier plan = tenant.getPlanTier();
        QuotaStatus quota;
        try {
            quota = quotaTracker.checkQuota(tenant.getId(), plan);
        } catch (QuotaUnavailableException e) {
            return GatewayResult.error(ErrorCode.QUOTA_UNAVAILABLE, "Quota service unavailable", reason(e.getMessage()));
        }
        boolean warning = quota.reachedThreshold(properties.getQuota().getWarningThreshold());
        PlanTier suggestion = warning ? quotaTracker.upgradeSuggestion(plan) : null;

        UsageReport report = UsageReport.builder()
                .planTier(plan.value())
                .totalQueries(quota.getUsed())
                .quotaLimit(quota.getLimit())
                .quotaRemaining(quota.getRemaining())
                .quotaReset(quota.getResetDate())
                .percentageUsed(quota.getPercentageUsed())
                .quotaWarning(warning)
                .upgradeSuggestion(suggestion != null ? suggestion.value() : null)
                .rateLimit(RateLimits.effectiveLimit(properties, plan, rateLimitOverride))
                .rateLimitUsed(rateLimiter.currentUsage(tenant.getId(), plan))
                .rateLimitWindowSeconds(properties.getRateLimit().getWindowSeconds())
                .build();
        return GatewayResult.ok(report).withHeaders(quota.toHeaders());
    }

    // ==================== Key 管理 ====================

    public GatewayResult handleApiKeyAction(ApiKeyRequest request, AuthResult auth) {
        if (!auth.isAuthenticated()) {
            return GatewayResult.error(auth.getError());
        }
        return apiKeyActionHandler.handle(request != null ? request : new ApiKeyRequest(), auth);
    }

    // ==================== 健康检查 ====================

    /**
     * 无需鉴权。检索服务不可达时返回 degraded，但仍是 200。
     */
    public GatewayResult health() {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("search", searchExecutor.getEngineName());
        services.put("keystore", keyStore != null ? keyStore.getStoreName() : "none");
        services.put("rate_limiter", rateLimiter.getBackendName());
        services.put("quota", quotaTracker.getBackendName());
        services.put("cache", responseCache.getBackendName());

        HealthResponse.HealthResponseBuilder health = HealthResponse.builder().services(services);
        try {
            IndexStats stats = searchEngine.stats();
            health.status(HealthResponse.HEALTHY)
                    .itemsIndexed(stats.getTotalItems())
                    .embeddingDim(stats.getEmbeddingDim());
        } catch (SearchEngineException e) {
            log.warn("健康检查: 检索服务不可达: {}", e.getMessage());
            health.status(HealthResponse.DEGRADED);
        }
        return GatewayResult.ok(health.build());
    }

    // ==================== 内部方法 ====================

    private boolean acquirePermit(long deadlineNanos) {
        try {
            return inFlight.tryAcquire(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * 未显式指定 action 时，带 queries 视为批量，否则视为单条。
     */
    private static String resolveAction(SearchRequest request) {
        if (!isBlank(request.getAction())) {
            return request.getAction().trim().toLowerCase(Locale.ROOT);
        }
        return request.getQueries() != null ? ACTION_BATCH : ACTION_SINGLE;
    }

    private Map<String, Object> quotaDetails(QuotaStatus quota, int requested, PlanTier plan) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("used", quota.getUsed());
        details.put("limit", quota.getLimit());
        details.put("remaining", quota.getRemaining());
        details.put("requested", requested);
        details.put("reset_date", quota.getResetDate().toString());
        PlanTier suggestion = quotaTracker.upgradeSuggestion(plan);
        if (suggestion != null) {
            details.put("upgrade_suggestion", suggestion.value());
        }
        return details;
    }

    static Map<String, Object> reason(String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", message);
        return details;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

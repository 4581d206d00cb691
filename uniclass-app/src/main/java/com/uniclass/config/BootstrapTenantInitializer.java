package com.uniclass.config;

import com.uniclass.common.model.PlanTier;
import com.uniclass.common.model.Tenant;
import com.uniclass.common.util.Digests;
import com.uniclass.gateway.auth.ApiKeyService;
import com.uniclass.gateway.auth.CreatedApiKey;
import com.uniclass.gateway.config.GatewayProperties;
import com.uniclass.gateway.keystore.KeyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 应用启动时按配置创建种子租户，并在它没有任何 Key 时生成第一个 Key。
 * <p>
 * 配置方式（在 application.yml 中）：
 * uniclass.bootstrap.tenant-id=acme
 * uniclass.bootstrap.tenant-name=Acme Inc.
 * uniclass.bootstrap.plan-tier=starter
 * <p>
 * 或通过环境变量：UNICLASS_BOOTSTRAP_TENANT_ID=acme
 */
@Slf4j
@Component
public class BootstrapTenantInitializer implements CommandLineRunner {

    private final GatewayProperties gatewayProperties;
    private final KeyStore keyStore;
    private final ApiKeyService apiKeyService;

    @Value("${uniclass.bootstrap.tenant-id:}")
    private String tenantId;

    @Value("${uniclass.bootstrap.tenant-name:}")
    private String tenantName;

    @Value("${uniclass.bootstrap.plan-tier:free}")
    private String planTier;

    public BootstrapTenantInitializer(GatewayProperties gatewayProperties, Optional<KeyStore> keyStore,
                                      ApiKeyService apiKeyService) {
        this.gatewayProperties = gatewayProperties;
        this.keyStore = keyStore.orElse(null);
        this.apiKeyService = apiKeyService;
    }

    @Override
    public void run(String... args) {
        boolean legacyEnabled = gatewayProperties.getLegacyApiKey() != null
                && !gatewayProperties.getLegacyApiKey().isBlank();

        if (keyStore == null && !legacyEnabled) {
            log.warn("==============================================");
            log.warn("  未配置任何鉴权方式，所有请求都会被拒绝！");
            log.warn("  请设置 uniclass.keystore.type: jdbc | memory");
            log.warn("  或设置 uniclass.gateway.legacy-api-key");
            log.warn("==============================================");
            return;
        }
        if (legacyEnabled) {
            log.info("旧版共享密钥已启用: {}", Digests.mask(gatewayProperties.getLegacyApiKey()));
        }
        if (keyStore == null || tenantId == null || tenantId.isBlank()) {
            return;
        }

        if (keyStore.lookupTenant(tenantId).isEmpty()) {
            keyStore.saveTenant(Tenant.builder()
                    .id(tenantId)
                    .name(tenantName == null || tenantName.isBlank() ? tenantId : tenantName)
                    .planTier(PlanTier.fromValue(planTier))
                    .build());
            log.info("已创建种子租户 {}（{}）", tenantId, planTier);
        }

        // 仅在租户没有 Key 时生成（避免重启时重复生成）
        if (!keyStore.listApiKeys(tenantId).isEmpty()) {
            log.info("租户 {} 已有 Key，跳过初始化", tenantId);
            return;
        }
        CreatedApiKey created = apiKeyService.createKey(tenantId, tenantId, "Bootstrap Key", null, null, null);
        log.warn("==============================================");
        log.warn("  已为租户 {} 生成初始 Key（{}***），只显示这一次：", tenantId, created.getApiKey().getKeyPrefix());
        log.warn("  {}", created.getRawKey());
        log.warn("==============================================");
    }
}

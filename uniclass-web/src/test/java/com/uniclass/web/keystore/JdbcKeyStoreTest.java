package com.uniclass.web.keystore;

import com.uniclass.common.exception.KeyStoreException;
import com.uniclass.common.model.ApiKey;
import com.uniclass.common.model.PlanTier;
import com.uniclass.common.model.SubscriptionStatus;
import com.uniclass.common.model.Tenant;
import com.uniclass.web.entity.ApiKeyEntity;
import com.uniclass.web.entity.MonthlyUsageEntity;
import com.uniclass.web.entity.TenantEntity;
import com.uniclass.web.repository.ApiKeyRepository;
import com.uniclass.web.repository.MonthlyUsageRepository;
import com.uniclass.web.repository.TenantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("JdbcKeyStore")
@ExtendWith(MockitoExtension.class)
class JdbcKeyStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    @Mock
    private TenantRepository tenantRepo;

    @Mock
    private ApiKeyRepository apiKeyRepo;

    @Mock
    private MonthlyUsageRepository usageRepo;

    private JdbcKeyStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcKeyStore(tenantRepo, apiKeyRepo, usageRepo, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Tenants")
    class TenantTests {

        @Test
        @DisplayName("should insert a new tenant with a generated id")
        void shouldInsertTenant() {
            when(tenantRepo.save(any(TenantEntity.class))).thenAnswer(inv -> inv.getArgument(0));

            Tenant saved = store.saveTenant(Tenant.builder().name("Acme").planTier(PlanTier.STARTER).build());

            ArgumentCaptor<TenantEntity> entity = ArgumentCaptor.forClass(TenantEntity.class);
            verify(tenantRepo).save(entity.capture());
            assertTrue(entity.getValue().isNew());
            assertEquals("starter", entity.getValue().getPlanTier());
            assertEquals(NOW.toEpochMilli(), entity.getValue().getCreatedAt());
            assertTrue(saved.getId().startsWith("tnt-"));
        }

        @Test
        @DisplayName("should update an existing tenant and keep its creation time")
        void shouldUpdateTenant() {
            TenantEntity existing = TenantEntity.builder().id("tenant-a").name("Acme").planTier("free")
                    .subscriptionStatus("active").createdAt(1_000L).build();
            when(tenantRepo.existsById("tenant-a")).thenReturn(true);
            when(tenantRepo.findById("tenant-a")).thenReturn(Optional.of(existing));
            when(tenantRepo.save(any(TenantEntity.class))).thenAnswer(inv -> inv.getArgument(0));

            Tenant saved = store.saveTenant(Tenant.builder().id("tenant-a").name("Acme")
                    .planTier(PlanTier.PROFESSIONAL).subscriptionStatus(SubscriptionStatus.PAST_DUE).build());

            ArgumentCaptor<TenantEntity> entity = ArgumentCaptor.forClass(TenantEntity.class);
            verify(tenantRepo).save(entity.capture());
            assertFalse(entity.getValue().isNew());
            assertEquals(1_000L, entity.getValue().getCreatedAt());
            assertEquals(SubscriptionStatus.PAST_DUE, saved.getSubscriptionStatus());
        }

        @Test
        @DisplayName("should map stored values back to the model")
        void shouldLookupTenant() {
            when(tenantRepo.findById("tenant-a")).thenReturn(Optional.of(TenantEntity.builder()
                    .id("tenant-a").name("Acme").planTier("enterprise").subscriptionStatus("trialing").build()));

            Tenant tenant = store.lookupTenant("tenant-a").get();

            assertEquals(PlanTier.ENTERPRISE, tenant.getPlanTier());
            assertEquals(SubscriptionStatus.TRIALING, tenant.getSubscriptionStatus());
        }
    }

    @Nested
    @DisplayName("API keys")
    class ApiKeyTests {

        @Test
        @DisplayName("should insert keys as active with joined scopes")
        void shouldCreateKey() {
            when(apiKeyRepo.save(any(ApiKeyEntity.class))).thenAnswer(inv -> inv.getArgument(0));
            Instant expiry = Instant.parse("2026-01-01T00:00:00Z");

            ApiKey created = store.createApiKey(ApiKey.builder()
                    .tenantId("tenant-a").name("ci").keyHash("hash-1").keyPrefix("uc_test_abcd")
                    .scopes(List.of("search", "admin")).rateLimitOverride(5).expiresAt(expiry).build());

            ArgumentCaptor<ApiKeyEntity> entity = ArgumentCaptor.forClass(ApiKeyEntity.class);
            verify(apiKeyRepo).save(entity.capture());
            assertTrue(entity.getValue().isNew());
            assertEquals("search,admin", entity.getValue().getScopes());
            assertEquals(1, entity.getValue().getActive());
            assertEquals(expiry.toEpochMilli(), entity.getValue().getExpiresAt());
            assertEquals(List.of("search", "admin"), created.getScopes());
            assertEquals(expiry, created.getExpiresAt());
            assertEquals(NOW, created.getCreatedAt());
            assertTrue(created.isActive());
        }

        @Test
        @DisplayName("should map a revoked row to an inactive key")
        void shouldMapInactiveKey() {
            when(apiKeyRepo.findByKeyHash("hash-1")).thenReturn(Optional.of(ApiKeyEntity.builder()
                    .id("key-1").tenantId("tenant-a").keyHash("hash-1").scopes("").active(0).build()));

            ApiKey key = store.lookupApiKeyByHash("hash-1").get();

            assertFalse(key.isActive());
            assertTrue(key.getScopes().isEmpty());
            assertNull(key.getExpiresAt());
        }

        @Test
        @DisplayName("should report whether a revoke matched a row")
        void shouldRevoke() {
            when(apiKeyRepo.deactivate("key-1")).thenReturn(1);
            when(apiKeyRepo.deactivate("key-9")).thenReturn(0);

            assertTrue(store.revokeApiKey("key-1"));
            assertFalse(store.revokeApiKey("key-9"));
        }

        @Test
        @DisplayName("should deactivate before inserting the replacement")
        void shouldRotate() {
            when(apiKeyRepo.save(any(ApiKeyEntity.class))).thenAnswer(inv -> inv.getArgument(0));

            ApiKey replacement = store.rotateApiKey("key-1", ApiKey.builder()
                    .tenantId("tenant-a").name("ci (rotated)").keyHash("hash-2").build());

            InOrder order = inOrder(apiKeyRepo);
            order.verify(apiKeyRepo).deactivate("key-1");
            order.verify(apiKeyRepo).save(any(ApiKeyEntity.class));
            assertTrue(replacement.getId().startsWith("key-"));
        }

        @Test
        @DisplayName("should translate database errors")
        void shouldTranslateErrors() {
            when(apiKeyRepo.findByKeyHash(anyString())).thenThrow(new DataAccessResourceFailureException("database is locked"));

            KeyStoreException e = assertThrows(KeyStoreException.class, () -> store.lookupApiKeyByHash("hash-1"));

            assertTrue(e.getMessage().contains("database is locked"));
        }
    }

    @Nested
    @DisplayName("Monthly usage")
    class UsageTests {

        @Test
        @DisplayName("should upsert and return the new total")
        void shouldIncrement() {
            when(usageRepo.findById("tenant-a:2025-03")).thenReturn(Optional.of(MonthlyUsageEntity.builder()
                    .id("tenant-a:2025-03").tenantId("tenant-a").month("2025-03").queryCount(7L).build()));

            long total = store.incrementMonthlyUsage("tenant-a", YearMonth.of(2025, 3), 2);

            verify(usageRepo).increment("tenant-a:2025-03", "tenant-a", "2025-03", 2);
            assertEquals(7, total);
        }

        @Test
        @DisplayName("should read zero for a month without a row")
        void shouldReadZero() {
            when(usageRepo.findById(anyString())).thenReturn(Optional.empty());

            assertEquals(0, store.getMonthlyUsage("tenant-a", YearMonth.of(2025, 4)));
        }
    }
}

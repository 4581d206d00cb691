package com.uniclass.gateway.keystore;

import com.uniclass.common.model.ApiKey;
import com.uniclass.common.model.PlanTier;
import com.uniclass.common.model.SubscriptionStatus;
import com.uniclass.common.model.Tenant;
import com.uniclass.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("InMemoryKeyStore")
class InMemoryKeyStoreTest {

    private MutableClock clock;
    private InMemoryKeyStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-10T12:00:00Z");
        store = new InMemoryKeyStore(clock);
    }

    private ApiKey newKey(String tenantId, String hash) {
        return ApiKey.builder().tenantId(tenantId).name("ci").keyHash(hash).keyPrefix("uc_test_abcd").build();
    }

    @Test
    @DisplayName("should assign an id to new tenants")
    void shouldSaveTenant() {
        Tenant saved = store.saveTenant(Tenant.builder().name("Acme").build());

        assertTrue(saved.getId().startsWith("tnt-"));
        assertTrue(store.lookupTenant(saved.getId()).isPresent());
    }

    @Test
    @DisplayName("should not let callers change stored tenants through their references")
    void shouldStoreTenantCopies() {
        Tenant input = Tenant.builder().id("tenant-a").planTier(PlanTier.STARTER).build();
        Tenant saved = store.saveTenant(input);

        input.setPlanTier(PlanTier.ENTERPRISE);
        saved.setSubscriptionStatus(SubscriptionStatus.CANCELED);
        store.lookupTenant("tenant-a").get().setPlanTier(PlanTier.FREE);

        Tenant stored = store.lookupTenant("tenant-a").get();
        assertEquals(PlanTier.STARTER, stored.getPlanTier());
        assertEquals(SubscriptionStatus.ACTIVE, stored.getSubscriptionStatus());
    }

    @Test
    @DisplayName("should find keys by digest")
    void shouldLookupByHash() {
        ApiKey created = store.createApiKey(newKey("tenant-a", "hash-1"));

        assertEquals(created.getId(), store.lookupApiKeyByHash("hash-1").get().getId());
        assertFalse(store.lookupApiKeyByHash("hash-2").isPresent());
    }

    @Test
    @DisplayName("should record last use")
    void shouldTouchLastUsed() {
        ApiKey created = store.createApiKey(newKey("tenant-a", "hash-1"));
        clock.advance(Duration.ofMinutes(5));

        store.touchLastUsed(created.getId());

        assertEquals(Instant.parse("2025-03-10T12:05:00Z"),
                store.lookupApiKeyByHash("hash-1").get().getLastUsedAt());
    }

    @Test
    @DisplayName("should revoke permanently and report unknown ids")
    void shouldRevoke() {
        ApiKey created = store.createApiKey(newKey("tenant-a", "hash-1"));

        assertTrue(store.revokeApiKey(created.getId()));
        assertFalse(store.lookupApiKeyByHash("hash-1").get().isActive());
        assertFalse(store.revokeApiKey("key-missing"));
    }

    @Test
    @DisplayName("should rotate by revoking the old key and creating the replacement")
    void shouldRotate() {
        ApiKey old = store.createApiKey(newKey("tenant-a", "hash-1"));

        ApiKey replacement = store.rotateApiKey(old.getId(), newKey("tenant-a", "hash-2"));

        assertNotNull(replacement.getId());
        assertFalse(store.lookupApiKeyByHash("hash-1").get().isActive());
        assertTrue(store.lookupApiKeyByHash("hash-2").get().isActive());
        assertEquals(2, store.listApiKeys("tenant-a").size());
    }

    @Test
    @DisplayName("should accumulate usage per tenant and month")
    void shouldTrackMonthlyUsage() {
        YearMonth march = YearMonth.of(2025, 3);

        assertEquals(3, store.incrementMonthlyUsage("tenant-a", march, 3));
        assertEquals(5, store.incrementMonthlyUsage("tenant-a", march, 2));
        assertEquals(5, store.getMonthlyUsage("tenant-a", march));
        assertEquals(0, store.getMonthlyUsage("tenant-a", YearMonth.of(2025, 4)));
        assertEquals(0, store.getMonthlyUsage("tenant-b", march));
    }
}

package com.uniclass.gateway.auth;

import com.uniclass.common.exception.ErrorCode;
import com.uniclass.common.exception.KeyStoreException;
import com.uniclass.common.model.ApiKey;
import com.uniclass.common.model.PlanTier;
import com.uniclass.common.model.SubscriptionStatus;
import com.uniclass.common.model.Tenant;
import com.uniclass.gateway.config.GatewayProperties;
import com.uniclass.gateway.keystore.InMemoryKeyStore;
import com.uniclass.gateway.keystore.KeyStore;
import com.uniclass.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

@DisplayName("AuthGate")
class AuthGateTest {

    private GatewayProperties properties;
    private MutableClock clock;
    private InMemoryKeyStore keyStore;
    private ApiKeyService apiKeyService;
    private AuthGate authGate;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        clock = MutableClock.at("2025-03-10T12:00:00Z");
        keyStore = new InMemoryKeyStore(clock);
        keyStore.saveTenant(Tenant.builder().id("tenant-a").name("Acme").planTier(PlanTier.STARTER).build());
        apiKeyService = new ApiKeyService(properties, Optional.of(keyStore));
        authGate = new AuthGate(properties, Optional.of(keyStore), clock);
    }

    private void assertRejected(AuthResult result, ErrorCode code, String message) {
        assertFalse(result.isAuthenticated());
        assertEquals(code.name(), result.getError().getCode());
        assertEquals(message, result.getError().getError());
    }

    @Nested
    @DisplayName("Managed keys")
    class ManagedKeyTests {

        @Test
        @DisplayName("should authenticate a fresh key and resolve its tenant")
        void shouldAuthenticateValidKey() {
            CreatedApiKey created = apiKeyService.createKey("tenant-a", "user-1", "ci", null, 25, null);

            AuthResult result = authGate.authenticate("Bearer " + created.getRawKey());

            assertTrue(result.isAuthenticated());
            assertEquals("tenant-a", result.getTenant().getId());
            assertEquals(PlanTier.STARTER, result.getTenant().getPlanTier());
            assertEquals(25, result.getRateLimitOverride());
            assertNotNull(keyStore.lookupApiKeyByHash(created.getApiKey().getKeyHash()).get().getLastUsedAt());
        }

        @Test
        @DisplayName("should accept a bare key and a lowercase bearer scheme")
        void shouldAcceptBareAndLowercaseBearer() {
            CreatedApiKey created = apiKeyService.createKey("tenant-a", null, "ci", null, null, null);

            assertTrue(authGate.authenticate(created.getRawKey()).isAuthenticated());
            assertTrue(authGate.authenticate("bearer " + created.getRawKey()).isAuthenticated());
        }

        @Test
        @DisplayName("should reject a revoked key")
        void shouldRejectRevoked() {
            CreatedApiKey created = apiKeyService.createKey("tenant-a", null, "ci", null, null, null);
            apiKeyService.revokeKey(created.getApiKey().getId(), "tenant-a");

            assertRejected(authGate.authenticate(created.getRawKey()),
                    ErrorCode.INVALID_API_KEY, "API key has been revoked");
        }

        @Test
        @DisplayName("should reject a key after its expiry")
        void shouldRejectExpired() {
            CreatedApiKey created = apiKeyService.createKey("tenant-a", null, "ci", null, null,
                    Instant.parse("2025-03-11T00:00:00Z"));
            assertTrue(authGate.authenticate(created.getRawKey()).isAuthenticated());

            clock.advance(Duration.ofDays(2));

            assertRejected(authGate.authenticate(created.getRawKey()),
                    ErrorCode.INVALID_API_KEY, "API key has expired");
        }

        @Test
        @DisplayName("should reject tenants whose subscription is past due")
        void shouldRejectPastDue() {
            CreatedApiKey created = apiKeyService.createKey("tenant-a", null, "ci", null, null, null);
            keyStore.saveTenant(keyStore.lookupTenant("tenant-a").get().toBuilder()
                    .subscriptionStatus(SubscriptionStatus.PAST_DUE)
                    .build());

            assertRejected(authGate.authenticate(created.getRawKey()),
                    ErrorCode.INVALID_API_KEY, "Subscription past_due. Please update payment.");
        }

        @Test
        @DisplayName("should reject tenants whose subscription is canceled")
        void shouldRejectCanceled() {
            CreatedApiKey created = apiKeyService.createKey("tenant-a", null, "ci", null, null, null);
            keyStore.saveTenant(keyStore.lookupTenant("tenant-a").get().toBuilder()
                    .subscriptionStatus(SubscriptionStatus.CANCELED)
                    .build());

            assertRejected(authGate.authenticate(created.getRawKey()),
                    ErrorCode.INVALID_API_KEY, "Subscription canceled. Please update payment.");
        }

        @Test
        @DisplayName("should reject a key whose tenant is gone")
        void shouldRejectOrphanKey() {
            CreatedApiKey created = apiKeyService.createKey("tenant-ghost", null, "ci", null, null, null);

            assertRejected(authGate.authenticate(created.getRawKey()),
                    ErrorCode.INVALID_API_KEY, "Tenant not found");
        }

        @Test
        @DisplayName("should still authenticate when recording last use fails")
        void shouldIgnoreTouchFailure() {
            CreatedApiKey created = apiKeyService.createKey("tenant-a", null, "ci", null, null, null);
            KeyStore flaky = spy(keyStore);
            doThrow(new KeyStoreException("readonly")).when(flaky).touchLastUsed(anyString());
            AuthGate gate = new AuthGate(properties, Optional.of(flaky), clock);

            assertTrue(gate.authenticate(created.getRawKey()).isAuthenticated());
        }
    }

    @Nested
    @DisplayName("Malformed credentials")
    class MalformedTests {

        @Test
        @DisplayName("should require a credential")
        void shouldRequireCredential() {
            assertRejected(authGate.authenticate(null), ErrorCode.AUTH_REQUIRED, "Authentication required");
            assertRejected(authGate.authenticate("  "), ErrorCode.AUTH_REQUIRED, "Authentication required");
            assertRejected(authGate.authenticate("Bearer "), ErrorCode.AUTH_REQUIRED, "Authentication required");
            assertRejected(authGate.authenticate("bearer   "), ErrorCode.AUTH_REQUIRED, "Authentication required");
        }

        @Test
        @DisplayName("should not strip a scheme glued to the key")
        void shouldKeepGluedScheme() {
            assertRejected(authGate.authenticate("Beareruc_test_abc"),
                    ErrorCode.INVALID_API_KEY, "Invalid API key format");
        }

        @Test
        @DisplayName("should reject keys without a known prefix")
        void shouldRejectUnknownFormat() {
            assertRejected(authGate.authenticate("sk_abcdef"), ErrorCode.INVALID_API_KEY, "Invalid API key format");
        }

        @Test
        @DisplayName("should reject an unknown key")
        void shouldRejectUnknownKey() {
            assertRejected(authGate.authenticate("uc_test_doesnotexist"), ErrorCode.INVALID_API_KEY, "Invalid API key");
        }

        @Test
        @DisplayName("should reject live keys in a test environment")
        void shouldRejectLiveKeyInTest() {
            assertRejected(authGate.authenticate("uc_live_abcdef"),
                    ErrorCode.INVALID_API_KEY, "Live key used in test environment");
        }

        @Test
        @DisplayName("should reject test keys in a live environment")
        void shouldRejectTestKeyInLive() {
            properties.setEnvironment("live");

            assertRejected(authGate.authenticate("uc_test_abcdef"),
                    ErrorCode.INVALID_API_KEY, "Test key used in live environment");
        }
    }

    @Nested
    @DisplayName("Legacy key")
    class LegacyTests {

        @Test
        @DisplayName("should map the shared key to the legacy professional tenant")
        void shouldAcceptLegacyKey() {
            properties.setLegacyApiKey("shared-secret");

            AuthResult result = authGate.authenticate("Bearer shared-secret");

            assertTrue(result.isAuthenticated());
            assertEquals(Tenant.LEGACY_ID, result.getTenant().getId());
            assertEquals(PlanTier.PROFESSIONAL, result.getTenant().getPlanTier());
            assertNull(result.getApiKey());
            assertNull(result.getRateLimitOverride());
        }

        @Test
        @DisplayName("should work without any key store")
        void shouldAcceptLegacyWithoutStore() {
            properties.setLegacyApiKey("shared-secret");
            AuthGate gate = new AuthGate(properties, Optional.empty(), clock);

            assertTrue(gate.authenticate("shared-secret").isAuthenticated());
            assertRejected(gate.authenticate("uc_test_abc"), ErrorCode.INVALID_API_KEY, "Invalid API key");
        }
    }

    @Test
    @DisplayName("should fail closed when the key store errors")
    void shouldFailClosedOnStoreError() {
        KeyStore broken = mock(KeyStore.class);
        when(broken.lookupApiKeyByHash(anyString())).thenThrow(new KeyStoreException("db locked"));
        AuthGate gate = new AuthGate(properties, Optional.of(broken), clock);

        assertRejected(gate.authenticate("uc_test_abcdef"), ErrorCode.INVALID_API_KEY, "Validation failed");
    }

    @Test
    @DisplayName("should reject an apparently valid key never issued")
    void shouldRejectForgedKey() {
        ApiKey issued = apiKeyService.createKey("tenant-a", null, "ci", null, null, null).getApiKey();

        AuthResult result = authGate.authenticate(issued.getKeyPrefix() + "forged");

        assertFalse(result.isAuthenticated());
    }
}

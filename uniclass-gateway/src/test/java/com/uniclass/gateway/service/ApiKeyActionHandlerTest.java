package com.uniclass.gateway.service;

import com.uniclass.common.dto.ApiKeyRequest;
import com.uniclass.common.dto.CreatedKeyResponse;
import com.uniclass.common.dto.GatewayResult;
import com.uniclass.common.exception.ErrorCode;
import com.uniclass.common.exception.KeyStoreException;
import com.uniclass.common.model.ApiKey;
import com.uniclass.common.model.Tenant;
import com.uniclass.gateway.auth.ApiKeyService;
import com.uniclass.gateway.auth.AuthResult;
import com.uniclass.gateway.auth.CreatedApiKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ApiKeyActionHandler")
@ExtendWith(MockitoExtension.class)
class ApiKeyActionHandlerTest {

    @Mock
    private ApiKeyService apiKeyService;

    private ApiKeyActionHandler handler;
    private AuthResult auth;

    @BeforeEach
    void setUp() {
        handler = new ApiKeyActionHandler(apiKeyService);
        Tenant tenant = Tenant.builder().id("tenant-a").name("Acme").build();
        auth = AuthResult.success(tenant, ApiKey.builder().id("key-0").userId("user-1").build());
    }

    private static ApiKeyRequest action(String action) {
        return ApiKeyRequest.builder().action(action).build();
    }

    private static CreatedApiKey created(String id, String name) {
        return new CreatedApiKey("uc_test_secret", ApiKey.builder()
                .id(id)
                .name(name)
                .keyPrefix("uc_test_secr")
                .scopes(List.of("search"))
                .createdAt(Instant.parse("2025-03-10T12:00:00Z"))
                .build());
    }

    @Test
    @DisplayName("should be unavailable without a key store")
    void shouldRequireStore() {
        when(apiKeyService.isAvailable()).thenReturn(false);

        GatewayResult result = handler.handle(action("list"), auth);

        assertEquals(ErrorCode.SERVICE_UNAVAILABLE.name(), result.getError().getCode());
    }

    @Nested
    @DisplayName("Create")
    class CreateTests {

        @Test
        @DisplayName("should return the raw key once with a save warning")
        void shouldCreate() {
            when(apiKeyService.isAvailable()).thenReturn(true);
            when(apiKeyService.createKey(eq("tenant-a"), eq("user-1"), eq("API Key"), isNull(), isNull(), isNull()))
                    .thenReturn(created("key-1", "API Key"));

            GatewayResult result = handler.handle(action("create"), auth);

            CreatedKeyResponse body = assertInstanceOf(CreatedKeyResponse.class, result.getBody());
            assertEquals("uc_test_secret", body.getKey());
            assertEquals("uc_test_secr", body.getPrefix());
            assertEquals(CreatedKeyResponse.SAVE_WARNING, body.getWarning());
        }

        @Test
        @DisplayName("should map store errors to CREATE_FAILED")
        void shouldReportCreateFailure() {
            when(apiKeyService.isAvailable()).thenReturn(true);
            when(apiKeyService.createKey(anyString(), anyString(), anyString(), any(), any(), any()))
                    .thenThrow(new KeyStoreException("disk full"));

            GatewayResult result = handler.handle(ApiKeyRequest.builder().action("create").name("ci").build(), auth);

            assertEquals(ErrorCode.CREATE_FAILED.name(), result.getError().getCode());
            assertEquals("disk full", result.getError().getDetails().get("reason"));
        }
    }

    @Nested
    @DisplayName("List")
    class ListTests {

        @Test
        @DisplayName("should list by default")
        @SuppressWarnings("unchecked")
        void shouldListByDefault() {
            when(apiKeyService.isAvailable()).thenReturn(true);
            when(apiKeyService.listKeys("tenant-a")).thenReturn(List.of());

            GatewayResult result = handler.handle(new ApiKeyRequest(), auth);

            assertTrue(((Map<String, Object>) result.getBody()).containsKey("keys"));
        }

        @Test
        @DisplayName("should map store errors to LIST_FAILED")
        void shouldReportListFailure() {
            when(apiKeyService.isAvailable()).thenReturn(true);
            when(apiKeyService.listKeys(anyString())).thenThrow(new KeyStoreException("db locked"));

            assertEquals(ErrorCode.LIST_FAILED.name(), handler.handle(action("list"), auth).getError().getCode());
        }
    }

    @Nested
    @DisplayName("Revoke")
    class RevokeTests {

        @Test
        @DisplayName("should require key_id")
        void shouldRequireKeyId() {
            when(apiKeyService.isAvailable()).thenReturn(true);

            GatewayResult result = handler.handle(action("revoke"), auth);

            assertEquals(ErrorCode.MISSING_PARAM.name(), result.getError().getCode());
            assertEquals("Missing 'key_id'", result.getError().getError());
        }

        @Test
        @DisplayName("should report unknown keys as NOT_FOUND")
        void shouldReportNotFound() {
            when(apiKeyService.isAvailable()).thenReturn(true);
            when(apiKeyService.revokeKey("key-9", "tenant-a")).thenReturn(false);

            GatewayResult result = handler.handle(
                    ApiKeyRequest.builder().action("revoke").keyId("key-9").build(), auth);

            assertEquals(ErrorCode.NOT_FOUND.name(), result.getError().getCode());
            assertEquals(404, result.getStatus());
        }

        @Test
        @DisplayName("should confirm a revocation")
        @SuppressWarnings("unchecked")
        void shouldRevoke() {
            when(apiKeyService.isAvailable()).thenReturn(true);
            when(apiKeyService.revokeKey("key-1", "tenant-a")).thenReturn(true);

            GatewayResult result = handler.handle(
                    ApiKeyRequest.builder().action("revoke").keyId("key-1").build(), auth);

            Map<String, Object> body = (Map<String, Object>) result.getBody();
            assertEquals("revoked", body.get("status"));
            assertEquals("key-1", body.get("key_id"));
        }

        @Test
        @DisplayName("should map store errors to REVOKE_FAILED")
        void shouldReportRevokeFailure() {
            when(apiKeyService.isAvailable()).thenReturn(true);
            when(apiKeyService.revokeKey(anyString(), anyString())).thenThrow(new KeyStoreException("db locked"));

            GatewayResult result = handler.handle(
                    ApiKeyRequest.builder().action("revoke").keyId("key-1").build(), auth);

            assertEquals(ErrorCode.REVOKE_FAILED.name(), result.getError().getCode());
        }
    }

    @Nested
    @DisplayName("Rotate")
    class RotateTests {

        @Test
        @DisplayName("should name the replaced key")
        void shouldRotate() {
            when(apiKeyService.isAvailable()).thenReturn(true);
            when(apiKeyService.rotateKey("key-1", "tenant-a", "user-1"))
                    .thenReturn(Optional.of(created("key-2", "ci (rotated)")));

            GatewayResult result = handler.handle(
                    ApiKeyRequest.builder().action("rotate").keyId("key-1").build(), auth);

            CreatedKeyResponse body = (CreatedKeyResponse) result.getBody();
            assertEquals("key-2", body.getId());
            assertEquals("key-1", body.getReplacedKeyId());
        }

        @Test
        @DisplayName("should map rotation errors to CREATE_FAILED")
        void shouldReportRotateFailure() {
            when(apiKeyService.isAvailable()).thenReturn(true);
            when(apiKeyService.rotateKey(anyString(), anyString(), anyString()))
                    .thenThrow(new KeyStoreException("db locked"));

            GatewayResult result = handler.handle(
                    ApiKeyRequest.builder().action("rotate").keyId("key-1").build(), auth);

            assertEquals(ErrorCode.CREATE_FAILED.name(), result.getError().getCode());
        }
    }

    @Test
    @DisplayName("should fall back to the tenant id as user for legacy callers")
    void shouldUseTenantAsUserForLegacy() {
        when(apiKeyService.isAvailable()).thenReturn(true);
        when(apiKeyService.createKey(anyString(), anyString(), anyString(), any(), any(), any()))
                .thenReturn(created("key-1", "ci"));
        AuthResult legacy = AuthResult.success(Tenant.legacy(), null);

        handler.handle(ApiKeyRequest.builder().action("create").name("ci").build(), legacy);

        verify(apiKeyService).createKey(eq(Tenant.LEGACY_ID), eq(Tenant.LEGACY_ID), eq("ci"), any(), any(), any());
    }

    @Test
    @DisplayName("should reject unknown key actions")
    void shouldRejectUnknownAction() {
        when(apiKeyService.isAvailable()).thenReturn(true);

        GatewayResult result = handler.handle(action("delete"), auth);

        assertFalse(result.isSuccess());
        assertEquals(ErrorCode.INVALID_ACTION.name(), result.getError().getCode());
    }
}

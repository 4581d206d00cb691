package com.uniclass.web.controller;

import com.uniclass.common.dto.ApiKeyRequest;
import com.uniclass.common.dto.GatewayResult;
import com.uniclass.common.dto.InfoRequest;
import com.uniclass.common.dto.SearchRequest;
import com.uniclass.gateway.auth.AuthResult;
import com.uniclass.gateway.service.RequestOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * 检索网关 REST 接口。
 * <p>
 * 只负责把请求交给 {@link RequestOrchestrator}，并按 {@link GatewayResult} 中的状态码与响应头输出。
 * <ul>
 *   <li>GET /health：健康检查，无需鉴权</li>
 *   <li>POST /search：单条 {"query": "...", "top_k": 5} 或批量 {"queries": [...], "top_k": 5}</li>
 *   <li>POST /info：{"action": "stats" | "usage" | "cache" | "clear_cache"}</li>
 *   <li>POST /api-keys：{"action": "create" | "list" | "revoke" | "rotate", ...}</li>
 * </ul>
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class GatewayController {

    private final RequestOrchestrator orchestrator;

    @GetMapping("/health")
    public ResponseEntity<Object> health() {
        return render(orchestrator.health());
    }

    @PostMapping("/search")
    public ResponseEntity<Object> search(
            @RequestBody(required = false) SearchRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        AuthResult auth = orchestrator.authenticate(authorization);
        return render(orchestrator.handleSearch(request, auth));
    }

    @PostMapping("/info")
    public ResponseEntity<Object> info(
            @RequestBody(required = false) InfoRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        AuthResult auth = orchestrator.authenticate(authorization);
        return render(orchestrator.handleInfo(request, auth));
    }

    @PostMapping("/api-keys")
    public ResponseEntity<Object> apiKeys(
            @RequestBody(required = false) ApiKeyRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        AuthResult auth = orchestrator.authenticate(authorization);
        return render(orchestrator.handleApiKeyAction(request, auth));
    }

    private ResponseEntity<Object> render(GatewayResult result) {
        if (!result.isSuccess()) {
            log.debug("请求失败: [{}] {}", result.getError().getCode(), result.getError().getError());
        }
        return ResponseEntity.status(result.getStatus())
                .headers(headers -> result.getHeaders().forEach(headers::add))
                .body(result.getPayload());
    }
}

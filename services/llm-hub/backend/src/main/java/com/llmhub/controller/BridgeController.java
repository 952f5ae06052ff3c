package com.llmhub.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.llmhub.dto.BridgeHealthStatus;
import com.llmhub.dto.ToolDescriptor;
import com.llmhub.dto.ToolInvocationRequest;
import com.llmhub.exception.ApiException;
import com.llmhub.exception.UpstreamClientErrorException;
import com.llmhub.exception.UpstreamException;
import com.llmhub.service.bridge.BridgeHealthService;
import com.llmhub.service.bridge.ToolTranslator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 브리지 도구 표면 (게이트웨이가 소비)
 * - 응답은 DefaultResponse 봉투 없이 {result} / {error}
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@ConditionalOnProperty(name = "bridge.enabled", havingValue = "true", matchIfMissing = true)
public class BridgeController {

    private final BridgeHealthService bridgeHealthService;
    private final ToolTranslator toolTranslator;

    /**
     * CircuitBreaker OPEN(DOWN) 이면 503 → 게이트웨이 레지스트리에서 제거됨
     */
    @GetMapping("/health")
    public ResponseEntity<BridgeHealthStatus> health() {
        BridgeHealthStatus status = bridgeHealthService.getCurrentStatus();

        HttpStatus httpStatus = "DOWN".equals(status.getStatus())
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;

        return ResponseEntity.status(httpStatus).body(status);
    }

    @GetMapping("/tools")
    public Map<String, List<ToolDescriptor>> tools() {
        return Map.of("tools", toolTranslator.listTools());
    }

    @PostMapping("/mcp/tools/{name}")
    public Map<String, JsonNode> invoke(
            @PathVariable String name,
            @RequestBody(required = false) ToolInvocationRequest request
    ) {
        Map<String, Object> parameters = request == null ? Map.of() : request.parameters();
        return Map.of("result", toolTranslator.invoke(name, parameters));
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, String>> handleApiException(ApiException e) {
        return error(e.getStatus(), e.getMessage());
    }

    @ExceptionHandler(UpstreamClientErrorException.class)
    public ResponseEntity<Map<String, String>> handleUpstreamRejected(UpstreamClientErrorException e) {
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<Map<String, String>> handleUpstream(UpstreamException e) {
        log.warn("event=TOOL_UPSTREAM_FAIL pattern={} message={}", e.getErrorPattern().getCode(), e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}

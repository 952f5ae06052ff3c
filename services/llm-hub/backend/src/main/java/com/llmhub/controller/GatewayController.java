package com.llmhub.controller;

import com.llmhub.dto.AggregateRequest;
import com.llmhub.dto.DefaultResponse;
import com.llmhub.dto.RateLimitToggleResponse;
import com.llmhub.dto.RegistryStatus;
import com.llmhub.dto.ToolCallResult;
import com.llmhub.dto.ToolInvocationRequest;
import com.llmhub.observability.RequestEvent;
import com.llmhub.service.gateway.GatewayOpsService;
import com.llmhub.service.gateway.ResponseAggregator;
import com.llmhub.service.gateway.ToolRouter;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/gateway")
@RequiredArgsConstructor
@ConditionalOnProperty(name = "gateway.enabled", havingValue = "true", matchIfMissing = true)
public class GatewayController {

    private final ToolRouter toolRouter;
    private final ResponseAggregator responseAggregator;
    private final GatewayOpsService gatewayOpsService;

    /**
     * 도구 호출 1건 라우팅
     * - 실패도 200 + status 필드로 반환 (degraded-but-running)
     */
    @PostMapping("/tools/{name}")
    public ResponseEntity<DefaultResponse<ToolCallResult>> route(
            @PathVariable String name,
            @RequestBody(required = false) ToolInvocationRequest request
    ) {
        Map<String, Object> parameters = request == null ? Map.of() : request.parameters();

        return ResponseEntity.ok(
                DefaultResponse.success(
                        HttpStatus.OK.value(),
                        toolRouter.route(name, parameters)
                )
        );
    }

    @PostMapping("/aggregate")
    public ResponseEntity<DefaultResponse<ToolCallResult>> aggregate(@RequestBody AggregateRequest request) {
        return ResponseEntity.ok(
                DefaultResponse.success(
                        HttpStatus.OK.value(),
                        responseAggregator.aggregate(request.calls())
                )
        );
    }

    @GetMapping("/registry")
    public ResponseEntity<DefaultResponse<RegistryStatus>> registry() {
        return ResponseEntity.ok(
                DefaultResponse.success(
                        HttpStatus.OK.value(),
                        gatewayOpsService.getRegistryStatus()
                )
        );
    }

    /**
     * Rate Limit ON/OFF 토글
     * - 서버 재시작 없이 동적 전환
     */
    @PostMapping("/rate-limit/toggle")
    public ResponseEntity<DefaultResponse<RateLimitToggleResponse>> toggleRateLimit() {
        return ResponseEntity.ok(
                DefaultResponse.success(
                        HttpStatus.OK.value(),
                        gatewayOpsService.toggleRateLimit()
                )
        );
    }

    /**
     * 최근 요청 이벤트 (기본 50건)
     */
    @GetMapping("/recent-requests")
    public ResponseEntity<DefaultResponse<List<RequestEvent>>> recentRequests(
            @RequestParam(defaultValue = "50") int limit
    ) {
        return ResponseEntity.ok(
                DefaultResponse.success(
                        HttpStatus.OK.value(),
                        gatewayOpsService.getRecentRequests(limit)
                )
        );
    }
}

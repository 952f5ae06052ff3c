package com.llmhub.service.gateway;

import com.llmhub.dto.RateLimitToggleResponse;
import com.llmhub.dto.RegistryStatus;
import com.llmhub.observability.RequestEvent;
import com.llmhub.observability.RequestEventBuffer;
import com.llmhub.state.RuntimeFeatureState;
import com.llmhub.state.ServiceRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 게이트웨이 운영 조회/토글
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "gateway.enabled", havingValue = "true", matchIfMissing = true)
public class GatewayOpsService {

    private final ServiceRegistry serviceRegistry;
    private final RuntimeFeatureState runtimeFeatureState;
    private final RequestEventBuffer requestEventBuffer;

    public RegistryStatus getRegistryStatus() {
        return serviceRegistry.getStatus();
    }

    /**
     * Rate Limit 상태를 ON ↔ OFF로 전환
     */
    public RateLimitToggleResponse toggleRateLimit() {
        boolean next = runtimeFeatureState.toggleRateLimit();

        // 상태 변화 문자열 (예: "OFF -> ON")
        String statusMessage = String.format("%s -> %s", next ? "OFF" : "ON", next ? "ON" : "OFF");

        return new RateLimitToggleResponse(next, statusMessage);
    }

    public List<RequestEvent> getRecentRequests(int limit) {
        return requestEventBuffer.getRecent(limit);
    }
}

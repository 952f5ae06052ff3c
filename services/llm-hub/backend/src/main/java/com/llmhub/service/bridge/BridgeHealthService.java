package com.llmhub.service.bridge;

import com.llmhub.dto.BridgeHealthStatus;
import com.llmhub.dto.BridgeSnapshot;
import com.llmhub.dto.ConnectionStatus;
import com.llmhub.service.maintenance.PredictiveMaintenanceMonitor;
import com.llmhub.service.resource.ResourceMonitor;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;

@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "bridge.enabled", havingValue = "true", matchIfMissing = true)
public class BridgeHealthService {

    static final String SERVICE_NAME = "lm-studio-bridge";

    // 이 레벨 이상이면 리소스 압박으로 DEGRADED
    static final int DEGRADED_THROTTLE_LEVEL = 3;

    private final UpstreamClient upstreamClient;
    private final ModelDiscoveryService discoveryService;
    private final ResourceMonitor resourceMonitor;
    private final RecoveryManager recoveryManager;
    private final PredictiveMaintenanceMonitor maintenanceMonitor;
    private final Clock clock;

    /**
     * 운영 상태 판정 (게이트웨이 등록 여부 결정용)
     */
    public BridgeHealthStatus getCurrentStatus() {
        CircuitBreaker.State state = upstreamClient.getCircuitState();
        int models = discoveryService.getModelCount();
        int throttleLevel = resourceMonitor.getThrottleState().level();

        /* CircuitBreaker 상태가 최우선 */
        if (state == CircuitBreaker.State.OPEN) {
            return status("DOWN", state, models, throttleLevel, "CIRCUIT_BREAKER_OPEN");
        }

        if (state == CircuitBreaker.State.HALF_OPEN) {
            return status("DEGRADED", state, models, throttleLevel, "CIRCUIT_BREAKER_HALF_OPEN");
        }

        ConnectionStatus connection = upstreamClient.getConnectionStatus();
        if (!connection.healthy()) {
            return status("DEGRADED", state, models, throttleLevel, "UPSTREAM_UNHEALTHY");
        }

        if (models == 0) {
            return status("DEGRADED", state, models, throttleLevel, "NO_MODELS");
        }

        if (throttleLevel >= DEGRADED_THROTTLE_LEVEL) {
            return status("DEGRADED", state, models, throttleLevel, "RESOURCE_PRESSURE");
        }

        return status("UP", state, models, throttleLevel, null);
    }

    /**
     * Raw 계측 스냅샷 (판단 없음)
     */
    public BridgeSnapshot getSnapshot() {
        return new BridgeSnapshot(
                ZonedDateTime.now(clock),
                upstreamClient.getConnectionStatus(),
                recoveryManager.getStatus(),
                resourceMonitor.getResourceStatus(),
                maintenanceMonitor.getStatus(),
                discoveryService.getModelCount(),
                discoveryService.isRunning()
        );
    }

    private static BridgeHealthStatus status(
            String status, CircuitBreaker.State state, int models, int throttleLevel, String reason) {
        return new BridgeHealthStatus(status, SERVICE_NAME, state.name(), models, throttleLevel, reason);
    }
}

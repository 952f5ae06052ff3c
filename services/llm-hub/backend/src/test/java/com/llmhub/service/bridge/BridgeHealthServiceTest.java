package com.llmhub.service.bridge;

import com.llmhub.dto.BridgeHealthStatus;
import com.llmhub.dto.ConnectionStatus;
import com.llmhub.dto.ThrottleState;
import com.llmhub.service.maintenance.PredictiveMaintenanceMonitor;
import com.llmhub.service.resource.ResourceMonitor;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BridgeHealthServiceTest {

    private UpstreamClient upstreamClient;
    private ModelDiscoveryService discoveryService;
    private ResourceMonitor resourceMonitor;
    private BridgeHealthService healthService;

    @BeforeEach
    void setUp() {
        upstreamClient = mock(UpstreamClient.class);
        discoveryService = mock(ModelDiscoveryService.class);
        resourceMonitor = mock(ResourceMonitor.class);
        healthService = new BridgeHealthService(
                upstreamClient, discoveryService, resourceMonitor,
                mock(RecoveryManager.class), mock(PredictiveMaintenanceMonitor.class), Clock.systemUTC());

        when(upstreamClient.getCircuitState()).thenReturn(CircuitBreaker.State.CLOSED);
        when(upstreamClient.getConnectionStatus()).thenReturn(connection(true));
        when(discoveryService.getModelCount()).thenReturn(2);
        when(resourceMonitor.getThrottleState()).thenReturn(ThrottleState.NONE);
    }

    private static ConnectionStatus connection(boolean healthy) {
        return new ConnectionStatus(healthy, "CLOSED", 0, null, -1, null, "http://backend");
    }

    @Test
    void upWhenEverythingIsHealthy() {
        BridgeHealthStatus status = healthService.getCurrentStatus();

        assertThat(status.getStatus()).isEqualTo("UP");
        assertThat(status.getReason()).isNull();
        assertThat(status.getModels()).isEqualTo(2);
    }

    @Test
    void downWhenCircuitIsOpen() {
        when(upstreamClient.getCircuitState()).thenReturn(CircuitBreaker.State.OPEN);

        BridgeHealthStatus status = healthService.getCurrentStatus();

        assertThat(status.getStatus()).isEqualTo("DOWN");
        assertThat(status.getReason()).isEqualTo("CIRCUIT_BREAKER_OPEN");
    }

    @Test
    void degradedWithoutModels() {
        when(discoveryService.getModelCount()).thenReturn(0);

        assertThat(healthService.getCurrentStatus().getReason()).isEqualTo("NO_MODELS");
    }

    @Test
    void degradedUnderResourcePressure() {
        when(resourceMonitor.getThrottleState()).thenReturn(new ThrottleState(3, Duration.ofMillis(500)));

        BridgeHealthStatus status = healthService.getCurrentStatus();

        assertThat(status.getStatus()).isEqualTo("DEGRADED");
        assertThat(status.getReason()).isEqualTo("RESOURCE_PRESSURE");
    }

    @Test
    void degradedWhenUpstreamUnhealthy() {
        when(upstreamClient.getConnectionStatus()).thenReturn(connection(false));

        assertThat(healthService.getCurrentStatus().getReason()).isEqualTo("UPSTREAM_UNHEALTHY");
    }
}

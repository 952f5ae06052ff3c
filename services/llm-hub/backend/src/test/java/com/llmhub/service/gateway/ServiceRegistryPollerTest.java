package com.llmhub.service.gateway;

import com.llmhub.dto.ServiceRegistryEntry;
import com.llmhub.state.ServiceRegistry;
import com.llmhub.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ServiceRegistryPollerTest {

    private static final String BRIDGE = "http://bridge:8080";
    private static final String CATALOG =
            "{\"tools\":[{\"name\":\"inference\",\"schema\":{\"type\":\"object\"}},{\"name\":\"list_models\",\"schema\":{}}]}";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

    private MockRestServiceServer server;
    private ServiceRegistry registry;
    private ServiceRegistryPoller poller;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        registry = new ServiceRegistry();
        poller = new ServiceRegistryPoller(restTemplate, registry, clock, "lm-studio-bridge", BRIDGE + "/",
                Duration.ofSeconds(30));
    }

    private void expectHealthyBridge() {
        server.expect(requestTo(BRIDGE + "/health"))
                .andRespond(withSuccess("{\"status\":\"UP\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BRIDGE + "/tools"))
                .andRespond(withSuccess(CATALOG, MediaType.APPLICATION_JSON));
    }

    @Test
    void healthyBridgeIsRegisteredWithItsTools() {
        expectHealthyBridge();

        assertThat(poller.pollOnce()).isTrue();

        ServiceRegistryEntry entry = registry.get("lm-studio-bridge").orElseThrow();
        assertThat(entry.baseUrl()).isEqualTo(BRIDGE);
        assertThat(entry.healthy()).isTrue();
        assertThat(entry.tools()).containsOnlyKeys("inference", "list_models");
        assertThat(entry.lastSeen()).isEqualTo(clock.instant());
        assertThat(registry.healthyEntriesFor("inference")).hasSize(1);
    }

    @Test
    void unhealthyBridgeIsRemovedWithoutFetchingCatalog() {
        expectHealthyBridge();
        poller.pollOnce();
        server.reset();

        server.expect(ExpectedCount.once(), requestTo(BRIDGE + "/health"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThat(poller.pollOnce()).isFalse();
        assertThat(registry.size()).isZero();
        server.verify();
    }

    @Test
    void unreachableBridgeIsRemoved() {
        expectHealthyBridge();
        poller.pollOnce();
        server.reset();

        server.expect(requestTo(BRIDGE + "/health")).andRespond(withException(new ConnectException("refused")));

        assertThat(poller.pollOnce()).isFalse();
        assertThat(registry.get("lm-studio-bridge")).isEmpty();
    }

    @Test
    void catalogFailureRemovesEntry() {
        expectHealthyBridge();
        poller.pollOnce();
        server.reset();

        server.expect(requestTo(BRIDGE + "/health"))
                .andRespond(withSuccess("{\"status\":\"DEGRADED\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BRIDGE + "/tools")).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThat(poller.pollOnce()).isFalse();
        assertThat(registry.size()).isZero();
    }

    @Test
    void repeatedSuccessRefreshesLastSeen() {
        expectHealthyBridge();
        poller.pollOnce();
        server.reset();

        clock.advance(Duration.ofSeconds(30));
        expectHealthyBridge();
        poller.pollOnce();

        assertThat(registry.get("lm-studio-bridge").orElseThrow().lastSeen()).isEqualTo(clock.instant());
        assertThat(registry.getStatus().lastDiscoveryAt()).isEqualTo(clock.instant());
    }
}

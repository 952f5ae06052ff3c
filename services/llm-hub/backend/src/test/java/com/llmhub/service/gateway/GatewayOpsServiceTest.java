package com.llmhub.service.gateway;

import com.llmhub.dto.RateLimitToggleResponse;
import com.llmhub.observability.RequestEventBuffer;
import com.llmhub.state.RuntimeFeatureState;
import com.llmhub.state.ServiceRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayOpsServiceTest {

    private final GatewayOpsService service = new GatewayOpsService(
            new ServiceRegistry(), new RuntimeFeatureState(true), new RequestEventBuffer(10));

    @Test
    void toggleReportsTransition() {
        RateLimitToggleResponse off = service.toggleRateLimit();
        RateLimitToggleResponse on = service.toggleRateLimit();

        assertThat(off.enabled()).isFalse();
        assertThat(off.status()).isEqualTo("ON -> OFF");
        assertThat(on.enabled()).isTrue();
        assertThat(on.status()).isEqualTo("OFF -> ON");
    }

    @Test
    void emptyRegistryStatus() {
        assertThat(service.getRegistryStatus().services()).isZero();
        assertThat(service.getRegistryStatus().lastDiscoveryAt()).isNull();
    }
}

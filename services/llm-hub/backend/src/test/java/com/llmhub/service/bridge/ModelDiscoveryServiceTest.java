package com.llmhub.service.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.llmhub.dto.ModelCatalogDiff;
import com.llmhub.dto.ModelRecord;
import com.llmhub.exception.ErrorPattern;
import com.llmhub.exception.UpstreamUnavailableException;
import com.llmhub.service.resource.ThrottleAdvisor;
import com.llmhub.state.ModelRegistry;
import com.llmhub.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ModelDiscoveryServiceTest {

    private static final Duration POLL = Duration.ofSeconds(30);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

    private UpstreamClient upstreamClient;
    private RecoveryManager recoveryManager;
    private ModelDiscoveryService discovery;

    @BeforeEach
    void setUp() {
        upstreamClient = mock(UpstreamClient.class);
        recoveryManager = mock(RecoveryManager.class);
        discovery = new ModelDiscoveryService(
                upstreamClient, recoveryManager, ThrottleAdvisor.NONE, new ModelRegistry(), clock, POLL);
    }

    private JsonNode catalog(String... ids) {
        ArrayNode data = objectMapper.createArrayNode();
        for (String id : ids) {
            data.addObject().put("id", id).put("object", "model");
        }
        return data;
    }

    @Test
    void registryTracksCatalogExactly() {
        when(upstreamClient.getModels()).thenReturn(catalog("A", "B"), catalog("B", "C"));

        ModelCatalogDiff first = discovery.discover();
        Instant firstSeenB = discovery.getModel("B").map(ModelRecord::discoveredAt).orElseThrow();

        clock.advance(POLL);
        ModelCatalogDiff second = discovery.discover();

        assertThat(first.added()).containsExactlyInAnyOrder("A", "B");
        assertThat(second.added()).containsExactly("C");
        assertThat(second.removed()).containsExactly("A");
        assertThat(discovery.getModels()).extracting(ModelRecord::id).containsExactly("B", "C");
        assertThat(discovery.getModel("B").map(ModelRecord::discoveredAt)).contains(firstSeenB);
    }

    @Test
    void entriesWithoutIdAreIgnored() {
        ArrayNode data = (ArrayNode) catalog("A");
        data.addObject().put("object", "model");
        when(upstreamClient.getModels()).thenReturn(data);

        discovery.discover();

        assertThat(discovery.getModelCount()).isEqualTo(1);
    }

    @Test
    void recoveryStartsOnThirdConsecutiveFailureAndBacksOff() {
        UpstreamUnavailableException failure =
                new UpstreamUnavailableException("down", ErrorPattern.CONNECTION_REFUSED, null);
        when(upstreamClient.getModels()).thenThrow(failure);
        when(recoveryManager.handleError(any(), eq("model_discovery"))).thenReturn(false);

        assertThat(discovery.runCycle()).isEqualTo(POLL);
        assertThat(discovery.runCycle()).isEqualTo(POLL);
        verify(recoveryManager, never()).handleError(any(), any());

        assertThat(discovery.runCycle()).isEqualTo(Duration.ofSeconds(60));
        verify(recoveryManager).handleError(failure, "model_discovery");
        assertThat(discovery.getConsecutiveFailures()).isEqualTo(3);
    }

    @Test
    void successAfterFailuresRestoresInterval() {
        UpstreamUnavailableException failure =
                new UpstreamUnavailableException("down", ErrorPattern.TIMEOUT, null);
        when(upstreamClient.getModels())
                .thenThrow(failure, failure, failure)
                .thenReturn(catalog("A"));

        discovery.runCycle();
        discovery.runCycle();
        discovery.runCycle();

        assertThat(discovery.runCycle()).isEqualTo(POLL);
        assertThat(discovery.getConsecutiveFailures()).isZero();
        assertThat(discovery.hasModels()).isTrue();
    }

    @Test
    void extendedIntervalIsCappedAtFiveMinutes() {
        ModelDiscoveryService slow = new ModelDiscoveryService(
                upstreamClient, recoveryManager, ThrottleAdvisor.NONE, new ModelRegistry(), clock,
                Duration.ofSeconds(200));

        assertThat(slow.extendedInterval()).isEqualTo(Duration.ofSeconds(300));
    }

    @Test
    void forceRunsSynchronouslyWhenLoopIsStopped() throws Exception {
        when(upstreamClient.getModels()).thenReturn(catalog("A", "B"));

        assertThat(discovery.force()).isEqualTo(2);
    }
}

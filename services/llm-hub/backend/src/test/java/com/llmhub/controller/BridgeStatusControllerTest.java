package com.llmhub.controller;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.llmhub.dto.ModelRecord;
import com.llmhub.exception.CircuitOpenException;
import com.llmhub.filter.ClientKeyResolver;
import com.llmhub.observability.RequestEventBuffer;
import com.llmhub.service.bridge.BridgeHealthService;
import com.llmhub.service.bridge.ModelDiscoveryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BridgeStatusController.class)
@Import({RequestEventBuffer.class, ClientKeyResolver.class})
class BridgeStatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BridgeHealthService bridgeHealthService;

    @MockBean
    private ModelDiscoveryService modelDiscoveryService;

    @Test
    void modelsAreListed() throws Exception {
        when(modelDiscoveryService.getModels()).thenReturn(List.of(
                new ModelRecord("llama-3", JsonNodeFactory.instance.objectNode(), Instant.parse("2026-01-01T00:00:00Z"))));

        mockMvc.perform(get("/api/bridge/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value("llama-3"));
    }

    @Test
    void refreshReturnsModelCount() throws Exception {
        when(modelDiscoveryService.force()).thenReturn(3);

        mockMvc.perform(post("/api/bridge/models/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.models").value(3));
    }

    @Test
    void refreshWhileCircuitOpenIsServiceUnavailable() throws Exception {
        when(modelDiscoveryService.force()).thenThrow(new CircuitOpenException("circuit breaker is open"));

        mockMvc.perform(post("/api/bridge/models/refresh"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("CIRCUIT_OPEN"));
    }
}

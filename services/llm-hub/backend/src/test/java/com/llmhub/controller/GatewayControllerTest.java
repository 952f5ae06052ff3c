package com.llmhub.controller;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.llmhub.dto.RateLimitToggleResponse;
import com.llmhub.dto.ToolCallResult;
import com.llmhub.dto.ToolCallStatus;
import com.llmhub.filter.ClientKeyResolver;
import com.llmhub.observability.RequestEventBuffer;
import com.llmhub.service.gateway.GatewayOpsService;
import com.llmhub.service.gateway.ResponseAggregator;
import com.llmhub.service.gateway.ToolRouter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GatewayController.class)
@Import({RequestEventBuffer.class, ClientKeyResolver.class})
class GatewayControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ToolRouter toolRouter;

    @MockBean
    private ResponseAggregator responseAggregator;

    @MockBean
    private GatewayOpsService gatewayOpsService;

    @Test
    void routeReturnsResultInEnvelope() throws Exception {
        when(toolRouter.route(eq("inference"), anyMap()))
                .thenReturn(ToolCallResult.success("lm-studio-bridge", JsonNodeFactory.instance.textNode("ok")));

        mockMvc.perform(post("/api/gateway/tools/inference")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"parameters\":{\"prompt\":\"hi\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.httpCode").value(200))
                .andExpect(jsonPath("$.data.status").value("success"))
                .andExpect(jsonPath("$.data.service").value("lm-studio-bridge"))
                .andExpect(jsonPath("$.data.result").value("ok"));
    }

    @Test
    void routeFailureIsStillOk() throws Exception {
        when(toolRouter.route(eq("inference"), anyMap()))
                .thenReturn(ToolCallResult.failure(ToolCallStatus.SERVICE_NOT_FOUND, null, "No service available for tool: inference"));

        mockMvc.perform(post("/api/gateway/tools/inference"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("service_not_found"));
    }

    @Test
    void aggregateDelegates() throws Exception {
        when(responseAggregator.aggregate(anyList())).thenReturn(ToolCallResult.noCalls());

        mockMvc.perform(post("/api/gateway/aggregate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"calls\":[]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("no_calls"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/gateway/aggregate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));
    }

    @Test
    void toggleRateLimit() throws Exception {
        when(gatewayOpsService.toggleRateLimit()).thenReturn(new RateLimitToggleResponse(false, "ON -> OFF"));

        mockMvc.perform(post("/api/gateway/rate-limit/toggle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.enabled").value(false))
                .andExpect(jsonPath("$.data.status").value("ON -> OFF"));
    }

    @Test
    void recentRequestsDefaultsToFifty() throws Exception {
        when(gatewayOpsService.getRecentRequests(50)).thenReturn(List.of());

        mockMvc.perform(get("/api/gateway/recent-requests"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isArray());
    }
}

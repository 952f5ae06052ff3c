package com.llmhub.service.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmhub.dto.ToolDescriptor;
import com.llmhub.exception.ApiException;
import com.llmhub.exception.ErrorPattern;
import com.llmhub.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ToolTranslatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private UpstreamClient upstreamClient;
    private RecoveryManager recoveryManager;
    private ToolTranslator translator;

    @BeforeEach
    void setUp() {
        upstreamClient = mock(UpstreamClient.class);
        recoveryManager = mock(RecoveryManager.class);
        translator = new ToolTranslator(upstreamClient, recoveryManager, objectMapper);
    }

    @Test
    void listsInferenceAndListModels() {
        assertThat(translator.listTools())
                .extracting(ToolDescriptor::name)
                .containsExactly(ToolTranslator.INFERENCE, ToolTranslator.LIST_MODELS);
    }

    @Test
    void inferenceAppliesDefaultsAndMapsCompletion() throws Exception {
        JsonNode upstream = objectMapper.readTree(
                "{\"id\":\"abc\",\"created\":17,\"choices\":[{\"text\":\"hi\",\"index\":0}],\"usage\":{\"total_tokens\":3}}");
        when(upstreamClient.createCompletion("hello", "m1", 0.7, 1000)).thenReturn(upstream);

        JsonNode result = translator.invoke("inference", Map.of("prompt", "hello", "model", "m1"));

        assertThat(result.path("id").asText()).isEqualTo("cmpl-abc");
        assertThat(result.path("object").asText()).isEqualTo("text_completion");
        assertThat(result.path("model").asText()).isEqualTo("m1");
        assertThat(result.path("choices").get(0).path("text").asText()).isEqualTo("hi");
        assertThat(result.path("usage").path("total_tokens").asInt()).isEqualTo(3);
    }

    @Test
    void plainTextCompletionBecomesSingleChoice() throws Exception {
        JsonNode mapped = translator.mapCompletion(objectMapper.readTree("{\"text\":\"raw\"}"), "m1");

        assertThat(mapped.path("choices")).hasSize(1);
        assertThat(mapped.path("choices").get(0).path("text").asText()).isEqualTo("raw");
        assertThat(mapped.path("choices").get(0).path("finish_reason").asText()).isEqualTo("stop");
    }

    @Test
    void invalidParametersAreRejectedBeforeCallingUpstream() {
        assertInvalid(Map.of("model", "m1"));
        assertInvalid(Map.of("prompt", "p", "model", "m1", "temperature", 2.5));
        assertInvalid(Map.of("prompt", "p", "model", "m1", "max_tokens", 0));
        assertInvalid(Map.of("prompt", "p", "model", "m1", "max_tokens", 1.5));
        assertInvalid(Map.of("prompt", "p", "model", "m1", "temperature", "hot"));

        verifyNoInteractions(upstreamClient);
    }

    private void assertInvalid(Map<String, Object> parameters) {
        assertThatThrownBy(() -> translator.invoke("inference", parameters))
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).getStatus()).isEqualTo(HttpStatus.BAD_REQUEST));
    }

    @Test
    void unknownToolIsNotFound() {
        assertThatThrownBy(() -> translator.invoke("summarize", Map.of()))
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).getCode()).isEqualTo("UNKNOWN_TOOL"));
    }

    @Test
    void retriesOnceAfterSuccessfulRecovery() {
        UpstreamUnavailableException failure =
                new UpstreamUnavailableException("down", ErrorPattern.CONNECTION_REFUSED, null);
        when(upstreamClient.getModels())
                .thenThrow(failure)
                .thenReturn(objectMapper.createArrayNode());
        when(recoveryManager.handleError(failure, "list_models")).thenReturn(true);

        JsonNode result = translator.invoke("list_models", Map.of());

        assertThat(result.path("object").asText()).isEqualTo("list");
        verify(upstreamClient, times(2)).getModels();
    }

    @Test
    void rethrowsWhenRecoveryFails() {
        UpstreamUnavailableException failure =
                new UpstreamUnavailableException("down", ErrorPattern.TIMEOUT, null);
        when(upstreamClient.createCompletion(anyString(), anyString(), anyDouble(), anyInt())).thenThrow(failure);
        when(recoveryManager.handleError(any(), eq("inference"))).thenReturn(false);

        assertThatThrownBy(() -> translator.invoke("inference", Map.of("prompt", "p", "model", "m1")))
                .isSameAs(failure);
    }
}

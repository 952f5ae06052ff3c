package com.llmhub.service.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llmhub.dto.ToolDescriptor;
import com.llmhub.exception.ApiException;
import com.llmhub.exception.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;

/**
 * 도구 호출 ↔ 추론 백엔드 API 변환
 *
 * - inference: /v1/completions 호출 후 text_completion 형태로 매핑
 * - list_models: /v1/models 결과를 {object: list, data} 로 반환
 * - 업스트림 실패 시 복구 1회 시도, 복구되면 한 번 더 호출
 */
@Slf4j
public class ToolTranslator {

    public static final String INFERENCE = "inference";
    public static final String LIST_MODELS = "list_models";

    static final double DEFAULT_TEMPERATURE = 0.7;
    static final int DEFAULT_MAX_TOKENS = 1000;

    private final UpstreamClient upstreamClient;
    private final RecoveryManager recoveryManager;
    private final ObjectMapper objectMapper;
    private final List<ToolDescriptor> tools;

    public ToolTranslator(UpstreamClient upstreamClient, RecoveryManager recoveryManager, ObjectMapper objectMapper) {
        this.upstreamClient = upstreamClient;
        this.recoveryManager = recoveryManager;
        this.objectMapper = objectMapper;
        this.tools = List.of(
                new ToolDescriptor(INFERENCE, inferenceSchema()),
                new ToolDescriptor(LIST_MODELS, objectSchema())
        );
    }

    public List<ToolDescriptor> listTools() {
        return tools;
    }

    public JsonNode invoke(String toolName, Map<String, Object> parameters) {
        return switch (toolName) {
            case INFERENCE -> {
                CompletionRequest request = CompletionRequest.from(parameters);
                yield withRecovery(toolName, () -> mapCompletion(
                        upstreamClient.createCompletion(
                                request.prompt(), request.model(), request.temperature(), request.maxTokens()),
                        request.model()));
            }
            case LIST_MODELS -> withRecovery(toolName, this::listModels);
            default -> throw new ApiException(
                    "UNKNOWN_TOOL",
                    "unknown tool: " + toolName,
                    HttpStatus.NOT_FOUND
            );
        };
    }

    private JsonNode withRecovery(String toolName, UpstreamCall call) {
        try {
            return call.execute();
        } catch (UpstreamException e) {
            if (!recoveryManager.handleError(e, toolName)) {
                throw e;
            }
            log.info("event=TOOL_CALL_RETRY tool={} reason=recovered", toolName);
            return call.execute();
        }
    }

    private JsonNode listModels() {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("object", "list");
        response.set("data", upstreamClient.getModels());
        return response;
    }

    /**
     * 백엔드 completion → text_completion
     * - choices 가 비어 있으면 text 를 단일 choice 로 감쌈
     */
    JsonNode mapCompletion(JsonNode upstream, String model) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("id", "cmpl-" + upstream.path("id").asText("unknown"));
        response.put("object", "text_completion");
        response.put("created", upstream.path("created").asLong(0));
        response.put("model", model);

        JsonNode choices = upstream.path("choices");
        if (choices.isArray() && !choices.isEmpty()) {
            response.set("choices", choices);
        } else {
            ArrayNode single = objectMapper.createArrayNode();
            single.addObject()
                    .put("text", upstream.path("text").asText(""))
                    .put("index", 0)
                    .put("finish_reason", "stop");
            response.set("choices", single);
        }

        JsonNode usage = upstream.path("usage");
        response.set("usage", usage.isObject() ? usage : objectMapper.createObjectNode());
        return response;
    }

    private JsonNode inferenceSchema() {
        ObjectNode schema = objectSchema();
        ObjectNode properties = schema.putObject("properties");
        properties.putObject("prompt").put("type", "string");
        properties.putObject("model").put("type", "string");
        properties.putObject("temperature")
                .put("type", "number")
                .put("minimum", 0.0)
                .put("maximum", 2.0)
                .put("default", DEFAULT_TEMPERATURE);
        properties.putObject("max_tokens")
                .put("type", "integer")
                .put("minimum", 1)
                .put("default", DEFAULT_MAX_TOKENS);
        schema.putArray("required").add("prompt").add("model");
        return schema;
    }

    private ObjectNode objectSchema() {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        return schema;
    }

    @FunctionalInterface
    private interface UpstreamCall {
        JsonNode execute();
    }

    /**
     * inference 파라미터 검증
     */
    record CompletionRequest(String prompt, String model, double temperature, int maxTokens) {

        static CompletionRequest from(Map<String, Object> parameters) {
            String prompt = requireText(parameters, "prompt");
            String model = requireText(parameters, "model");

            double temperature = number(parameters, "temperature", DEFAULT_TEMPERATURE);
            if (temperature < 0.0 || temperature > 2.0) {
                throw invalid("temperature must be between 0.0 and 2.0");
            }

            double maxTokens = number(parameters, "max_tokens", DEFAULT_MAX_TOKENS);
            if (maxTokens != Math.rint(maxTokens) || maxTokens < 1) {
                throw invalid("max_tokens must be an integer >= 1");
            }

            return new CompletionRequest(prompt, model, temperature, (int) maxTokens);
        }

        private static String requireText(Map<String, Object> parameters, String key) {
            Object value = parameters.get(key);
            if (!(value instanceof String text)) {
                throw invalid(key + " is required");
            }
            return text;
        }

        private static double number(Map<String, Object> parameters, String key, double defaultValue) {
            Object value = parameters.get(key);
            if (value == null) {
                return defaultValue;
            }
            if (value instanceof Number number) {
                return number.doubleValue();
            }
            if (value instanceof String text) {
                try {
                    return Double.parseDouble(text.trim());
                } catch (NumberFormatException e) {
                    throw invalid(key + " must be a number");
                }
            }
            throw invalid(key + " must be a number");
        }

        private static ApiException invalid(String message) {
            return new ApiException("INVALID_PARAMETERS", message, HttpStatus.BAD_REQUEST);
        }
    }
}

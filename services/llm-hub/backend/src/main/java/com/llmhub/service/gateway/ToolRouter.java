package com.llmhub.service.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmhub.dto.ServiceRegistryEntry;
import com.llmhub.dto.ToolCallResult;
import com.llmhub.dto.ToolCallStatus;
import com.llmhub.logging.TraceContext;
import com.llmhub.observability.HubMetrics;
import com.llmhub.state.ServiceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.InterruptedIOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 도구 이름 → 소유 서비스로 호출 전달
 *
 * - 후보: 도구를 가진 healthy 항목 (서비스 이름 순), 후보 집합별 round-robin
 * - 결과는 항상 ToolCallResult (예외를 던지지 않음)
 */
@Slf4j
public class ToolRouter {

    static final String USER_AGENT = "llm-hub-gateway/1.0.0";

    private final RestTemplate restTemplate;
    private final ServiceRegistry registry;
    private final ObjectMapper objectMapper;
    private final HubMetrics metrics;

    private final Map<String, AtomicInteger> roundRobinCounters = new ConcurrentHashMap<>();

    public ToolRouter(RestTemplate restTemplate, ServiceRegistry registry, ObjectMapper objectMapper, HubMetrics metrics) {
        this.restTemplate = restTemplate;
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    public ToolCallResult route(String toolName, Map<String, Object> parameters) {
        List<ServiceRegistryEntry> candidates = registry.healthyEntriesFor(toolName);

        ToolCallResult result = candidates.isEmpty()
                ? ToolCallResult.failure(
                        ToolCallStatus.SERVICE_NOT_FOUND, null, "No service available for tool: " + toolName)
                : forward(select(candidates), toolName, parameters);

        metrics.routeOutcome(result.status().getCode());
        return result;
    }

    ServiceRegistryEntry select(List<ServiceRegistryEntry> candidates) {
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        String key = candidates.stream()
                .map(ServiceRegistryEntry::serviceName)
                .collect(Collectors.joining(","));
        int counter = roundRobinCounters.computeIfAbsent(key, k -> new AtomicInteger()).getAndIncrement();
        return candidates.get(Math.floorMod(counter, candidates.size()));
    }

    private ToolCallResult forward(ServiceRegistryEntry target, String toolName, Map<String, Object> parameters) {
        String service = target.serviceName();
        String url = target.baseUrl() + "/mcp/tools/" + toolName;

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    url,
                    new HttpEntity<>(Map.of("parameters", parameters), headers()),
                    String.class
            );

            if (response.getStatusCode().value() != 200) {
                return ToolCallResult.failure(ToolCallStatus.SERVICE_ERROR, service,
                        "Service returned " + response.getStatusCode().value());
            }

            return ToolCallResult.success(service, parse(response.getBody()));

        } catch (HttpStatusCodeException e) {
            return ToolCallResult.failure(ToolCallStatus.SERVICE_ERROR, service,
                    "Service returned " + e.getStatusCode().value());

        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof InterruptedIOException) {
                log.warn("event=FORWARD_TIMEOUT service={} tool={}", service, toolName);
                return ToolCallResult.failure(ToolCallStatus.TIMEOUT, service, "Service timeout");
            }
            log.warn("event=FORWARD_FAIL service={} tool={} message={}", service, toolName, e.getMessage());
            return ToolCallResult.failure(ToolCallStatus.FORWARD_ERROR, service, "Forward failed: " + e.getMessage());

        } catch (RestClientException e) {
            log.warn("event=FORWARD_FAIL service={} tool={} message={}", service, toolName, e.getMessage());
            return ToolCallResult.failure(ToolCallStatus.FORWARD_ERROR, service, "Forward failed: " + e.getMessage());
        }
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.nullNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return objectMapper.getNodeFactory().textNode(body);
        }
    }

    private static HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);

        String traceId = TraceContext.current();
        if (traceId != null) {
            headers.set(TraceContext.TRACE_ID_HEADER, traceId);
        }
        return headers;
    }
}

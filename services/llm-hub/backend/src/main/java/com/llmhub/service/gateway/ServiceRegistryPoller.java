package com.llmhub.service.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.llmhub.dto.ServiceRegistryEntry;
import com.llmhub.dto.ToolDescriptor;
import com.llmhub.logging.LogEvent;
import com.llmhub.scheduling.PollingLoop;
import com.llmhub.state.ServiceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 브리지 health/catalog 폴링 → 게이트웨이 레지스트리 갱신
 *
 * - health 200 이 아니면 항목 제거 후 catalog 조회 생략
 * - catalog 조회 실패(비 200, 전송 오류)도 항목 제거
 * - 성공 시 healthy=true, last_seen 갱신으로 upsert
 */
@Slf4j
public class ServiceRegistryPoller extends PollingLoop {

    private final RestTemplate restTemplate;
    private final ServiceRegistry registry;
    private final Clock clock;
    private final String serviceName;
    private final String serviceUrl;
    private final Duration pollInterval;

    public ServiceRegistryPoller(
            RestTemplate restTemplate,
            ServiceRegistry registry,
            Clock clock,
            String serviceName,
            String serviceUrl,
            Duration pollInterval
    ) {
        super("service-registry");
        this.restTemplate = restTemplate;
        this.registry = registry;
        this.clock = clock;
        this.serviceName = serviceName;
        this.serviceUrl = serviceUrl.endsWith("/") ? serviceUrl.substring(0, serviceUrl.length() - 1) : serviceUrl;
        this.pollInterval = pollInterval;
    }

    @Override
    protected Duration runCycle() {
        pollOnce();
        return pollInterval;
    }

    @Override
    protected Duration fallbackDelay() {
        return pollInterval;
    }

    /**
     * @return 폴링 후 서비스가 등록 상태인지
     */
    boolean pollOnce() {
        try {
            ResponseEntity<JsonNode> health = restTemplate.getForEntity(serviceUrl + "/health", JsonNode.class);
            if (health.getStatusCode().value() != 200) {
                deregister("health_status_" + health.getStatusCode().value());
                return false;
            }

            ResponseEntity<JsonNode> tools = restTemplate.getForEntity(serviceUrl + "/tools", JsonNode.class);
            if (tools.getStatusCode().value() != 200 || tools.getBody() == null) {
                deregister("tools_status_" + tools.getStatusCode().value());
                return false;
            }

            Map<String, ToolDescriptor> catalog = parseCatalog(tools.getBody());
            boolean known = registry.get(serviceName).isPresent();

            registry.upsert(new ServiceRegistryEntry(serviceName, serviceUrl, catalog, clock.instant(), true));

            if (!known) {
                log.info("event={} service={} url={} tools={}",
                        LogEvent.SERVICE_REGISTERED, serviceName, serviceUrl, catalog.keySet());
            }
            return true;

        } catch (RestClientException e) {
            deregister(e.getClass().getSimpleName());
            log.debug("event=SERVICE_POLL_FAIL service={} message={}", serviceName, e.getMessage());
            return false;
        }
    }

    private Map<String, ToolDescriptor> parseCatalog(JsonNode body) {
        Map<String, ToolDescriptor> catalog = new LinkedHashMap<>();
        for (JsonNode tool : body.path("tools")) {
            String name = tool.path("name").asText("");
            if (!name.isEmpty()) {
                catalog.put(name, new ToolDescriptor(name, tool.path("schema")));
            }
        }
        return catalog;
    }

    private void deregister(String reason) {
        if (registry.remove(serviceName)) {
            log.warn("event={} service={} reason={}", LogEvent.SERVICE_REMOVED, serviceName, reason);
        }
    }
}

package com.llmhub.service.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.llmhub.dto.ModelCatalogDiff;
import com.llmhub.dto.ModelRecord;
import com.llmhub.logging.LogEvent;
import com.llmhub.scheduling.PollingLoop;
import com.llmhub.service.resource.ThrottleAdvisor;
import com.llmhub.state.ModelRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 모델 카탈로그 폴링 + 레지스트리 diff
 *
 * - 매 사이클 카탈로그 전체로 레지스트리를 교체 (추가/제거 이벤트 로그)
 * - 연속 실패 3회부터 복구 시도, 복구 실패 시 다음 대기만 2배 (최대 300s)
 * - 성공 시 실패 카운터/주기 원복
 */
@Slf4j
public class ModelDiscoveryService extends PollingLoop {

    static final int RECOVERY_AFTER_FAILURES = 3;
    static final Duration MAX_BACKOFF_INTERVAL = Duration.ofSeconds(300);

    private final UpstreamClient upstreamClient;
    private final RecoveryManager recoveryManager;
    private final ThrottleAdvisor throttleAdvisor;
    private final ModelRegistry registry;
    private final Clock clock;
    private final Duration pollInterval;

    private int consecutiveFailures;

    public ModelDiscoveryService(
            UpstreamClient upstreamClient,
            RecoveryManager recoveryManager,
            ThrottleAdvisor throttleAdvisor,
            ModelRegistry registry,
            Clock clock,
            Duration pollInterval
    ) {
        super("model-discovery");
        this.upstreamClient = upstreamClient;
        this.recoveryManager = recoveryManager;
        this.throttleAdvisor = throttleAdvisor;
        this.registry = registry;
        this.clock = clock;
        this.pollInterval = pollInterval;
    }

    @Override
    protected Duration runCycle() {
        try {
            discover();
            consecutiveFailures = 0;
            return nextInterval();

        } catch (RuntimeException e) {
            consecutiveFailures++;
            log.warn("event={} failures={} message={}", LogEvent.DISCOVERY_FAIL, consecutiveFailures, e.getMessage());

            if (consecutiveFailures < RECOVERY_AFTER_FAILURES) {
                return pollInterval;
            }

            if (recoveryManager.handleError(e, "model_discovery")) {
                return pollInterval;
            }

            Duration extended = extendedInterval();
            log.warn("event={} failures={} nextMs={}", LogEvent.POLL_BACKOFF, consecutiveFailures, extended.toMillis());
            return extended;
        }
    }

    @Override
    protected Duration fallbackDelay() {
        return pollInterval;
    }

    /**
     * 디스커버리 1회를 동기 실행하고 레지스트리 크기 반환
     * - 업스트림 실패는 호출자에게 그대로 전달
     */
    public int force() throws Exception {
        log.info("event=DISCOVERY_FORCE");
        return runOnLoop(() -> {
            discover();
            return registry.size();
        });
    }

    /**
     * 카탈로그 조회 → 레지스트리 교체 → 변경분 로그
     */
    ModelCatalogDiff discover() {
        JsonNode models = upstreamClient.getModels();

        Map<String, JsonNode> catalog = new LinkedHashMap<>();
        for (JsonNode model : models) {
            String id = model.path("id").asText("");
            if (id.isEmpty()) {
                continue;
            }
            catalog.put(id, model);
        }

        ModelCatalogDiff diff = registry.apply(catalog, clock.instant());

        diff.added().forEach(id -> log.info("event={} model={} type={}",
                LogEvent.MODEL_ADDED, id, catalog.get(id).path("object").asText("unknown")));
        diff.removed().forEach(id -> log.info("event={} model={}", LogEvent.MODEL_REMOVED, id));

        return diff;
    }

    Duration extendedInterval() {
        Duration doubled = pollInterval.multipliedBy(2);
        return doubled.compareTo(MAX_BACKOFF_INTERVAL) > 0 ? MAX_BACKOFF_INTERVAL : doubled;
    }

    // 리소스 압박 중이면 권장 지연만큼 주기 연장
    private Duration nextInterval() {
        if (throttleAdvisor.shouldThrottle()) {
            return pollInterval.plus(throttleAdvisor.recommendedDelay());
        }
        return pollInterval;
    }

    int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public List<ModelRecord> getModels() {
        return registry.getModels();
    }

    public Optional<ModelRecord> getModel(String id) {
        return registry.getModel(id);
    }

    public boolean hasModels() {
        return !registry.isEmpty();
    }

    public int getModelCount() {
        return registry.size();
    }
}

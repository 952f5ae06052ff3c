package com.llmhub.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.function.ToDoubleFunction;

/**
 * 브리지/게이트웨이 공통 관측 메트릭
 * - 태그 값은 고정된 소수 집합만 사용 (cardinality 증가 방지)
 */
@Component
public class HubMetrics {

    private final MeterRegistry registry;

    // 업스트림 재시도 누적 카운터
    private final Counter upstreamRetries;

    // CircuitBreaker OPEN 으로 즉시 차단된 호출 누적 카운터
    private final Counter circuitRejected;

    public HubMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.upstreamRetries = Counter.builder("upstream_retries_total")
                .description("Total retry attempts against the inference backend")
                .register(registry);
        this.circuitRejected = Counter.builder("upstream_circuit_rejected_total")
                .description("Calls rejected while the upstream circuit was open")
                .register(registry);
    }

    // 업스트림 요청 결과 (success / failure)
    public void upstreamRequest(String outcome) {
        registry.counter("upstream_requests_total", "outcome", outcome).increment();
    }

    public void upstreamRetry() {
        upstreamRetries.increment();
    }

    public void circuitRejected() {
        circuitRejected.increment();
    }

    // 복구 시도 결과 (success / failure / skipped)
    public void recoveryAttempt(String outcome) {
        registry.counter("recovery_attempts_total", "outcome", outcome).increment();
    }

    // 예측 정비 조치 (memory_cleanup / cpu_priority / disk_cleanup / error_mitigation)
    public void maintenanceAction(String action) {
        registry.counter("maintenance_actions_total", "action", action).increment();
    }

    // 게이트웨이 라우팅 결과 (ToolCallStatus 코드)
    public void routeOutcome(String status) {
        registry.counter("gateway_route_total", "status", status).increment();
    }

    public <T> void gauge(String name, String description, T target, ToDoubleFunction<T> value) {
        Gauge.builder(name, target, value)
                .description(description)
                .register(registry);
    }

    public double getUpstreamRetryCount() {
        return upstreamRetries.count();
    }

    public double getCircuitRejectedCount() {
        return circuitRejected.count();
    }
}

package com.llmhub.dto;

import java.time.Instant;

/**
 * 업스트림 연결 상태 (health 보고용 읽기 전용 스냅샷)
 */
public record ConnectionStatus(
        boolean healthy,
        // CLOSED / OPEN / HALF_OPEN
        String circuitBreakerState,
        int consecutiveFailures,
        Instant lastSuccessAt,
        double secondsSinceLastSuccess,
        Instant lastFailureAt,
        String baseUrl
) {

    public boolean isCircuitOpen() {
        return "OPEN".equals(circuitBreakerState);
    }
}

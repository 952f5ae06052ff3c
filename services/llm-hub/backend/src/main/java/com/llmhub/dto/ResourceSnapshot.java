package com.llmhub.dto;

import java.time.Instant;

/**
 * 호스트/자기 프로세스 리소스 사용률 (최근 1회 샘플만 유지)
 */
public record ResourceSnapshot(
        Instant timestamp,
        double systemCpuPercent,
        double systemMemoryPercent,
        double processCpuPercent,
        double processMemoryPercent
) {

    public static ResourceSnapshot empty(Instant timestamp) {
        return new ResourceSnapshot(timestamp, 0.0, 0.0, 0.0, 0.0);
    }
}

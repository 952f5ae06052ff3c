package com.llmhub.dto;

import java.time.Instant;

/**
 * 예측 정비 상태 (health 보고용)
 */
public record PredictionStatus(
        boolean monitoringActive,
        Trends trends,
        ErrorFrequency errorFrequency,
        LastActions lastActions,
        DataPoints dataPoints
) {

    public record Trends(
            double memoryGrowthPerHour,
            double cpuTrendPerHour,
            double diskGrowthPerDay
    ) {}

    public record ErrorFrequency(int errorsLastHour, int threshold) {}

    public record LastActions(
            Instant lastCleanupAt,   // null 가능
            Instant lastCpuActionAt, // null 가능
            Instant lastRestartAt,   // null 가능
            long cleanupCooldownRemainingSeconds,
            long cpuCooldownRemainingSeconds,
            long restartCooldownRemainingSeconds
    ) {}

    public record DataPoints(int memorySamples, int cpuSamples, int diskSamples, int errorSamples) {}
}

package com.llmhub.dto;

public record ResourceStatus(
        boolean monitoringActive,
        ResourceSnapshot snapshot,
        double maxCpuPercent,
        double maxMemoryPercent,
        ThrottleState throttle,
        boolean userActivityDetected
) {}

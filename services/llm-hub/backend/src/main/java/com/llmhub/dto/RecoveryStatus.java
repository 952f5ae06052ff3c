package com.llmhub.dto;

import java.time.Instant;

public record RecoveryStatus(
        int recoveryAttempts,
        int maxRecoveryAttempts,
        Instant lastRecoveryAt,          // null 가능 (시도 이력 없음)
        Double secondsSinceLastRecovery, // null 가능
        boolean cooldownActive,
        boolean recoveryAvailable
) {}

package com.llmhub.dto;

import java.time.ZonedDateTime;

/**
 * 브리지 Raw 계측 스냅샷 (상태 판단 없음)
 */
public record BridgeSnapshot(
    ZonedDateTime timestamp,
    // 업스트림 연결 / CircuitBreaker
    ConnectionStatus connection,
    // 자동 복구 상태
    RecoveryStatus recovery,
    // 리소스 / 스로틀
    ResourceStatus resources,
    // 예측 정비 추세
    PredictionStatus predictions,
    int registeredModels,
    boolean discoveryRunning
) {}

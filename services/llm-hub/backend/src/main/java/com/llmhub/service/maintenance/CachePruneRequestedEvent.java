package com.llmhub.service.maintenance;

import java.time.Instant;

/**
 * 선제적 메모리 정리 시 발행, 인메모리 캐시 보유자가 정리 수행
 */
public record CachePruneRequestedEvent(Instant requestedAt) {}

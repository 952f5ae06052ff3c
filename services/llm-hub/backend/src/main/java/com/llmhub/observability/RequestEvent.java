package com.llmhub.observability;

import java.time.Instant;

/**
 * 게이트웨이 요청 관측 이벤트
 * - client: 토큰 지문(token:...) 또는 IP(ip:...)
 */
public record RequestEvent(
        Instant timestamp,
        String traceId,
        String client,
        String method,
        String path,
        int status,
        String event,
        long durationMs
) {}

package com.llmhub.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * 요청/폴링 사이클 단위 trace_id 관리
 */
public final class TraceContext {

    public static final String TRACE_ID_KEY = "trace_id";

    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private TraceContext() {
    }

    /**
     * trace_id 조회 (없으면 생성)
     */
    public static String getOrCreate() {
        String traceId = MDC.get(TRACE_ID_KEY);

        if (traceId == null) {
            traceId = generate();
            MDC.put(TRACE_ID_KEY, traceId);
        }

        return traceId;
    }

    public static String current() {
        return MDC.get(TRACE_ID_KEY);
    }

    /**
     * trace_id 제거 (요청/사이클 종료 시)
     */
    public static void clear() {
        MDC.remove(TRACE_ID_KEY);
    }

    private static String generate() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}

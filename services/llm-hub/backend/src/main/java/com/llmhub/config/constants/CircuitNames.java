package com.llmhub.config.constants;

public final class CircuitNames {

    private CircuitNames() {
    }

    /** 추론 백엔드 업스트림 CircuitBreaker (application.yml resilience4j 인스턴스 이름) */
    public static final String UPSTREAM = "lmStudioUpstream";
}

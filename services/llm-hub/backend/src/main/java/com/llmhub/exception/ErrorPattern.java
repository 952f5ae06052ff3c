package com.llmhub.exception;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 복구 전략 선택용 오류 패턴 (닫힌 열거)
 * - 실패 지점에서 직접 지정한다. 메시지 문자열 매칭으로 추론하지 않음
 */
public enum ErrorPattern {

    CONNECTION_REFUSED("connection_refused"),
    TIMEOUT("timeout"),
    SERVICE_UNAVAILABLE("service_unavailable"),
    CIRCUIT_BREAKER("circuit_breaker"),
    NETWORK_ERROR("network_error"),
    GENERIC("generic");

    private final String code;

    ErrorPattern(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}

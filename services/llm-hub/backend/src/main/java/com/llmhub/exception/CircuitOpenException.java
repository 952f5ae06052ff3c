package com.llmhub.exception;

/**
 * CircuitBreaker OPEN 상태에서의 즉시 실패
 * - 새로운 breaker 실패로 집계하지 않는다
 */
public class CircuitOpenException extends UpstreamException {

    public CircuitOpenException(String message) {
        super(message, ErrorPattern.CIRCUIT_BREAKER, null);
    }
}

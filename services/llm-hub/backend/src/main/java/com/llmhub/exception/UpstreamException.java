package com.llmhub.exception;

import lombok.Getter;

/**
 * 업스트림(추론 백엔드) 호출 실패의 공통 부모
 * - 실패 지점에서 분류한 ErrorPattern 을 함께 전달
 */
@Getter
public abstract class UpstreamException extends RuntimeException {

    private final ErrorPattern errorPattern;

    protected UpstreamException(String message, ErrorPattern errorPattern, Throwable cause) {
        super(message, cause);
        this.errorPattern = errorPattern;
    }
}

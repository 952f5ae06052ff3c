package com.llmhub.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 정상 흐름 내에서 발생 가능한 비즈니스 예외
 * - code: 시스템/비즈니스 식별용 에러 코드
 * - status: 응답 HTTP 상태
 */
@Getter
public class ApiException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    public ApiException(String code, String message, HttpStatus status) {
        super(message);
        this.code = code;
        this.status = status;
    }

    public ApiException(String code, String message, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }
}

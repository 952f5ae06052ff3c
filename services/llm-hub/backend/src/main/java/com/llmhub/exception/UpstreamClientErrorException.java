package com.llmhub.exception;

import lombok.Getter;

/**
 * 4xx (429 제외) 응답. 재시도하지 않는 종결 실패
 */
@Getter
public class UpstreamClientErrorException extends UpstreamException {

    private final int statusCode;

    public UpstreamClientErrorException(String message, int statusCode, Throwable cause) {
        super(message, ErrorPattern.GENERIC, cause);
        this.statusCode = statusCode;
    }
}

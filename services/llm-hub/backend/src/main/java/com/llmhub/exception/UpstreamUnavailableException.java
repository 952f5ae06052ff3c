package com.llmhub.exception;

/**
 * 재시도를 모두 소진했거나 복구 불가능한 전송 실패
 */
public class UpstreamUnavailableException extends UpstreamException {

    public UpstreamUnavailableException(String message, ErrorPattern errorPattern, Throwable cause) {
        super(message, errorPattern, cause);
    }
}

package com.llmhub.logging;

import com.llmhub.exception.ApiException;
import com.llmhub.exception.ErrorPattern;
import com.llmhub.exception.UpstreamClientErrorException;
import com.llmhub.exception.UpstreamException;
import org.slf4j.event.Level;

/**
 * 로그 레벨 판단 정책
 * - 예외 타입과 ErrorPattern 으로만 판단 (메시지 문자열 비교 없음)
 */
public final class LogLevelPolicy {

    private LogLevelPolicy() {
    }

    /**
     * 예외 기반 로그 레벨 결정
     */
    public static Level decideByException(Throwable t) {

        if (t == null) {
            return Level.INFO;
        }

        // 4xx 응답은 호출자 문제
        if (t instanceof UpstreamClientErrorException) {
            return Level.WARN;
        }

        // CircuitBreaker OPEN / 일시적 전송 장애는 복구 대상
        if (t instanceof UpstreamException upstream) {
            return upstream.getErrorPattern() == ErrorPattern.GENERIC ? Level.ERROR : Level.WARN;
        }

        // 비즈니스 예외: 4xx 는 WARN, 5xx 는 ERROR
        if (t instanceof ApiException api) {
            return api.getStatus().is4xxClientError() ? Level.WARN : Level.ERROR;
        }

        return Level.ERROR;
    }
}

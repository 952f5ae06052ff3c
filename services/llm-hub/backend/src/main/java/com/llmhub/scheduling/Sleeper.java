package com.llmhub.scheduling;

import java.time.Duration;

/**
 * 대기 지점 추상화
 * - 폴링 루프, 재시도 backoff, 복구 전략의 대기는 모두 이 인터페이스를 통과한다
 * - 인터럽트 = 취소 신호
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}

package com.llmhub.state;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 런타임 토글 가능한 게이트웨이 기능 플래그
 */
@Component
public class RuntimeFeatureState {

    private final AtomicBoolean rateLimitEnabled;

    public RuntimeFeatureState(@Value("${rate-limit.enabled:true}") boolean rateInit) {
        this.rateLimitEnabled = new AtomicBoolean(rateInit);
    }

    public boolean isRateLimitEnabled() {
        return rateLimitEnabled.get();
    }

    /**
     * @return 토글 이후의 값
     */
    public boolean toggleRateLimit() {
        while (true) {
            boolean prev = rateLimitEnabled.get();
            boolean next = !prev;

            // 다른 스레드가 먼저 바꿨다면 최신 값으로 재시도
            if (rateLimitEnabled.compareAndSet(prev, next)) {
                return next;
            }
        }
    }
}

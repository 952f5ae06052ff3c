package com.llmhub.service.resource;

import java.time.Duration;

/**
 * 리소스 압박 기반 지연 힌트 (업스트림 클라이언트/디스커버리가 읽기 전용으로 소비)
 */
public interface ThrottleAdvisor {

    ThrottleAdvisor NONE = new ThrottleAdvisor() {
        @Override
        public boolean shouldThrottle() {
            return false;
        }

        @Override
        public Duration recommendedDelay() {
            return Duration.ZERO;
        }
    };

    boolean shouldThrottle();

    Duration recommendedDelay();
}

package com.llmhub.dto;

import java.time.Duration;

/**
 * 스로틀 레벨(0~5)과 그에 따른 권장 지연
 */
public record ThrottleState(int level, Duration recommendedDelay) {

    public static final ThrottleState NONE = new ThrottleState(0, Duration.ZERO);

    public boolean isThrottled() {
        return level > 0;
    }
}

package com.llmhub.service.maintenance;

import com.llmhub.exception.ErrorPattern;

/**
 * 분류된 오류를 공유 에러 로그에 기록
 */
@FunctionalInterface
public interface ErrorRecorder {

    ErrorRecorder NONE = pattern -> { };

    void recordError(ErrorPattern pattern);
}

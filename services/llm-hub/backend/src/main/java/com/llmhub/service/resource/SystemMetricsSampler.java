package com.llmhub.service.resource;

import com.llmhub.dto.ResourceSnapshot;

/**
 * 호스트/프로세스 계측 소스
 */
public interface SystemMetricsSampler {

    ResourceSnapshot sample();

    /**
     * 디스크 사용률(%)
     */
    double diskUsedPercent();
}

package com.llmhub.service.resource;

public interface ProcessPriorityAdjuster {

    /**
     * @return 적용 성공 여부
     */
    boolean apply(ProcessPriority priority);
}

package com.llmhub.dto;

import java.util.Map;

/**
 * 애그리게이터 입력 1건
 * - service: 오류 보고용 라벨 (없으면 tool 이름 사용)
 */
public record ServiceCall(String service, String tool, Map<String, Object> parameters) {

    public ServiceCall {
        parameters = parameters == null ? Map.of() : parameters;
    }

    public String label() {
        return service != null && !service.isBlank() ? service : tool;
    }
}

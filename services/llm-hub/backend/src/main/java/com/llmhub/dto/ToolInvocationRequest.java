package com.llmhub.dto;

import java.util.Map;

/**
 * POST /mcp/tools/{name} 요청 바디
 */
public record ToolInvocationRequest(Map<String, Object> parameters) {

    public ToolInvocationRequest {
        parameters = parameters == null ? Map.of() : parameters;
    }
}

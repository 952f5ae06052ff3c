package com.llmhub.dto;

import java.time.Instant;
import java.util.Map;

/**
 * 게이트웨이 레지스트리 항목 (서비스 이름 = 키)
 */
public record ServiceRegistryEntry(
        String serviceName,
        String baseUrl,
        Map<String, ToolDescriptor> tools,
        Instant lastSeen,
        boolean healthy
) {

    public ServiceRegistryEntry {
        tools = Map.copyOf(tools);
    }

    public boolean hasTool(String toolName) {
        return tools.containsKey(toolName);
    }
}

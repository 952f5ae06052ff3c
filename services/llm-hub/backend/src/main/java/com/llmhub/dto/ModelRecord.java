package com.llmhub.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * 디스커버리로 발견된 모델 1건
 * - metadata: 백엔드가 내려준 원본 JSON 그대로
 */
public record ModelRecord(
        String id,
        JsonNode metadata,
        Instant discoveredAt
) {

    public ModelRecord withMetadata(JsonNode refreshed) {
        return new ModelRecord(id, refreshed, discoveredAt);
    }
}

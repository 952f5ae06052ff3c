package com.llmhub.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * 도구 호출 결과 (라우터/애그리게이터 공통)
 * - 실패도 예외가 아닌 status 값으로 표현
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCallResult(
        ToolCallStatus status,
        JsonNode result,
        String service,
        String error,
        List<AggregatedError> errors
) {

    public static ToolCallResult success(String service, JsonNode result) {
        return new ToolCallResult(ToolCallStatus.SUCCESS, result, service, null, null);
    }

    public static ToolCallResult failure(ToolCallStatus status, String service, String error) {
        return new ToolCallResult(status, null, service, error, null);
    }

    public static ToolCallResult noCalls() {
        return new ToolCallResult(ToolCallStatus.NO_CALLS, null, null, "No service calls provided", null);
    }

    public static ToolCallResult allFailed(List<AggregatedError> errors) {
        return new ToolCallResult(ToolCallStatus.ALL_FAILED, null, null, "All services failed", List.copyOf(errors));
    }

    public boolean isSuccess() {
        return status == ToolCallStatus.SUCCESS;
    }
}

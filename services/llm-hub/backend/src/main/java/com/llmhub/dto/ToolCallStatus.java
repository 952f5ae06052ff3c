package com.llmhub.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ToolCallStatus {

    SUCCESS("success"),
    SERVICE_ERROR("service_error"),
    TIMEOUT("timeout"),
    FORWARD_ERROR("forward_error"),
    SERVICE_NOT_FOUND("service_not_found"),
    NO_CALLS("no_calls"),
    ALL_FAILED("all_failed");

    private final String code;

    ToolCallStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}

package com.llmhub.dto;

public record AggregatedError(String service, String error) {}

package com.llmhub.dto;

public record RateLimitToggleResponse(boolean enabled, String status) {}

package com.llmhub.dto;

import java.util.List;

public record AggregateRequest(List<ServiceCall> calls) {}

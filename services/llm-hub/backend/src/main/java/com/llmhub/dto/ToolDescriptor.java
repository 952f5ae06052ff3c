package com.llmhub.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolDescriptor(String name, JsonNode schema) {}

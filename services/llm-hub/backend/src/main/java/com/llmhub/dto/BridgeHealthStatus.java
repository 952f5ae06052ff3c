package com.llmhub.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BridgeHealthStatus {

    private String status;          // UP / DEGRADED / DOWN
    private String service;
    private String circuitBreaker;  // CLOSED / OPEN / HALF_OPEN
    private int models;
    private int throttleLevel;

    private String reason;          // null 가능
}

package com.llmhub.dto;

import java.time.Instant;
import java.util.List;

public record RegistryStatus(
        int services,
        int healthyServices,
        Instant lastDiscoveryAt,
        List<ServiceRegistryEntry> entries
) {}

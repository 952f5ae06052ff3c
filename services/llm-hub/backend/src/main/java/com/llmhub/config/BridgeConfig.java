package com.llmhub.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmhub.config.constants.CircuitNames;
import com.llmhub.observability.HubMetrics;
import com.llmhub.scheduling.Sleeper;
import com.llmhub.service.bridge.ModelDiscoveryService;
import com.llmhub.service.bridge.PooledUpstreamConnectionFactory;
import com.llmhub.service.bridge.RecoveryManager;
import com.llmhub.service.bridge.ToolTranslator;
import com.llmhub.service.bridge.UpstreamClient;
import com.llmhub.service.maintenance.PredictiveMaintenanceMonitor;
import com.llmhub.service.resource.JvmSystemMetricsSampler;
import com.llmhub.service.resource.ProcessPriorityAdjuster;
import com.llmhub.service.resource.ReniceProcessPriorityAdjuster;
import com.llmhub.service.resource.ResourceMonitor;
import com.llmhub.service.resource.SystemMetricsSampler;
import com.llmhub.state.ModelRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * 브리지 측 컴포넌트 조립
 *
 * - 폴링 루프(리소스/디스커버리/예측 정비)는 컨텍스트 기동 시 start, 종료 시 stop
 * - 의존 방향: ResourceMonitor → UpstreamClient → (PredictiveMaintenance, RecoveryManager) → Discovery
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "bridge.enabled", havingValue = "true", matchIfMissing = true)
public class BridgeConfig {

    @Bean
    public SystemMetricsSampler systemMetricsSampler(
            Clock clock,
            @Value("${maintenance.disk-path:${java.io.tmpdir}}") String diskPath
    ) {
        return new JvmSystemMetricsSampler(clock, new File(diskPath));
    }

    @Bean
    public ProcessPriorityAdjuster processPriorityAdjuster() {
        return new ReniceProcessPriorityAdjuster();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ResourceMonitor resourceMonitor(
            SystemMetricsSampler sampler,
            ProcessPriorityAdjuster priorityAdjuster,
            Clock clock,
            HubMetrics metrics,
            @Value("${bridge.resources.interval:10s}") Duration interval,
            @Value("${bridge.resources.max-cpu-percent:50}") double maxCpuPercent,
            @Value("${bridge.resources.max-memory-percent:50}") double maxMemoryPercent
    ) {
        ResourceMonitor monitor = new ResourceMonitor(
                sampler, priorityAdjuster, clock, interval, maxCpuPercent, maxMemoryPercent);

        metrics.gauge("resource_throttle_level", "Current throttle level (0-5)",
                monitor, m -> m.getThrottleState().level());
        return monitor;
    }

    @Bean(destroyMethod = "close")
    public UpstreamClient upstreamClient(
            CircuitBreakerRegistry circuitBreakerRegistry,
            ResourceMonitor resourceMonitor,
            ObjectMapper objectMapper,
            HubMetrics metrics,
            Clock clock,
            Sleeper sleeper,
            @Value("${bridge.upstream.base-url:http://localhost:1234}") String baseUrl,
            @Value("${bridge.upstream.timeout:30s}") Duration timeout,
            @Value("${bridge.upstream.max-retries:3}") int maxRetries
    ) {
        log.info("event=UPSTREAM_CONFIGURED baseUrl={} timeoutMs={} maxRetries={}",
                baseUrl, timeout.toMillis(), maxRetries);

        return new UpstreamClient(
                baseUrl,
                maxRetries,
                circuitBreakerRegistry.circuitBreaker(CircuitNames.UPSTREAM),
                new PooledUpstreamConnectionFactory(timeout),
                resourceMonitor,
                objectMapper,
                metrics,
                clock,
                sleeper
        );
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public PredictiveMaintenanceMonitor predictiveMaintenanceMonitor(
            SystemMetricsSampler sampler,
            ProcessPriorityAdjuster priorityAdjuster,
            UpstreamClient upstreamClient,
            ApplicationEventPublisher eventPublisher,
            HubMetrics metrics,
            Clock clock,
            @Value("${maintenance.interval:60s}") Duration interval,
            @Value("${maintenance.temp-dir:${java.io.tmpdir}/llm-hub}") String tempDir
    ) {
        return new PredictiveMaintenanceMonitor(
                sampler, priorityAdjuster, upstreamClient, eventPublisher, metrics, clock, interval, Path.of(tempDir));
    }

    @Bean
    public RecoveryManager recoveryManager(
            UpstreamClient upstreamClient,
            PredictiveMaintenanceMonitor maintenanceMonitor,
            HubMetrics metrics,
            Clock clock,
            Sleeper sleeper,
            @Value("${bridge.recovery.cooldown:60s}") Duration cooldown,
            @Value("${bridge.recovery.max-attempts:5}") int maxAttempts
    ) {
        return new RecoveryManager(upstreamClient, maintenanceMonitor, metrics, clock, sleeper, cooldown, maxAttempts);
    }

    @Bean
    public ModelRegistry modelRegistry(HubMetrics metrics) {
        ModelRegistry registry = new ModelRegistry();
        metrics.gauge("discovery_models", "Models currently in the registry", registry, ModelRegistry::size);
        return registry;
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ModelDiscoveryService modelDiscoveryService(
            UpstreamClient upstreamClient,
            RecoveryManager recoveryManager,
            ResourceMonitor resourceMonitor,
            ModelRegistry modelRegistry,
            Clock clock,
            @Value("${bridge.discovery.poll-interval:30s}") Duration pollInterval
    ) {
        return new ModelDiscoveryService(
                upstreamClient, recoveryManager, resourceMonitor, modelRegistry, clock, pollInterval);
    }

    @Bean
    public ToolTranslator toolTranslator(
            UpstreamClient upstreamClient,
            RecoveryManager recoveryManager,
            ObjectMapper objectMapper
    ) {
        return new ToolTranslator(upstreamClient, recoveryManager, objectMapper);
    }
}

package com.llmhub.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmhub.logging.TraceIdTaskDecorator;
import com.llmhub.observability.HubMetrics;
import com.llmhub.service.gateway.ResponseAggregator;
import com.llmhub.service.gateway.ServiceRegistryPoller;
import com.llmhub.service.gateway.ToolRouter;
import com.llmhub.state.ServiceRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * 게이트웨이 측 컴포넌트 조립
 */
@Configuration
@ConditionalOnProperty(name = "gateway.enabled", havingValue = "true", matchIfMissing = true)
public class GatewayConfig {

    @Bean
    public ServiceRegistry serviceRegistry(HubMetrics metrics) {
        ServiceRegistry registry = new ServiceRegistry();
        metrics.gauge("gateway_registered_services", "Services currently in the gateway registry",
                registry, ServiceRegistry::size);
        return registry;
    }

    /**
     * 브리지 폴링/도구 호출 전달용 (호출 단위 timeout)
     */
    @Bean
    public RestTemplate gatewayRestTemplate(
            RestTemplateBuilder builder,
            @Value("${gateway.forward-timeout:30s}") Duration forwardTimeout
    ) {
        return builder
                .setConnectTimeout(forwardTimeout)
                .setReadTimeout(forwardTimeout)
                .build();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ServiceRegistryPoller serviceRegistryPoller(
            @Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
            ServiceRegistry serviceRegistry,
            Clock clock,
            @Value("${gateway.service-name:lm-studio-bridge}") String serviceName,
            @Value("${gateway.bridge-url:http://localhost:${server.port:8080}}") String bridgeUrl,
            @Value("${gateway.poll-interval:30s}") Duration pollInterval
    ) {
        return new ServiceRegistryPoller(restTemplate, serviceRegistry, clock, serviceName, bridgeUrl, pollInterval);
    }

    @Bean
    public ToolRouter toolRouter(
            @Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
            ServiceRegistry serviceRegistry,
            ObjectMapper objectMapper,
            HubMetrics metrics
    ) {
        return new ToolRouter(restTemplate, serviceRegistry, objectMapper, metrics);
    }

    /**
     * 다중 호출 fan-out 전용 풀 (요청 스레드와 분리)
     */
    @Bean
    public ThreadPoolTaskExecutor aggregatorExecutor(
            @Value("${gateway.aggregator.pool-size:8}") int poolSize,
            @Value("${gateway.aggregator.queue-capacity:100}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("aggregate-");
        executor.setTaskDecorator(new TraceIdTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public ResponseAggregator responseAggregator(
            ToolRouter toolRouter,
            @Qualifier("aggregatorExecutor") ThreadPoolTaskExecutor aggregatorExecutor,
            @Value("${gateway.aggregate-timeout:30s}") Duration aggregateTimeout
    ) {
        return new ResponseAggregator(toolRouter, aggregatorExecutor, aggregateTimeout);
    }
}

package com.llmhub.config.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 관측 메트릭 정의
 * - 게이트웨이 Rate Limit Counter 명시 등록
 * - 브리지/게이트웨이 도메인 메트릭은 HubMetrics 에서 관리
 */
@Configuration
public class MetricsConfig {

    /**
     * 모든 메트릭에 공통 tag 부여
     */
    @Bean
    MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
                .commonTags("service", "llm-hub-backend");
    }

    /**
     * Rate Limit 차단 누적 카운터
     * label을 두지 않아 cardinality 증가 방지 (토큰별 구분 없음)
     */
    @Bean
    public Counter rateLimitBlockedCounter(MeterRegistry registry) {
        return Counter.builder("rate_limit_blocked_total")
                .description("Gateway requests blocked by the per-token rate limit")
                .register(registry);
    }

    @Bean
    public Counter rateLimitAllowedCounter(MeterRegistry registry) {
        return Counter.builder("rate_limit_allowed_total")
                .description("Gateway requests allowed by the per-token rate limit")
                .register(registry);
    }

    /**
     * 인증 실패 누적 카운터
     */
    @Bean
    public Counter authRejectedCounter(MeterRegistry registry) {
        return Counter.builder("gateway_auth_rejected_total")
                .description("Gateway requests rejected for a missing or invalid bearer token")
                .register(registry);
    }
}

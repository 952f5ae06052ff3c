package com.llmhub.config.filter;

import com.llmhub.filter.ApiTokenAuthFilter;
import com.llmhub.filter.ClientKeyResolver;
import com.llmhub.filter.RateLimitBucketStore;
import com.llmhub.filter.RateLimitFilter;
import com.llmhub.filter.TraceIdFilter;
import com.llmhub.observability.RequestEventBuffer;
import com.llmhub.state.RuntimeFeatureState;
import io.micrometer.core.instrument.Counter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Filter 실행 순서 고정
 *
 * 1. TraceIdFilter      : 모든 요청, trace_id 생성/재사용
 * 2. ApiTokenAuthFilter : /api/gateway/*, Bearer 토큰 검증
 * 3. RateLimitFilter    : /api/gateway/*, 인증된 토큰 단위 제한
 *
 * 로직은 Filter에 두고, 이 클래스는 "순서"와 "적용 경로"만 책임
 */
@Configuration
public class FilterOrderConfig {

    private static final String GATEWAY_API = "/api/gateway/*";

    @Bean
    public FilterRegistrationBean<TraceIdFilter> traceIdFilterRegistration() {
        FilterRegistrationBean<TraceIdFilter> registration = new FilterRegistrationBean<>();
        registration.setFilter(new TraceIdFilter());
        registration.setOrder(1);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<ApiTokenAuthFilter> apiTokenAuthFilterRegistration(
            ClientKeyResolver clientKeyResolver,
            Counter authRejectedCounter,
            @Value("${gateway.auth.enabled:true}") boolean authEnabled,
            @Value("${gateway.auth.api-key:changeme}") String apiKey
    ) {
        FilterRegistrationBean<ApiTokenAuthFilter> registration = new FilterRegistrationBean<>();
        registration.setFilter(new ApiTokenAuthFilter(clientKeyResolver, authRejectedCounter, authEnabled, apiKey));
        registration.addUrlPatterns(GATEWAY_API);

        // trace_id 생성 이후 실행
        registration.setOrder(2);

        return registration;
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(
            ClientKeyResolver clientKeyResolver,
            RateLimitBucketStore rateLimitBucketStore,
            RuntimeFeatureState runtimeFeatureState,
            RequestEventBuffer requestEventBuffer,
            Counter rateLimitBlockedCounter,
            Counter rateLimitAllowedCounter
    ) {
        RateLimitFilter filter = new RateLimitFilter(
                clientKeyResolver,
                rateLimitBucketStore,
                runtimeFeatureState,
                requestEventBuffer,
                rateLimitBlockedCounter,
                rateLimitAllowedCounter
        );

        FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>();
        registration.setFilter(filter);
        registration.addUrlPatterns(GATEWAY_API);

        // 인증 이후 실행 → 유효 토큰만 버킷 소비
        registration.setOrder(3);

        return registration;
    }
}

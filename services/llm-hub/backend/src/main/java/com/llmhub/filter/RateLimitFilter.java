package com.llmhub.filter;

import com.llmhub.logging.LogEvent;
import com.llmhub.logging.TraceContext;
import com.llmhub.observability.RequestEvent;
import com.llmhub.observability.RequestEventBuffer;
import com.llmhub.state.RuntimeFeatureState;
import io.micrometer.core.instrument.Counter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;

@Slf4j
@RequiredArgsConstructor
public class RateLimitFilter extends OncePerRequestFilter {

    /**
     * 토큰 기반 Rate Limit Filter
     *
     * - ApiTokenAuthFilter 이후 실행 (인증된 토큰 단위로 제한)
     * - FilterOrderConfig 에서 /api/gateway/* 에만 등록
     * - Bucket4j Token Bucket 방식 사용
     * - 런타임 ON/OFF 가능
     * - 차단/허용 이벤트를 메트릭 + RequestEventBuffer 기록
     */

    private final ClientKeyResolver clientKeyResolver;
    private final RateLimitBucketStore bucketStore;
    private final RuntimeFeatureState runtimeFeatureState;
    private final RequestEventBuffer requestEventBuffer;
    private final Counter rateLimitBlockedCounter;
    private final Counter rateLimitAllowedCounter;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String traceId = TraceContext.current();
        String clientKey = clientKeyResolver.resolve(request);
        long start = System.currentTimeMillis();

        // 런타임 비활성화 또는 제한 없음 설정
        if (!runtimeFeatureState.isRateLimitEnabled() || !bucketStore.isLimited()) {
            filterChain.doFilter(request, response);
            record(traceId, clientKey, request, response.getStatus(), "REQUEST_COMPLETED", start);
            return;
        }

        // 토큰 소비 성공 → 요청 허용
        if (bucketStore.tryConsume(clientKey)) {
            rateLimitAllowedCounter.increment();

            filterChain.doFilter(request, response);

            record(traceId, clientKey, request, response.getStatus(), "REQUEST_COMPLETED", start);
            return;
        }

        // 토큰 부족 → 요청 차단 (429)
        rateLimitBlockedCounter.increment();

        log.warn(
                "event={} traceId={} client={} uri={}",
                LogEvent.RATE_LIMIT_REJECTED,
                traceId,
                clientKey,
                request.getRequestURI()
        );

        int statusCode = HttpStatus.TOO_MANY_REQUESTS.value();
        response.setStatus(statusCode);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(
                """
                {
                  "httpCode": %d,
                  "data": null,
                  "error": {
                    "code": "RATE_LIMIT_EXCEEDED",
                    "message": "Rate limit exceeded"
                  }
                }
                """.formatted(statusCode)
        );
        response.getWriter().flush();

        record(traceId, clientKey, request, statusCode, "RATE_LIMITED", start);
    }

    private void record(
            String traceId,
            String clientKey,
            HttpServletRequest request,
            int status,
            String event,
            long start
    ) {
        requestEventBuffer.add(new RequestEvent(
                Instant.now(),
                traceId,
                clientKey,
                request.getMethod(),
                request.getRequestURI(),
                status,
                event,
                System.currentTimeMillis() - start
        ));
    }
}

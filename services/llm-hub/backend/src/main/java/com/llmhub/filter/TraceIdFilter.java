package com.llmhub.filter;

import com.llmhub.logging.TraceContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * HTTP 요청 단위 trace_id 생성 및 MDC 전파
 * - 게이트웨이 → 브리지 전달 시 X-Trace-Id 를 재사용하므로 두 구간 로그가 같은 trace_id 로 묶임
 */
public class TraceIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String incoming = request.getHeader(TraceContext.TRACE_ID_HEADER);

        String traceId;
        if (incoming != null && !incoming.isBlank()) {
            MDC.put(TraceContext.TRACE_ID_KEY, incoming);
            traceId = incoming;
        } else {
            traceId = TraceContext.getOrCreate();
        }

        // 응답 헤더로 돌려줘 장애 문의 시 추적 가능
        response.setHeader(TraceContext.TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // 서버 스레드 재사용으로 인한 trace_id 오염 방지
            MDC.clear();
        }
    }
}

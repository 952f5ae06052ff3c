package com.llmhub.filter;

import com.llmhub.logging.LogEvent;
import com.llmhub.logging.TraceContext;
import io.micrometer.core.instrument.Counter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * 게이트웨이 API Bearer 토큰 인증
 *
 * - FilterOrderConfig 에서 /api/gateway/* 에만 등록
 * - 비활성화 시 모든 요청 통과
 * - 토큰 누락/불일치 → 401 (DefaultResponse 형태)
 */
@Slf4j
public class ApiTokenAuthFilter extends OncePerRequestFilter {

    private final ClientKeyResolver clientKeyResolver;
    private final Counter authRejectedCounter;
    private final boolean enabled;
    private final byte[] apiKey;

    public ApiTokenAuthFilter(
            ClientKeyResolver clientKeyResolver,
            Counter authRejectedCounter,
            boolean enabled,
            String apiKey
    ) {
        this.clientKeyResolver = clientKeyResolver;
        this.authRejectedCounter = authRejectedCounter;
        this.enabled = enabled;
        this.apiKey = apiKey.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        if (!enabled) {
            filterChain.doFilter(request, response);
            return;
        }

        Optional<String> token = clientKeyResolver.bearerToken(request);

        if (token.isPresent() && matches(token.get())) {
            filterChain.doFilter(request, response);
            return;
        }

        authRejectedCounter.increment();

        log.warn(
                "event={} traceId={} ip={} uri={} reason={}",
                LogEvent.AUTH_REJECTED,
                TraceContext.current(),
                clientKeyResolver.resolveIp(request),
                request.getRequestURI(),
                token.isPresent() ? "invalid_token" : "missing_token"
        );

        int statusCode = HttpStatus.UNAUTHORIZED.value();
        response.setStatus(statusCode);
        response.setHeader("WWW-Authenticate", "Bearer");
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(
                """
                {
                  "httpCode": %d,
                  "data": null,
                  "error": {
                    "code": "UNAUTHORIZED",
                    "message": "Invalid authentication token"
                  }
                }
                """.formatted(statusCode)
        );
        response.getWriter().flush();
    }

    // 상수 시간 비교
    private boolean matches(String token) {
        return MessageDigest.isEqual(apiKey, token.getBytes(StandardCharsets.UTF_8));
    }
}

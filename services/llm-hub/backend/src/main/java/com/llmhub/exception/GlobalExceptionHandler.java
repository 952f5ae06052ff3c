package com.llmhub.exception;

import com.llmhub.dto.DefaultResponse;
import com.llmhub.filter.ClientKeyResolver;
import com.llmhub.logging.LogEvent;
import com.llmhub.logging.TraceContext;
import com.llmhub.observability.RequestEvent;
import com.llmhub.observability.RequestEventBuffer;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@Slf4j
@RestControllerAdvice(basePackages = "com.llmhub.controller")
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final RequestEventBuffer requestEventBuffer;
    private final ClientKeyResolver clientKeyResolver;

    /**
     * 업스트림 CircuitBreaker OPEN
     *
     * - 서버 내부 오류(500)가 아닌 보호 상태(503)로 응답
     * - 관측을 위해 RequestEventBuffer에 CIRCUIT_OPEN 이벤트 기록
     */
    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<DefaultResponse<Void>> handleCircuitOpen(
            CircuitOpenException e,
            HttpServletRequest request) {

        log.warn("event={} trace_id={}", LogEvent.CIRCUIT_OPEN, TraceContext.current());
        record(request, HttpStatus.SERVICE_UNAVAILABLE, LogEvent.CIRCUIT_OPEN);

        return failure(HttpStatus.SERVICE_UNAVAILABLE, "CIRCUIT_OPEN", "circuit breaker is open");
    }

    /**
     * 재시도 소진 후 업스트림 사용 불가
     */
    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<DefaultResponse<Void>> handleUpstreamUnavailable(
            UpstreamUnavailableException e,
            HttpServletRequest request) {

        log.warn(
                "event={} pattern={} trace_id={}",
                LogEvent.UPSTREAM_FAILED,
                e.getErrorPattern().getCode(),
                TraceContext.current()
        );
        record(request, HttpStatus.SERVICE_UNAVAILABLE, LogEvent.UPSTREAM_FAILED);

        return failure(HttpStatus.SERVICE_UNAVAILABLE, "UPSTREAM_UNAVAILABLE", e.getMessage());
    }

    /**
     * 업스트림이 요청을 거절 (4xx, 재시도 없음)
     */
    @ExceptionHandler(UpstreamClientErrorException.class)
    public ResponseEntity<DefaultResponse<Void>> handleUpstreamClientError(UpstreamClientErrorException e) {
        log.warn(
                "event={} upstreamStatus={} trace_id={}",
                LogEvent.BUSINESS_EXCEPTION,
                e.getStatusCode(),
                TraceContext.current()
        );

        return failure(HttpStatus.BAD_GATEWAY, "UPSTREAM_REJECTED", e.getMessage());
    }

    /**
     * 비즈니스 예외 처리
     * - 정상 흐름 내에서 발생 가능한 예외
     * - ERROR가 아닌 WARN 수준으로 기록
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<DefaultResponse<Void>> handleApiException(ApiException e) {
        log.warn(
                "event={} code={} trace_id={}",
                LogEvent.BUSINESS_EXCEPTION,
                e.getCode(),
                TraceContext.current()
        );

        return failure(e.getStatus(), e.getCode(), e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<DefaultResponse<Void>> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("event={} code=INVALID_REQUEST trace_id={}", LogEvent.BUSINESS_EXCEPTION, TraceContext.current());

        return failure(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "request body is not valid JSON");
    }

    /**
     * 예상하지 못한 예외 처리
     * - 반드시 로그를 남겨 "로그 없는 장애"를 방지
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<DefaultResponse<Void>> handleException(Exception e) {
        log.error(
                "event={} trace_id={}",
                LogEvent.UNHANDLED_EXCEPTION,
                TraceContext.current(),
                e
        );

        return failure(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다");
    }

    private void record(HttpServletRequest request, HttpStatus status, String event) {
        requestEventBuffer.add(
                new RequestEvent(
                        Instant.now(),
                        TraceContext.current(),
                        clientKeyResolver.resolve(request),
                        request.getMethod(),
                        request.getRequestURI(),
                        status.value(),
                        event,
                        0L // 업스트림 실행 전/후 차단 시점, 처리 시간은 필터 이벤트에서 기록
                )
        );
    }

    private static ResponseEntity<DefaultResponse<Void>> failure(HttpStatus status, String code, String message) {
        return ResponseEntity
                .status(status)
                .body(DefaultResponse.failure(status.value(), code, message));
    }
}

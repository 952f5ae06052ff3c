package com.llmhub.service.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llmhub.dto.ConnectionStatus;
import com.llmhub.exception.CircuitOpenException;
import com.llmhub.exception.ErrorPattern;
import com.llmhub.exception.UpstreamClientErrorException;
import com.llmhub.exception.UpstreamException;
import com.llmhub.exception.UpstreamUnavailableException;
import com.llmhub.logging.LogEvent;
import com.llmhub.observability.HubMetrics;
import com.llmhub.scheduling.Sleeper;
import com.llmhub.service.resource.ThrottleAdvisor;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.ConnectTimeoutException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 추론 백엔드 호출 경로 (CircuitBreaker + 재시도 + 복구 훅)
 *
 * - 시도마다 breaker 허용 여부 확인, OPEN 이면 즉시 CircuitOpenException (실패로 집계하지 않음)
 * - 4xx(429 제외): 실패 1회 기록 후 재시도 없이 종료
 * - 전송 오류 / timeout / 5xx / 429: 최대 maxRetries+1 회 시도
 * - 시도 사이 대기: min(2^attempt, 30)s (+ 스로틀 활성 시 권장 지연)
 */
@Slf4j
public class UpstreamClient {

    static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private final String baseUrl;
    private final int maxRetries;
    private final CircuitBreaker circuitBreaker;
    private final UpstreamConnectionFactory connectionFactory;
    private final ThrottleAdvisor throttleAdvisor;
    private final ObjectMapper objectMapper;
    private final HubMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;

    private volatile UpstreamConnection connection;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile boolean healthy = true;
    private volatile Instant lastSuccessAt;
    private volatile Instant lastFailureAt;

    public UpstreamClient(
            String baseUrl,
            int maxRetries,
            CircuitBreaker circuitBreaker,
            UpstreamConnectionFactory connectionFactory,
            ThrottleAdvisor throttleAdvisor,
            ObjectMapper objectMapper,
            HubMetrics metrics,
            Clock clock,
            Sleeper sleeper
    ) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.maxRetries = maxRetries;
        this.circuitBreaker = circuitBreaker;
        this.connectionFactory = connectionFactory;
        this.throttleAdvisor = throttleAdvisor;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
        this.connection = connectionFactory.create();
        this.lastSuccessAt = clock.instant();

        circuitBreaker.getEventPublisher().onStateTransition(event -> {
            CircuitBreaker.State to = event.getStateTransition().getToState();
            if (to == CircuitBreaker.State.OPEN) {
                log.warn("event={} circuit={} failures={}",
                        LogEvent.CIRCUIT_OPEN, circuitBreaker.getName(), consecutiveFailures.get());
            } else if (to == CircuitBreaker.State.CLOSED) {
                log.info("event={} circuit={}", LogEvent.CIRCUIT_CLOSED, circuitBreaker.getName());
            }
        });
    }

    /**
     * 재시도 포함 논리 호출 1회
     */
    public JsonNode call(HttpMethod method, String path, Object body) {
        UpstreamException last = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                JsonNode result = attempt(method, path, body);
                metrics.upstreamRequest("success");
                return result;

            } catch (CircuitOpenException | UpstreamClientErrorException e) {
                metrics.upstreamRequest("failure");
                healthy = false;
                throw e;

            } catch (UpstreamUnavailableException e) {
                last = e;
            }

            if (attempt < maxRetries) {
                Duration delay = retryDelay(attempt);
                log.warn("event={} method={} path={} attempt={} pattern={} delayMs={}",
                        LogEvent.UPSTREAM_RETRY, method, path, attempt + 1,
                        last.getErrorPattern().getCode(), delay.toMillis());
                metrics.upstreamRetry();

                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        metrics.upstreamRequest("failure");
        healthy = false;
        log.error("event={} method={} path={} attempts={} pattern={} message={}",
                LogEvent.UPSTREAM_FAILED, method, path, maxRetries + 1,
                last.getErrorPattern().getCode(), last.getMessage());

        throw new UpstreamUnavailableException(
                "upstream request failed after retries: " + last.getMessage(),
                last.getErrorPattern(),
                last
        );
    }

    /**
     * GET /v1/models → data 배열
     */
    public JsonNode getModels() {
        JsonNode response = call(HttpMethod.GET, "/v1/models", null);
        JsonNode data = response.path("data");
        return data.isArray() ? data : objectMapper.createArrayNode();
    }

    /**
     * POST /v1/completions
     */
    public JsonNode createCompletion(String prompt, String model, double temperature, int maxTokens) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", prompt);
        payload.put("temperature", temperature);
        payload.put("max_tokens", maxTokens);
        payload.put("stream", false);
        if (model != null && !model.isBlank()) {
            payload.put("model", model);
        }
        return call(HttpMethod.POST, "/v1/completions", payload);
    }

    /**
     * 재시도 없는 단일 probe
     */
    public boolean healthCheck() {
        try {
            attempt(HttpMethod.GET, "/v1/models", null);
            return true;
        } catch (UpstreamException e) {
            log.debug("event=HEALTH_PROBE_FAIL pattern={} message={}",
                    e.getErrorPattern().getCode(), e.getMessage());
            return false;
        }
    }

    /**
     * 복구 훅: breaker 초기화 → 연결 풀 재생성 → probe 1회
     */
    public boolean attemptRecovery() {
        log.info("event={} target=upstream_connection baseUrl={}", LogEvent.RECOVERY_ATTEMPT, baseUrl);

        circuitBreaker.reset();
        consecutiveFailures.set(0);

        swapConnection();

        boolean recovered = healthCheck();
        healthy = recovered;
        return recovered;
    }

    // 동시 복구 시 이전 연결은 정확히 한 번만 닫힘
    private synchronized void swapConnection() {
        UpstreamConnection previous = connection;
        connection = connectionFactory.create();
        previous.close();
    }

    public ConnectionStatus getConnectionStatus() {
        Instant success = lastSuccessAt;
        double secondsSinceSuccess = success == null
                ? -1
                : Duration.between(success, clock.instant()).toMillis() / 1000.0;

        return new ConnectionStatus(
                healthy,
                circuitBreaker.getState().name(),
                consecutiveFailures.get(),
                success,
                secondsSinceSuccess,
                lastFailureAt,
                baseUrl
        );
    }

    public CircuitBreaker.State getCircuitState() {
        return circuitBreaker.getState();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public synchronized void close() {
        connection.close();
    }

    /**
     * 재시도 대기: min(2^attempt, 30)s + (스로틀 활성 시) 권장 지연
     */
    Duration retryDelay(int attempt) {
        Duration delay = backoff(attempt);
        if (throttleAdvisor.shouldThrottle()) {
            Duration extra = throttleAdvisor.recommendedDelay();
            log.debug("event={} extraMs={}", LogEvent.THROTTLE_DELAY, extra.toMillis());
            delay = delay.plus(extra);
        }
        return delay;
    }

    static Duration backoff(int attempt) {
        if (attempt >= 5) {
            return MAX_BACKOFF;
        }
        Duration exponential = Duration.ofSeconds(1L << attempt);
        return exponential.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : exponential;
    }

    // 시도 1회: breaker 허용 확인 → 요청 → 결과 기록
    private JsonNode attempt(HttpMethod method, String path, Object body) {
        if (!circuitBreaker.tryAcquirePermission()) {
            metrics.circuitRejected();
            throw new CircuitOpenException("circuit breaker is open for " + baseUrl);
        }

        long start = System.nanoTime();

        try {
            ResponseEntity<String> response = connection.restTemplate().exchange(
                    URI.create(baseUrl + path),
                    method,
                    new HttpEntity<>(body, jsonHeaders()),
                    String.class
            );

            circuitBreaker.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
            recordSuccess();
            return parseBody(response.getBody());

        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();

            if (e.getStatusCode().is4xxClientError() && status != HttpStatus.TOO_MANY_REQUESTS.value()) {
                UpstreamClientErrorException failure = new UpstreamClientErrorException(
                        "upstream rejected request with HTTP " + status, status, e);
                recordFailure(start, failure);
                throw failure;
            }

            ErrorPattern pattern = status == HttpStatus.SERVICE_UNAVAILABLE.value()
                    ? ErrorPattern.SERVICE_UNAVAILABLE
                    : ErrorPattern.NETWORK_ERROR;
            UpstreamUnavailableException failure =
                    new UpstreamUnavailableException("upstream responded HTTP " + status, pattern, e);
            recordFailure(start, failure);
            throw failure;

        } catch (ResourceAccessException e) {
            UpstreamUnavailableException failure = new UpstreamUnavailableException(
                    "upstream transport failure: " + e.getMessage(), classifyTransport(e), e);
            recordFailure(start, failure);
            throw failure;

        } catch (RuntimeException e) {
            UpstreamUnavailableException failure = new UpstreamUnavailableException(
                    "upstream call failed: " + e.getMessage(), ErrorPattern.GENERIC, e);
            recordFailure(start, failure);
            throw failure;
        }
    }

    private static ErrorPattern classifyTransport(ResourceAccessException e) {
        Throwable cause = e.getCause();
        if (cause instanceof ConnectException) {
            return ErrorPattern.CONNECTION_REFUSED;
        }
        if (cause instanceof SocketTimeoutException || cause instanceof ConnectTimeoutException) {
            return ErrorPattern.TIMEOUT;
        }
        return ErrorPattern.NETWORK_ERROR;
    }

    private void recordSuccess() {
        consecutiveFailures.set(0);
        healthy = true;
        lastSuccessAt = clock.instant();
    }

    private void recordFailure(long startNanos, Throwable failure) {
        circuitBreaker.onError(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS, failure);
        consecutiveFailures.incrementAndGet();
        lastFailureAt = clock.instant();
    }

    // JSON 이 아니면 {"text": body}
    private JsonNode parseBody(String body) {
        if (body != null && !body.isBlank()) {
            try {
                return objectMapper.readTree(body);
            } catch (JsonProcessingException e) {
                log.debug("event=UPSTREAM_NON_JSON length={}", body.length());
            }
        }
        ObjectNode text = objectMapper.createObjectNode();
        text.put("text", body == null ? "" : body);
        return text;
    }

    private static HttpHeaders jsonHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

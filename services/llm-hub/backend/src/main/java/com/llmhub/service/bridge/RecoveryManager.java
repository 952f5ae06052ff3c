package com.llmhub.service.bridge;

import com.llmhub.dto.RecoveryStatus;
import com.llmhub.exception.ErrorPattern;
import com.llmhub.exception.UpstreamException;
import com.llmhub.logging.LogEvent;
import com.llmhub.observability.HubMetrics;
import com.llmhub.scheduling.Sleeper;
import com.llmhub.service.maintenance.ErrorRecorder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 오류 패턴별 자동 복구
 *
 * - 전역 상태 하나(시도 횟수, 마지막 시도 시각)를 공유
 * - 쿨다운 중이거나 최대 시도 횟수 도달 시 새 시도 없이 false
 * - 성공 시에만 시도 횟수 0 으로 초기화
 * - 실패는 예외가 아닌 boolean 으로 보고
 */
@Slf4j
public class RecoveryManager {

    static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(60);
    static final int DEFAULT_MAX_ATTEMPTS = 5;

    private static final List<Duration> NETWORK_BACKOFF =
            List.of(Duration.ofSeconds(5), Duration.ofSeconds(15), Duration.ofSeconds(30));

    private final UpstreamClient upstreamClient;
    private final ErrorRecorder errorRecorder;
    private final HubMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration cooldown;
    private final int maxAttempts;

    private final Map<ErrorPattern, RecoveryStrategy> strategies = new EnumMap<>(ErrorPattern.class);

    private int attempts;
    private Instant lastAttemptAt;

    public RecoveryManager(
            UpstreamClient upstreamClient,
            ErrorRecorder errorRecorder,
            HubMetrics metrics,
            Clock clock,
            Sleeper sleeper,
            Duration cooldown,
            int maxAttempts
    ) {
        this.upstreamClient = upstreamClient;
        this.errorRecorder = errorRecorder;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
        this.cooldown = cooldown;
        this.maxAttempts = maxAttempts;

        strategies.put(ErrorPattern.CONNECTION_REFUSED, () -> waitThen(Duration.ofSeconds(10), upstreamClient::attemptRecovery));
        strategies.put(ErrorPattern.TIMEOUT, () -> waitThen(Duration.ofSeconds(5), upstreamClient::attemptRecovery));
        strategies.put(ErrorPattern.SERVICE_UNAVAILABLE, () -> waitThen(Duration.ofSeconds(30), upstreamClient::healthCheck));
        strategies.put(ErrorPattern.CIRCUIT_BREAKER, () -> waitThen(Duration.ofSeconds(60), upstreamClient::attemptRecovery));
        strategies.put(ErrorPattern.NETWORK_ERROR, this::progressiveProbe);
        strategies.put(ErrorPattern.GENERIC, () -> waitThen(Duration.ofSeconds(10), upstreamClient::healthCheck));
    }

    /**
     * @return 복구 성공 여부 (쿨다운/최대 횟수로 생략된 경우 false)
     */
    public boolean handleError(Throwable error, String context) {
        ErrorPattern pattern = classify(error);

        // 게이트 확인 + 시도 선점만 lock 안에서, 전략 대기는 lock 밖에서
        int attempt;
        synchronized (this) {
            Instant now = clock.instant();

            if (lastAttemptAt != null && Duration.between(lastAttemptAt, now).compareTo(cooldown) < 0) {
                log.debug("event={} reason=cooldown context={}", LogEvent.RECOVERY_SKIPPED, context);
                metrics.recoveryAttempt("skipped");
                return false;
            }

            if (attempts >= maxAttempts) {
                log.warn("event={} reason=max_attempts attempts={} context={}",
                        LogEvent.RECOVERY_SKIPPED, attempts, context);
                metrics.recoveryAttempt("skipped");
                return false;
            }

            attempts++;
            lastAttemptAt = now;
            attempt = attempts;
        }

        errorRecorder.recordError(pattern);

        log.info("event={} pattern={} attempt={} maxAttempts={} context={}",
                LogEvent.RECOVERY_ATTEMPT, pattern.getCode(), attempt, maxAttempts, context);

        boolean recovered;
        try {
            recovered = strategies.get(pattern).recover();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recovered = false;
        }

        if (recovered) {
            synchronized (this) {
                attempts = 0;
            }
            metrics.recoveryAttempt("success");
            log.info("event={} pattern={} context={}", LogEvent.RECOVERY_SUCCESS, pattern.getCode(), context);
        } else {
            metrics.recoveryAttempt("failure");
            log.warn("event={} pattern={} attempt={} context={}",
                    LogEvent.RECOVERY_FAIL, pattern.getCode(), attempt, context);
        }

        return recovered;
    }

    /**
     * 실패 지점에서 붙인 패턴 우선, 없으면 cause chain 의 예외 타입으로 분류
     */
    public static ErrorPattern classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof UpstreamException upstream) {
                return upstream.getErrorPattern();
            }
            if (t instanceof ConnectException) {
                return ErrorPattern.CONNECTION_REFUSED;
            }
            if (t instanceof SocketTimeoutException) {
                return ErrorPattern.TIMEOUT;
            }
            if (t instanceof IOException) {
                return ErrorPattern.NETWORK_ERROR;
            }
        }
        return ErrorPattern.GENERIC;
    }

    public synchronized RecoveryStatus getStatus() {
        Instant now = clock.instant();
        Double secondsSince = lastAttemptAt == null
                ? null
                : Duration.between(lastAttemptAt, now).toMillis() / 1000.0;
        boolean cooldownActive = lastAttemptAt != null
                && Duration.between(lastAttemptAt, now).compareTo(cooldown) < 0;

        return new RecoveryStatus(
                attempts,
                maxAttempts,
                lastAttemptAt,
                secondsSince,
                cooldownActive,
                !cooldownActive && attempts < maxAttempts
        );
    }

    /**
     * 수동 개입용 초기화
     */
    public synchronized void reset() {
        attempts = 0;
        lastAttemptAt = null;
        log.info("event=RECOVERY_RESET");
    }

    private boolean waitThen(Duration delay, RecoveryAction action) throws InterruptedException {
        sleeper.sleep(delay);
        return action.run();
    }

    // 5s → 15s → 30s 대기하며 probe
    private boolean progressiveProbe() throws InterruptedException {
        for (Duration delay : NETWORK_BACKOFF) {
            sleeper.sleep(delay);
            if (upstreamClient.healthCheck()) {
                return true;
            }
        }
        return false;
    }

    @FunctionalInterface
    private interface RecoveryStrategy {
        boolean recover() throws InterruptedException;
    }

    @FunctionalInterface
    private interface RecoveryAction {
        boolean run();
    }
}

package com.llmhub.scheduling;

import com.llmhub.logging.LogEvent;
import com.llmhub.logging.TraceContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 독립 스케줄링되는 폴링 루프의 공통 골격
 *
 * - 루프마다 단일 스레드 executor 하나를 소유 → 루프가 소유한 상태의 유일한 writer
 * - 사이클이 반환한 지연 시간으로 다음 실행을 다시 예약 (주기 가변)
 * - stop() 은 협조적 취소: 플래그 해제 → 예약 취소 → 대기 중인 사이클 인터럽트 → 종료 대기
 */
@Slf4j
public abstract class PollingLoop {

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    private final String name;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile ScheduledExecutorService executor;
    private volatile ScheduledFuture<?> pending;

    protected PollingLoop(String name) {
        this.name = name;
    }

    /**
     * 사이클 1회 실행 후 다음 사이클까지의 대기 시간을 반환
     */
    protected abstract Duration runCycle() throws InterruptedException;

    /**
     * 사이클이 예기치 않게 실패했을 때 다음 실행까지의 대기 시간
     */
    protected abstract Duration fallbackDelay();

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("event=LOOP_ALREADY_RUNNING loop={}", name);
            return;
        }

        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "loop-" + name);
            thread.setDaemon(true);
            return thread;
        });

        log.info("event=LOOP_START loop={}", name);
        schedule(Duration.ZERO);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        log.info("event=LOOP_STOP loop={}", name);

        ScheduledFuture<?> next = pending;
        if (next != null) {
            next.cancel(true);
        }

        ScheduledExecutorService current = executor;
        current.shutdownNow();

        try {
            if (!current.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("event=LOOP_STOP_TIMEOUT loop={}", name);
            }
        } catch (InterruptedException e) {
            // 호출자 스레드의 인터럽트 상태 복원
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getName() {
        return name;
    }

    /**
     * 루프 소유 상태를 변경하는 동기 작업
     * - 루프 실행 중이면 루프 스레드에서 실행 (single-writer 유지)
     * - 정지 상태면 호출자 스레드에서 직접 실행
     */
    protected <T> T runOnLoop(Callable<T> task) throws Exception {
        ScheduledExecutorService current = executor;

        if (!running.get() || current == null || current.isShutdown()) {
            return task.call();
        }

        Future<T> future = current.submit(task);
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
    }

    private void schedule(Duration delay) {
        if (!running.get()) {
            return;
        }
        try {
            pending = executor.schedule(this::tick, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // stop() 과 경합: executor 가 이미 종료됨
            log.debug("event=LOOP_SCHEDULE_REJECTED loop={}", name);
        }
    }

    private void tick() {
        if (!running.get()) {
            return;
        }

        Duration next;
        TraceContext.getOrCreate();

        try {
            next = runCycle();

        } catch (InterruptedException e) {
            // 취소 신호: 조용히 종료
            Thread.currentThread().interrupt();
            return;

        } catch (RuntimeException e) {
            log.error("event={} loop={} message={}", LogEvent.LOOP_ERROR, name, e.getMessage(), e);
            next = fallbackDelay();

        } finally {
            TraceContext.clear();
        }

        schedule(next);
    }
}

package com.llmhub.service.gateway;

import com.llmhub.dto.AggregatedError;
import com.llmhub.dto.ServiceCall;
import com.llmhub.dto.ToolCallResult;
import com.llmhub.dto.ToolCallStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 하나 이상의 도구 호출 실행
 *
 * - 0건: no_calls / 1건: 라우터 결과 그대로
 * - 여러 건: 동시 실행 (호출별 timeout), 모두 끝난 뒤 입력 순서상 첫 success 반환
 * - 전부 실패: all_failed + 입력 순서대로 서비스별 오류
 */
@Slf4j
public class ResponseAggregator {

    private final ToolRouter router;
    private final Executor executor;
    private final Duration callTimeout;

    public ResponseAggregator(ToolRouter router, Executor executor, Duration callTimeout) {
        this.router = router;
        this.executor = executor;
        this.callTimeout = callTimeout;
    }

    public ToolCallResult aggregate(List<ServiceCall> calls) {
        if (calls == null || calls.isEmpty()) {
            return ToolCallResult.noCalls();
        }

        if (calls.size() == 1) {
            ServiceCall call = calls.get(0);
            return router.route(call.tool(), call.parameters());
        }

        List<CompletableFuture<ToolCallResult>> futures = calls.stream()
                .map(this::execute)
                .toList();

        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        List<AggregatedError> errors = new ArrayList<>();
        for (int i = 0; i < calls.size(); i++) {
            ToolCallResult result = futures.get(i).join();
            if (result.isSuccess()) {
                return result;
            }
            String service = result.service() != null ? result.service() : calls.get(i).label();
            errors.add(new AggregatedError(service, result.error()));
        }

        log.warn("event=AGGREGATE_ALL_FAILED calls={}", calls.size());
        return ToolCallResult.allFailed(errors);
    }

    // 호출 1건: 예외 → service_error, 시간 초과 → timeout (남은 작업은 무시)
    private CompletableFuture<ToolCallResult> execute(ServiceCall call) {
        CompletableFuture<ToolCallResult> routed;
        try {
            routed = CompletableFuture.supplyAsync(() -> router.route(call.tool(), call.parameters()), executor);
        } catch (RejectedExecutionException e) {
            log.warn("event=AGGREGATE_REJECTED service={}", call.label());
            return CompletableFuture.completedFuture(ToolCallResult.failure(
                    ToolCallStatus.SERVICE_ERROR, call.label(), "Aggregator queue full"));
        }

        return routed
                .exceptionally(e -> ToolCallResult.failure(
                        ToolCallStatus.SERVICE_ERROR, call.label(), rootMessage(e)))
                .completeOnTimeout(
                        ToolCallResult.failure(ToolCallStatus.TIMEOUT, call.label(), "Service timeout"),
                        callTimeout.toMillis(),
                        TimeUnit.MILLISECONDS
                );
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

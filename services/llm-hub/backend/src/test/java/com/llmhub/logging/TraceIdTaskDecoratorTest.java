package com.llmhub.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class TraceIdTaskDecoratorTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void workerThreadSeesCallerTraceId() throws Exception {
        MDC.put(TraceContext.TRACE_ID_KEY, "trace-1");
        AtomicReference<String> seen = new AtomicReference<>();

        Runnable decorated = new TraceIdTaskDecorator().decorate(() -> seen.set(TraceContext.current()));
        CompletableFuture.runAsync(decorated).get();

        assertThat(seen.get()).isEqualTo("trace-1");
    }

    @Test
    void workerContextIsRestoredAfterTask() {
        MDC.put(TraceContext.TRACE_ID_KEY, "caller");
        Runnable decorated = new TraceIdTaskDecorator().decorate(() -> { });

        MDC.put(TraceContext.TRACE_ID_KEY, "worker");
        decorated.run();

        assertThat(TraceContext.current()).isEqualTo("worker");
    }
}

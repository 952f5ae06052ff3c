package com.llmhub.scheduling;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PollingLoopTest {

    static class CountingLoop extends PollingLoop {

        final AtomicInteger cycles = new AtomicInteger();
        final CountDownLatch threeCycles = new CountDownLatch(3);
        volatile boolean fail;

        CountingLoop() {
            super("counting");
        }

        @Override
        protected Duration runCycle() {
            cycles.incrementAndGet();
            threeCycles.countDown();
            if (fail) {
                throw new IllegalStateException("cycle failed");
            }
            return Duration.ofMillis(10);
        }

        @Override
        protected Duration fallbackDelay() {
            return Duration.ofMillis(10);
        }

        String threadName() throws Exception {
            return runOnLoop(() -> Thread.currentThread().getName());
        }
    }

    @Test
    void reschedulesUntilStopped() throws Exception {
        CountingLoop loop = new CountingLoop();

        loop.start();
        assertThat(loop.threeCycles.await(2, TimeUnit.SECONDS)).isTrue();
        loop.stop();

        int afterStop = loop.cycles.get();
        Thread.sleep(50);

        assertThat(loop.isRunning()).isFalse();
        assertThat(loop.cycles.get()).isEqualTo(afterStop);
    }

    @Test
    void failingCycleKeepsLoopAlive() throws Exception {
        CountingLoop loop = new CountingLoop();
        loop.fail = true;

        loop.start();
        assertThat(loop.threeCycles.await(2, TimeUnit.SECONDS)).isTrue();
        loop.stop();
    }

    @Test
    void runOnLoopUsesLoopThreadWhileRunning() throws Exception {
        CountingLoop loop = new CountingLoop();

        assertThat(loop.threadName()).isEqualTo(Thread.currentThread().getName());

        loop.start();
        try {
            assertThat(loop.threadName()).isEqualTo("loop-counting");
        } finally {
            loop.stop();
        }
    }
}

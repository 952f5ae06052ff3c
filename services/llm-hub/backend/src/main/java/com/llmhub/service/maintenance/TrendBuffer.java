package com.llmhub.service.maintenance;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * 시간순 (timestamp, value) 샘플 버퍼
 * - 추가는 모니터 루프에서만, 조회는 어느 스레드에서나 가능
 */
public class TrendBuffer {

    static final int MIN_SAMPLES = 5;

    private final ConcurrentLinkedDeque<Sample> samples = new ConcurrentLinkedDeque<>();

    public void add(Instant timestamp, double value) {
        samples.addLast(new Sample(timestamp, value));
    }

    /**
     * cutoff 보다 오래된 샘플 제거
     */
    public void trimOlderThan(Instant cutoff) {
        while (true) {
            Sample head = samples.peekFirst();
            if (head == null || !head.timestamp().isBefore(cutoff)) {
                return;
            }
            samples.pollFirst();
        }
    }

    /**
     * 창 안의 첫/마지막 샘플 기준 변화율 (scale 초당 변화량)
     * - 전체 샘플 5개 미만, 창 안 샘플 2개 미만, 시간 간격 0 이면 0
     * - 창 경계의 샘플(정확히 window 만큼 오래된 샘플)도 포함
     */
    public double trend(Duration window, Instant now, Duration scale) {
        if (samples.size() < MIN_SAMPLES) {
            return 0.0;
        }

        List<Sample> inWindow = since(now.minus(window));
        if (inWindow.size() < 2) {
            return 0.0;
        }

        Sample first = inWindow.get(0);
        Sample last = inWindow.get(inWindow.size() - 1);

        double spanSeconds = Duration.between(first.timestamp(), last.timestamp()).toMillis() / 1000.0;
        if (spanSeconds <= 0) {
            return 0.0;
        }

        return (last.value() - first.value()) / spanSeconds * scale.toSeconds();
    }

    /**
     * 창 안 값들의 평균 (샘플 없으면 NaN)
     */
    public double meanSince(Instant cutoff) {
        return since(cutoff).stream()
                .mapToDouble(Sample::value)
                .average()
                .orElse(Double.NaN);
    }

    public int size() {
        return samples.size();
    }

    private List<Sample> since(Instant cutoff) {
        return samples.stream()
                .filter(sample -> !sample.timestamp().isBefore(cutoff))
                .toList();
    }

    record Sample(Instant timestamp, double value) {}
}

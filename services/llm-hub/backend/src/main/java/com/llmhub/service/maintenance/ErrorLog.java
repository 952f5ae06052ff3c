package com.llmhub.service.maintenance;

import com.llmhub.exception.ErrorPattern;

import java.time.Instant;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * 분류된 오류 이력 (복구 관리자와 예측 정비가 공유)
 */
public class ErrorLog {

    private final ConcurrentLinkedDeque<Entry> entries = new ConcurrentLinkedDeque<>();

    public void record(Instant timestamp, ErrorPattern pattern) {
        entries.addLast(new Entry(timestamp, pattern));
    }

    public void trimOlderThan(Instant cutoff) {
        entries.removeIf(entry -> entry.timestamp().isBefore(cutoff));
    }

    /**
     * cutoff 이후(경계 제외) 오류 수
     */
    public int countSince(Instant cutoff) {
        return (int) entries.stream()
                .filter(entry -> entry.timestamp().isAfter(cutoff))
                .count();
    }

    public int size() {
        return entries.size();
    }

    record Entry(Instant timestamp, ErrorPattern pattern) {}
}

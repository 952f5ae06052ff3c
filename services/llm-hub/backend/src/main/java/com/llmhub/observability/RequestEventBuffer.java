package com.llmhub.observability;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * 최근 게이트웨이 요청 이벤트 Ring Buffer
 * - 최신 이벤트가 앞쪽
 */
@Component
public class RequestEventBuffer {

    private final int maxSize;

    private final ConcurrentLinkedDeque<RequestEvent> buffer = new ConcurrentLinkedDeque<>();

    public RequestEventBuffer(@Value("${gateway.recent-requests.max-size:200}") int maxSize) {
        this.maxSize = maxSize;
    }

    public synchronized void add(RequestEvent event) {
        buffer.addFirst(event);

        // 초과분은 즉시 제거해 항상 maxSize 이하 유지
        while (buffer.size() > maxSize) {
            buffer.removeLast();
        }
    }

    public List<RequestEvent> getRecent(int limit) {
        return buffer.stream().limit(Math.max(0, limit)).toList();
    }

    public int size() {
        return buffer.size();
    }
}

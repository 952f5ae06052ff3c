package com.llmhub.service.bridge;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.web.client.RestTemplate;

/**
 * 업스트림 HTTP 연결 묶음 (RestTemplate + 연결 풀)
 * - close() 시 풀을 해제, 이후 재사용 금지
 */
@Slf4j
public class UpstreamConnection implements AutoCloseable {

    private final RestTemplate restTemplate;
    private final DisposableBean pool;

    public UpstreamConnection(RestTemplate restTemplate, DisposableBean pool) {
        this.restTemplate = restTemplate;
        this.pool = pool;
    }

    public RestTemplate restTemplate() {
        return restTemplate;
    }

    @Override
    public void close() {
        try {
            pool.destroy();
        } catch (Exception e) {
            log.warn("event=UPSTREAM_POOL_CLOSE_FAIL message={}", e.getMessage());
        }
    }
}

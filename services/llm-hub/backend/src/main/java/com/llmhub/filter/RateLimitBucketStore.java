package com.llmhub.filter;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.llmhub.service.maintenance.CachePruneRequestedEvent;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 요청 주체별 Bucket 저장소
 *
 * - 10분간 미사용 시 제거, 최대 10,000 주체 유지
 * - 분당 N 토큰, 1분마다 N 토큰 일괄 충전
 */
@Slf4j
@Component
public class RateLimitBucketStore {

    private final long perMinute;

    private final Cache<String, Bucket> buckets =
            Caffeine.newBuilder()
                    .expireAfterAccess(10, TimeUnit.MINUTES)
                    .maximumSize(10_000)
                    .build();

    public RateLimitBucketStore(@Value("${gateway.rate-limit.per-minute:60}") long perMinute) {
        this.perMinute = perMinute;
    }

    /**
     * 0 이하면 제한 없음
     */
    public boolean isLimited() {
        return perMinute > 0;
    }

    public boolean tryConsume(String clientKey) {
        return buckets.get(clientKey, this::createBucket).tryConsume(1);
    }

    public long estimatedSize() {
        return buckets.estimatedSize();
    }

    /**
     * 예측 정비의 메모리 정리 요청 시 만료 항목 즉시 제거
     */
    @EventListener
    public void onCachePrune(CachePruneRequestedEvent event) {
        buckets.cleanUp();
        log.info("event=RATE_LIMIT_BUCKETS_PRUNED remaining={}", buckets.estimatedSize());
    }

    private Bucket createBucket(String clientKey) {
        Bandwidth limit = Bandwidth.classic(
                perMinute,
                Refill.intervally(perMinute, Duration.ofMinutes(1))
        );

        return Bucket.builder()
                .addLimit(limit)
                .build();
    }
}

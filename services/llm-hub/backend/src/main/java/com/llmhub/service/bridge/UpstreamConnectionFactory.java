package com.llmhub.service.bridge;

/**
 * 복구 훅에서 연결 풀을 새로 만들기 위한 팩토리
 */
@FunctionalInterface
public interface UpstreamConnectionFactory {

    UpstreamConnection create();
}

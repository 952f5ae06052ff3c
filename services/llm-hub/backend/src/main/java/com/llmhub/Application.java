package com.llmhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * LLM Hub
 * - bridge.enabled: 추론 백엔드 앞단 브리지 (업스트림/복구/디스커버리/리소스/예측 정비)
 * - gateway.enabled: 도구 라우팅 게이트웨이 (레지스트리/라우터/집계)
 */
@EnableAspectJAutoProxy
@SpringBootApplication
public class Application {
    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}

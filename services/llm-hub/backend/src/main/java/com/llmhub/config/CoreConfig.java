package com.llmhub.config;

import com.llmhub.scheduling.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 시간/대기 추상화 (테스트에서 교체 가능)
 */
@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.of("Asia/Seoul"));
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }
}

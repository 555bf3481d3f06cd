package com.localguide.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * 비동기 실행기 / 시계 설정
 */
@Configuration
public class AsyncConfig {

    /**
     * API 로그 저장 전용 실행기 (요청 스레드와 분리)
     */
    @Bean(name = "apiLogExecutor")
    public ThreadPoolTaskExecutor apiLogExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("api-log-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    // 영업시간/이력 타임스탬프 계산용. 테스트에서는 Clock.fixed로 교체
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}

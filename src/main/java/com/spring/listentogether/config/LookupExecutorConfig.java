package com.spring.listentogether.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 외부 음악 조회 전용 스레드 풀
 *
 * 조회는 이 풀에서 실행되고 호출 측은 music.api.timeout 까지만 기다린다.
 * 방 잠금을 쥔 스레드에서는 절대 사용하지 않는다.
 */
@Configuration
public class LookupExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor lookupExecutor(MusicApiProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.lookupThreads());
        executor.setMaxPoolSize(props.lookupThreads());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("music-lookup-");
        executor.initialize();
        return executor;
    }
}

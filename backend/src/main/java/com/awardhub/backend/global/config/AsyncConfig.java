package com.awardhub.backend.global.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for fire-and-forget work (SMS dispatch). Retries run on the same worker thread.
 */
@Configuration
@EnableAsync
@EnableRetry
public class AsyncConfig {

    public static final String SMS_EXECUTOR = "smsTaskExecutor";

    @Bean(name = SMS_EXECUTOR)
    public Executor smsTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("sms-");
        executor.initialize();
        return executor;
    }
}

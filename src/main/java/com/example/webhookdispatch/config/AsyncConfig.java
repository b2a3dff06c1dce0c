package com.example.webhookdispatch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 投递线程池。本地队列模式下执行投递任务与延迟重试，同时承载 @Scheduled 定时任务。
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "deliveryTaskScheduler")
    public ThreadPoolTaskScheduler deliveryTaskScheduler(
            @Value("${app.webhook.worker.pool-size:10}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("webhook-worker-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(35);
        scheduler.initialize();
        return scheduler;
    }
}

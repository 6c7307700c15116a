package com.lastmile.locationtracking.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for background work.
 *
 * locationTaskExecutor     - fire-and-forget sample ingestion (/update/async).
 *                            10 core / 50 max / 500 queue.
 * notificationTaskExecutor - geofence notifications.
 *                            2 core / 8 max / 1000 queue.
 *
 * Both use CallerRunsPolicy: a full queue runs the task on the submitting thread.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    @Bean("locationTaskExecutor")
    public Executor locationTaskExecutor() {
        return buildExecutor("location-async-", 10, 50, 500);
    }

    @Bean("notificationTaskExecutor")
    public Executor notificationTaskExecutor() {
        return buildExecutor("notify-async-", 2, 8, 1000);
    }

    private ThreadPoolTaskExecutor buildExecutor(String prefix, int core, int max, int queue) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}

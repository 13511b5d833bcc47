package com.aigreentick.services.subscriptions.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Async, scheduling and time configuration.
 *
 * callbackTaskExecutor: used by CallbackDispatcher
 * ─────────────────────────────────────────────────
 * The webhook is acknowledged on the request thread; reconciliation
 * (one read, one guarded write) runs here. Bounded so a burst of gateway
 * retries cannot create unbounded threads; CallerRuns when the queue is full.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    @Bean(name = "callbackTaskExecutor")
    public Executor callbackTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(5);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("mpesa-callback-");
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /** Every component reads time from this clock. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

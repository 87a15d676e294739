package com.miniuber.rideservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Scheduling and async execution.
 *
 * - @EnableScheduling drives the periodic dispatch pass.
 * - dispatchTaskExecutor runs manually triggered passes off the request thread.
 *   Small pool: passes never overlap anyway, a second trigger is a no-op.
 * - Clock is injected everywhere "now" is needed so tests can pin time.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    @Bean("dispatchTaskExecutor")
    public Executor dispatchTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("dispatch-async-");
        // Queue full: drop the trigger, the next scheduled pass picks the rides up
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardPolicy());
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}

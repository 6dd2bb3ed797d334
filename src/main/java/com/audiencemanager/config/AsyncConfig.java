package com.audiencemanager.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools of the audience manager.
 *
 * <p>{@code eventExecutor} delivers segment lifecycle events to async listeners such as
 * metrics. {@code materializationTaskScheduler} runs the materialization jobs themselves,
 * cron-triggered and manual alike.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    private final int eventCorePoolSize;
    private final int eventMaxPoolSize;
    private final int eventQueueCapacity;
    private final int jobPoolSize;

    public AsyncConfig(
            @Value("${audience.async.core-pool-size:2}") int eventCorePoolSize,
            @Value("${audience.async.max-pool-size:4}") int eventMaxPoolSize,
            @Value("${audience.async.queue-capacity:500}") int eventQueueCapacity,
            @Value("${audience.scheduler.pool-size:4}") int jobPoolSize) {
        this.eventCorePoolSize = eventCorePoolSize;
        this.eventMaxPoolSize = eventMaxPoolSize;
        this.eventQueueCapacity = eventQueueCapacity;
        this.jobPoolSize = jobPoolSize;
    }

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(eventCorePoolSize);
        executor.setMaxPoolSize(eventMaxPoolSize);
        executor.setQueueCapacity(eventQueueCapacity);
        executor.setThreadNamePrefix("segment-event-");
        // A full queue slows the publishing job down instead of dropping its event
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /** One thread per rule that may materialize concurrently. */
    @Bean("materializationTaskScheduler")
    public ThreadPoolTaskScheduler materializationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(jobPoolSize);
        scheduler.setThreadNamePrefix("segment-job-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(60);
        scheduler.setErrorHandler(t -> log.error("Materialization job escaped the executor: {}", t.getMessage(), t));
        return scheduler;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (throwable, method, params) -> log.error(
                "Segment event listener {}.{} failed: {}",
                method.getDeclaringClass().getSimpleName(),
                method.getName(),
                throwable.getMessage(),
                throwable);
    }
}

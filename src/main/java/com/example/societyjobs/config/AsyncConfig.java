package com.example.societyjobs.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used by the job engine.
 * <p>
 * - taskScheduler drives the trigger clocks and delayed retries
 * - blobDeleteExecutor runs the concurrent deletes of one cleanup chunk
 * - notificationExecutor runs background push delivery
 * - taskExecutor backs Spring's @Async (alerting)
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    /**
     * Scheduler shared by all @Scheduled triggers and by retry scheduling.
     * Several threads so a long cleanup run never delays the 5-minute jobs.
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler(JobEngineProperties properties) {
        log.info("Creating job scheduler with {} threads", properties.getSchedulerPoolSize());

        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("job-trigger-");
        scheduler.setErrorHandler(t -> log.error("Unhandled error in scheduled job: {}", t.getMessage(), t));
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(60);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Executor for blob deletions. Sized to the per-chunk concurrency limit;
     * the chunking in BlobCleanupService is what bounds in-flight calls.
     */
    @Bean(name = "blobDeleteExecutor", destroyMethod = "shutdown")
    public ExecutorService blobDeleteExecutor(JobEngineProperties properties) {
        var poolSize = properties.getCleanup().getMaxConcurrentDeletes();
        log.info("Creating blob delete executor with {} threads", poolSize);

        return Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("blob-delete-"));
    }

    /**
     * Bounded executor for background push delivery.
     * Rejected submissions surface as TaskRejectedException to the caller.
     */
    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor(JobEngineProperties properties) {
        var notifications = properties.getNotifications();
        log.info("Creating notification executor with {} threads, queue capacity {}",
                notifications.getPushPoolSize(), notifications.getPushQueueCapacity());

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(notifications.getPushPoolSize());
        executor.setMaxPoolSize(notifications.getPushPoolSize());
        executor.setQueueCapacity(notifications.getPushQueueCapacity());
        executor.setThreadNamePrefix("push-dispatch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Task executor for Spring's @Async annotation.
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("async-task-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}

package io.newsharvest.ingestion.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    static final int SHUTDOWN_AWAIT_SECONDS = 60;

    /**
     * Executor for per-item import pipelines. Pool size follows the configured
     * item concurrency so third-party sites see at most that many parallel fetches per run.
     * Once shut down it rejects new items with {@link java.util.concurrent.RejectedExecutionException};
     * items already running are given {@value #SHUTDOWN_AWAIT_SECONDS}s to finish.
     */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor importItemExecutor(NewsConfig config) {
        int concurrency = Math.max(1, config.scheduling().itemConcurrency());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency * 2);
        executor.setQueueCapacity(100);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("Import-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(SHUTDOWN_AWAIT_SECONDS);
        executor.initialize();
        return executor;
    }

    /**
     * One scheduler thread per job group, so a long run never delays another job's tick.
     */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler importJobScheduler(NewsConfig config) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, config.scheduling().jobs().size()) + 1);
        scheduler.setThreadNamePrefix("ImportJob-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(SHUTDOWN_AWAIT_SECONDS);
        scheduler.initialize();
        return scheduler;
    }
}

package com.foresight.core.engine;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for stage fan-out and for detached background work
 * (asynchronous analysis runs and accepted recommendations).
 */
@Configuration
public class ExecutorConfig {

    public static final String FAN_OUT = "fanOutExecutor";
    public static final String BACKGROUND = "backgroundExecutor";

    /**
     * Cached so nested fan-out never starves; concurrency is bounded per fan-out by {@link BoundedFanOut}.
     */
    @Bean(name = FAN_OUT, destroyMethod = "shutdownNow")
    public ExecutorService fanOutExecutor() {
        return Executors.newCachedThreadPool(named("fanout"));
    }

    /**
     * Non-daemon and drained on close, so an accepted recommendation that is already
     * {@code executing} reaches a terminal status before the process exits.
     */
    @Bean(name = BACKGROUND)
    public ThreadPoolTaskExecutor backgroundExecutor(PipelineProperties properties) {
        return backgroundExecutor(properties.getBackgroundThreads(), properties.getShutdownAwaitSeconds());
    }

    static ThreadPoolTaskExecutor backgroundExecutor(int threads, int awaitSeconds) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setThreadNamePrefix("foresight-background-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitSeconds);
        executor.initialize();
        return executor;
    }

    private static ThreadFactory named(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "foresight-" + prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

package com.phillippitts.hdrcompute.config;

import com.phillippitts.hdrcompute.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind the compute engines.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded pool shared by the edit scheduler, the tile engine, the accelerated
     * engine and gallery loading.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.compute.*} properties:
     * <ul>
     *   <li>Core pool: default one thread per CPU (at least 2)</li>
     *   <li>Max pool: default two threads per CPU (at least 4)</li>
     *   <li>Queue: default 256 tasks - room for a fine tile grid plus interactive work</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Submitters run on the
     * controlling thread, which must never execute pipeline work itself; the
     * {@link com.phillippitts.hdrcompute.service.worker.WorkerPool} turns a rejection into a failed
     * task future.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext from the submitting thread to the worker
     * thread so session and export identifiers survive the hand-off.
     *
     * @return Configured executor for compute tasks
     */
    @Bean(name = "computeExecutor")
    public ThreadPoolTaskExecutor computeExecutor() {
        ThreadPoolProperties.ComputePoolProperties props = threadPoolProperties.getCompute();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(props.getCorePoolSize(), props.getMaxPoolSize()));
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(ThreadPoolConfig::propagateThreadContext);
        executor.initialize();
        return executor;
    }

    /**
     * Single-threaded scheduler that interrupts compute tasks past their deadline.
     * It never runs pipeline work.
     *
     * @return scheduler for task deadlines
     */
    @Bean(name = "computeWatchdog", destroyMethod = "shutdownNow")
    public ScheduledExecutorService computeWatchdog() {
        CustomizableThreadFactory threadFactory =
                new CustomizableThreadFactory(threadPoolProperties.getWatchdog().getThreadNamePrefix());
        threadFactory.setDaemon(true);
        return Executors.newSingleThreadScheduledExecutor(threadFactory);
    }

    static Runnable propagateThreadContext(Runnable runnable) {
        Map<String, String> contextMap = ThreadContext.getImmutableContext();
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            try {
                if (contextMap != null && !contextMap.isEmpty()) {
                    ThreadContext.putAll(contextMap);
                }
                runnable.run();
            } finally {
                ThreadContext.clearAll();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }
}

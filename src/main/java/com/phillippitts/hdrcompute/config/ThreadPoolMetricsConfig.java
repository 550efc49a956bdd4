package com.phillippitts.hdrcompute.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for compute pool metrics exposure via Micrometer.
 *
 * <p>Exposes gauges for the shared compute executor:
 * <ul>
 *   <li>compute.pool.size - Current number of threads in the pool</li>
 *   <li>compute.pool.active - Number of actively executing tasks</li>
 *   <li>compute.pool.queued - Number of tasks waiting in the queue</li>
 *   <li>compute.pool.completed - Cumulative count of completed tasks</li>
 *   <li>compute.pool.max.size - Configured maximum pool size</li>
 * </ul>
 *
 * <p>Additionally logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> computeExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("computeExecutor") ObjectProvider<ThreadPoolTaskExecutor> computeExecutorProvider) {
        this.computeExecutorProvider = computeExecutorProvider;
    }

    /**
     * Binds compute executor metrics to the Micrometer registry.
     *
     * @return MeterBinder that registers the pool gauges
     */
    @Bean
    public MeterBinder computeExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = computeExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("compute.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the compute pool")
                    .register(registry);

            Gauge.builder("compute.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively executing compute tasks")
                    .register(registry);

            Gauge.builder("compute.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of compute tasks waiting in the queue")
                    .register(registry);

            Gauge.builder("compute.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed compute tasks")
                    .register(registry);

            Gauge.builder("compute.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured maximum pool size for the compute executor")
                    .register(registry);

            LOG.info("Compute pool metrics registered: compute.pool.*");
        };
    }

    /**
     * Logs a compute pool summary every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = computeExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Compute Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}

package com.phillippitts.hdrcompute.service.health;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Health indicator for the shared compute pool.
 *
 * <p>Reports pool status for monitoring and alerting:
 * <ul>
 *   <li>UP: Pool running with queue headroom</li>
 *   <li>DEGRADED: Queue more than 80% full, new tasks are about to be rejected</li>
 *   <li>DOWN: Pool shut down</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class WorkerPoolHealthIndicator implements HealthIndicator {

    static final double DEGRADED_QUEUE_RATIO = 0.8;

    private final ObjectProvider<ThreadPoolTaskExecutor> computeExecutorProvider;

    public WorkerPoolHealthIndicator(
            @Qualifier("computeExecutor") ObjectProvider<ThreadPoolTaskExecutor> computeExecutorProvider) {
        this.computeExecutorProvider = computeExecutorProvider;
    }

    @Override
    public Health health() {
        ThreadPoolExecutor executor = computeExecutorProvider.getObject().getThreadPoolExecutor();
        return health(executor);
    }

    Health health(ThreadPoolExecutor executor) {
        int queued = executor.getQueue().size();
        int capacity = queued + executor.getQueue().remainingCapacity();

        Health.Builder builder;
        if (executor.isShutdown()) {
            builder = Health.down().withDetail("status", "Compute pool shut down");
        } else if (capacity > 0 && queued > capacity * DEGRADED_QUEUE_RATIO) {
            builder = Health.status("DEGRADED").withDetail("status", "Compute queue nearly full");
        } else {
            builder = Health.up().withDetail("status", "Compute pool operational");
        }
        return builder
                .withDetail("active", executor.getActiveCount())
                .withDetail("poolSize", executor.getPoolSize())
                .withDetail("queued", queued)
                .withDetail("queueCapacity", capacity)
                .build();
    }
}

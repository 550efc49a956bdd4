package com.phillippitts.hdrcompute.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the shared compute pool (every engine and every open editing
 * session submits to it) and for the watchdog thread that enforces task deadlines.
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private ComputePoolProperties compute = new ComputePoolProperties();

    @Valid
    private WatchdogProperties watchdog = new WatchdogProperties();

    public ComputePoolProperties getCompute() {
        return compute;
    }

    public void setCompute(ComputePoolProperties compute) {
        this.compute = compute;
    }

    public WatchdogProperties getWatchdog() {
        return watchdog;
    }

    public void setWatchdog(WatchdogProperties watchdog) {
        this.watchdog = watchdog;
    }

    /**
     * Compute executor pool configuration.
     */
    public static class ComputePoolProperties {
        @Min(1)
        private int corePoolSize = Math.max(2, Runtime.getRuntime().availableProcessors());
        @Min(1)
        private int maxPoolSize = Math.max(4, Runtime.getRuntime().availableProcessors() * 2);
        @Min(0)
        private int queueCapacity = 256;
        @Min(0)
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix = "compute-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Deadline watchdog configuration.
     */
    public static class WatchdogProperties {
        @NotBlank
        private String threadNamePrefix = "compute-watchdog-";

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}

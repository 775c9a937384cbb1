package com.phillippitts.mathpreserve.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Only the cleanup scheduler is pooled; extraction and reconstruction run on the caller's thread.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private CleanupPoolProperties cleanup = new CleanupPoolProperties();

    public CleanupPoolProperties getCleanup() {
        return cleanup;
    }

    public void setCleanup(CleanupPoolProperties cleanup) {
        this.cleanup = cleanup;
    }

    /**
     * Scheduler pool used for deferred cleanup passes.
     */
    public static class CleanupPoolProperties {
        private int poolSize = 1;
        private String threadNamePrefix = "cleanup-retry-";
        private int awaitTerminationSeconds = 5;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }
    }
}

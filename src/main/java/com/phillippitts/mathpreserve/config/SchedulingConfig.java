package com.phillippitts.mathpreserve.config;

import com.phillippitts.mathpreserve.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;

/**
 * Scheduler used to re-run deferred cleanup passes.
 *
 * <p>MDC propagation: {@link #mdcPropagating()} copies the Log4j2 ThreadContext of the scheduling
 * thread to the worker so request and document ids survive into retry logs.
 */
@Configuration
public class SchedulingConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public SchedulingConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    @Bean(name = "cleanupScheduler")
    public ThreadPoolTaskScheduler cleanupScheduler() {
        ThreadPoolProperties.CleanupPoolProperties props = threadPoolProperties.getCleanup();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Decorator applied by callers when they submit a task, since the scheduler itself takes none.
     */
    public static TaskDecorator mdcPropagating() {
        return runnable -> {
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
        };
    }
}

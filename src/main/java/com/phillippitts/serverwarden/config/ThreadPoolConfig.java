package com.phillippitts.serverwarden.config;

import com.phillippitts.serverwarden.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;

/**
 * Configuration for thread pools used in asynchronous processing.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolConfig.class);

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates a bounded thread pool for notification delivery.
     *
     * <p>Rejection policy: log and drop. Notifications are fire-and-forget, and the orchestration
     * loop (the publisher) must never run delivery work itself or block on a saturated pool.
     *
     * <p>Thread naming: {@code notify-pool-N} for easy identification in logs.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext from the publishing thread to the worker
     * thread, so delivery logs keep the originating tick or request id.
     *
     * @return Configured executor for notification delivery
     */
    @Bean(name = "notifyExecutor")
    public Executor notifyExecutor() {
        ThreadPoolProperties.NotifyPoolProperties props = threadPoolProperties.getNotify();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(logAndDrop());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static RejectedExecutionHandler logAndDrop() {
        return (task, pool) -> LOG.warn("Notification pool saturated (active={}, queued={}); dropping delivery",
                pool.getActiveCount(), pool.getQueue().size());
    }

    static TaskDecorator mdcPropagating() {
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

package com.phillippitts.dictation.config;

import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used by provisioning and local server supervision.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties}. The provisioning executor copies
 * the Log4j2 ThreadContext (MDC) from the submitting thread so request ids from the control API
 * follow downloads into their worker threads. The scheduler has no decorator hook; callers that
 * need the MDC wrap their tasks with {@link #mdcPropagatingDecorator()}.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for model downloads and archive extraction.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A download request beyond the
     * queue capacity fails fast instead of blocking the controller thread for minutes.
     *
     * @return configured executor for provisioning work
     */
    @Bean(name = "provisionExecutor")
    public ThreadPoolTaskExecutor provisionExecutor() {
        ThreadPoolProperties.ProvisionPoolProperties props = threadPoolProperties.getProvision();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler shared by the local inference servers for spawning, readiness polling and
     * periodic health checks.
     *
     * @return configured scheduler
     */
    @Bean(name = "serverScheduler")
    public ThreadPoolTaskScheduler serverScheduler() {
        ThreadPoolProperties.ServerPoolProperties props = threadPoolProperties.getServer();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Decorator that runs a task under the ThreadContext captured when it was decorated, restoring
     * the worker's own context afterwards.
     *
     * @return MDC-propagating decorator
     */
    public static TaskDecorator mdcPropagatingDecorator() {
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

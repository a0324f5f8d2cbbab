package com.phillippitts.ellie.config;

import com.phillippitts.ellie.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for turn orchestration, upstream provider calls and event offload.
 *
 * <p>Pool sizes come from {@link ThreadPoolProperties} ({@code threadpool.*}).
 * All pools copy the Log4j2 ThreadContext of the submitting thread so session and request ids
 * follow the work.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs one task per in-flight user turn.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. A saturated pool slows the
     * submitting WebSocket thread instead of dropping the turn.
     */
    @Bean(name = "turnExecutor")
    public ThreadPoolTaskExecutor turnExecutor() {
        return build(threadPoolProperties.getTurn(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Runs single upstream calls so the caller can wait on them with a timeout.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A rejected call surfaces as
     * provider unavailability and the turn moves on to the next provider or the fallback reply.
     * Running it on the caller would defeat the timeout.
     */
    @Bean(name = "providerExecutor")
    public ThreadPoolTaskExecutor providerExecutor() {
        return build(threadPoolProperties.getProvider(), new ThreadPoolExecutor.AbortPolicy());
    }

    /** Offload pool for asynchronous event listeners. */
    @Bean(name = "eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        return build(threadPoolProperties.getEvent(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext onto the worker and restores the worker's own
     * context afterwards.
     */
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

package com.phillippitts.ellie.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the turn and provider pools through Micrometer as {@code ellie.pool.*} gauges tagged
 * with {@code pool=turn|provider}, e.g. {@code GET /actuator/metrics/ellie.pool.active?tag=pool:provider}.
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ThreadPoolTaskExecutor turnExecutor;
    private final ThreadPoolTaskExecutor providerExecutor;

    public ThreadPoolMetricsConfig(@Qualifier("turnExecutor") ThreadPoolTaskExecutor turnExecutor,
                                   @Qualifier("providerExecutor") ThreadPoolTaskExecutor providerExecutor) {
        this.turnExecutor = turnExecutor;
        this.providerExecutor = providerExecutor;
    }

    @Bean
    public MeterBinder executorPoolMetrics() {
        return registry -> {
            bind(registry, "turn", turnExecutor.getThreadPoolExecutor());
            bind(registry, "provider", providerExecutor.getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: ellie.pool.* available via /actuator/metrics");
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("ellie.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("ellie.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("ellie.pool.queued", executor, e -> e.getQueue().size())
                .description("Tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("ellie.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", pool)
                .register(registry);
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        log("Turn", turnExecutor.getThreadPoolExecutor());
        log("Provider", providerExecutor.getThreadPoolExecutor());
    }

    private static void log(String name, ThreadPoolExecutor executor) {
        LOG.info("{} Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                name,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}

package com.phillippitts.hugdimon.config;

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
 * Exposes the completion executor through Micrometer:
 * <ul>
 *   <li>completion.pool.size - current number of threads</li>
 *   <li>completion.pool.active - calls in flight</li>
 *   <li>completion.pool.queued - calls waiting for a thread</li>
 *   <li>completion.pool.completed - cumulative completed calls</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> completionExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("completionExecutor") ObjectProvider<ThreadPoolTaskExecutor> completionExecutorProvider) {
        this.completionExecutorProvider = completionExecutorProvider;
    }

    @Bean
    public MeterBinder completionExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = completionExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("completion.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the completion pool")
                    .register(registry);
            Gauge.builder("completion.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Completion calls currently executing")
                    .register(registry);
            Gauge.builder("completion.pool.queued", executor, e -> e.getQueue().size())
                    .description("Completion calls waiting in the queue")
                    .register(registry);
            Gauge.builder("completion.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed completion calls")
                    .register(registry);

            LOG.info("Completion pool metrics registered: completion.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = completionExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Completion pool health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}

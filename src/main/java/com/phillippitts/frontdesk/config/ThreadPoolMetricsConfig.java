package com.phillippitts.frontdesk.config;

import com.phillippitts.frontdesk.service.session.SessionRegistry;
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
 * Exposes pipeline pool and session gauges via Micrometer:
 * <ul>
 *   <li>frontdesk.pipeline.pool.size / active / queued / completed</li>
 *   <li>frontdesk.sessions.active</li>
 * </ul>
 *
 * <p>Also logs a pool health summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider;
    private final ObjectProvider<SessionRegistry> registryProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("pipelineExecutor") ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider,
            ObjectProvider<SessionRegistry> registryProvider) {
        this.pipelineExecutorProvider = pipelineExecutorProvider;
        this.registryProvider = registryProvider;
    }

    @Bean
    public MeterBinder pipelineExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = pipelineExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("frontdesk.pipeline.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the pipeline pool")
                    .register(registry);

            Gauge.builder("frontdesk.pipeline.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Pipeline threads actively delivering messages")
                    .register(registry);

            Gauge.builder("frontdesk.pipeline.pool.queued", executor, e -> e.getQueue().size())
                    .description("Deliveries waiting for a pipeline thread")
                    .register(registry);

            Gauge.builder("frontdesk.pipeline.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed deliveries")
                    .register(registry);

            Gauge.builder("frontdesk.sessions.active", registryProvider.getObject(), SessionRegistry::activeCount)
                    .description("Calls currently connected")
                    .register(registry);

            LOG.info("Pipeline pool metrics registered: frontdesk.pipeline.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = pipelineExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Pipeline Pool Health: size={}/{}, active={}, queued={}, completed={}, sessions={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount(),
                registryProvider.getObject().activeCount()
        );
    }
}

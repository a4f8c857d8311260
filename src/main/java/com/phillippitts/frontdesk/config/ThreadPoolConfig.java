package com.phillippitts.frontdesk.config;

import com.phillippitts.frontdesk.config.properties.ThreadPoolProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools of the call pipeline.
 *
 * <p>Sizes come from {@link ThreadPoolProperties} ({@code threadpool.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs message-bus deliveries: transcript handling, routing and generation, synthesis.
     *
     * <p>Handlers block on provider streams, so the pool is sized for concurrent calls rather than
     * CPU count. Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}; a saturated pool
     * slows publishers down instead of dropping messages.
     *
     * <p>MDC propagation: the publisher's ThreadContext (sessionId, callSid) follows the task.
     */
    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor() {
        ThreadPoolProperties.PipelinePoolProperties props = threadPoolProperties.getPipeline();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Timer for paced playback ticks. Ticks are short and never block.
     */
    @Bean(name = "playbackTaskScheduler")
    public ThreadPoolTaskScheduler playbackTaskScheduler() {
        ThreadPoolProperties.PlaybackPoolProperties props = threadPoolProperties.getPlayback();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}

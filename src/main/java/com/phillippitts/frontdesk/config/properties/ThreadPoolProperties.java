package com.phillippitts.frontdesk.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The pipeline pool runs queue consumers (transcripts, generation, synthesis, outbound audio,
 * clears). Consumers for one session run one at a time, so the pool bounds how many sessions
 * progress concurrently. The playback pool only runs short timer ticks.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PipelinePoolProperties pipeline = new PipelinePoolProperties();
    private PlaybackPoolProperties playback = new PlaybackPoolProperties();

    public PipelinePoolProperties getPipeline() {
        return pipeline;
    }

    public void setPipeline(PipelinePoolProperties pipeline) {
        this.pipeline = pipeline;
    }

    public PlaybackPoolProperties getPlayback() {
        return playback;
    }

    public void setPlayback(PlaybackPoolProperties playback) {
        this.playback = playback;
    }

    /**
     * Pipeline executor pool configuration.
     */
    public static class PipelinePoolProperties {
        private int corePoolSize = 8;
        private int maxPoolSize = 32;
        private int queueCapacity = 200;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "pipeline-";

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
     * Playback timer pool configuration.
     */
    public static class PlaybackPoolProperties {
        private int poolSize = 4;
        private String threadNamePrefix = "playback-";

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
    }
}

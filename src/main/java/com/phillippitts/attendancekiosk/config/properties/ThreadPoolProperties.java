package com.phillippitts.attendancekiosk.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>The frame thread is always a single thread so decisioning stays serialized.
 * Network probing and sync ticks share a small scheduler; sync passes run on their own
 * single-thread executor.
 */
@ConfigurationProperties(prefix = "threadpool")
@Validated
public class ThreadPoolProperties {

    private FramePoolProperties frame = new FramePoolProperties();
    @Valid
    private NetworkPoolProperties network = new NetworkPoolProperties();
    @Valid
    private SyncPoolProperties sync = new SyncPoolProperties();
    @Valid
    private SpeechPoolProperties speech = new SpeechPoolProperties();

    public FramePoolProperties getFrame() {
        return frame;
    }

    public void setFrame(FramePoolProperties frame) {
        this.frame = frame;
    }

    public NetworkPoolProperties getNetwork() {
        return network;
    }

    public void setNetwork(NetworkPoolProperties network) {
        this.network = network;
    }

    public SyncPoolProperties getSync() {
        return sync;
    }

    public void setSync(SyncPoolProperties sync) {
        this.sync = sync;
    }

    public SpeechPoolProperties getSpeech() {
        return speech;
    }

    public void setSpeech(SpeechPoolProperties speech) {
        this.speech = speech;
    }

    /**
     * Frame scheduler configuration.
     */
    public static class FramePoolProperties {
        private String threadNamePrefix = "frame-";

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Network scheduler configuration (probes and sync ticks).
     */
    public static class NetworkPoolProperties {
        @Positive
        private int poolSize = 2;
        private String threadNamePrefix = "net-";

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

    /**
     * Sync executor configuration.
     */
    public static class SyncPoolProperties {
        @Positive
        private int queueCapacity = 1;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "sync-";

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
     * Greeting executor configuration. Greetings that do not fit the queue are dropped.
     */
    public static class SpeechPoolProperties {
        @Positive
        private int queueCapacity = 4;
        private String threadNamePrefix = "speech-";

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}

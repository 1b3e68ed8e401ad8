package com.phillippitts.clipcast.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Sizing for the encode and event executors.
 *
 * <p>Encoding runs one ffmpeg process per task, so the encode pool stays small; a second thread
 * only helps when a recording finishes while the previous one is still encoding.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties encode = new PoolProperties(1, 2, 4, "encode-pool-");
    private PoolProperties event = new PoolProperties(2, 4, 10, "event-pool-");

    public PoolProperties getEncode() {
        return encode;
    }

    public void setEncode(PoolProperties encode) {
        this.encode = encode;
    }

    public PoolProperties getEvent() {
        return event;
    }

    public void setEvent(PoolProperties event) {
        this.event = event;
    }

    /**
     * Sizing of one executor.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(1, 1, 1, "pool-");
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

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
}

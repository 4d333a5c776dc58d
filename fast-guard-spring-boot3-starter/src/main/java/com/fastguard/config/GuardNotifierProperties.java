package com.fastguard.config;

import com.fastguard.model.enums.NotifyChannel;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "guard.notify")
public class GuardNotifierProperties {

    private boolean enabled = true;

    private NotifyChannel channel = NotifyChannel.LOG;

    private String application = "fast-guard";

    private String environment = "development";

    /** kafka 通道的告警 topic */
    private String topic = "guard-alerts";

    private Duration sendTimeout = Duration.ofSeconds(3);

    private int payloadSnapshotLength = 500;

    private Duration shutdownAwait = Duration.ofSeconds(5);

    private Async async = new Async();

    private Throttle throttle = new Throttle();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public NotifyChannel getChannel() {
        return channel;
    }

    public void setChannel(NotifyChannel channel) {
        this.channel = channel;
    }

    public String getApplication() {
        return application;
    }

    public void setApplication(String application) {
        this.application = application;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public Duration getSendTimeout() {
        return sendTimeout;
    }

    public void setSendTimeout(Duration sendTimeout) {
        this.sendTimeout = sendTimeout;
    }

    public int getPayloadSnapshotLength() {
        return payloadSnapshotLength;
    }

    public void setPayloadSnapshotLength(int payloadSnapshotLength) {
        this.payloadSnapshotLength = payloadSnapshotLength;
    }

    public Duration getShutdownAwait() {
        return shutdownAwait;
    }

    public void setShutdownAwait(Duration shutdownAwait) {
        this.shutdownAwait = shutdownAwait;
    }

    public Async getAsync() {
        return async;
    }

    public void setAsync(Async async) {
        this.async = async;
    }

    public Throttle getThrottle() {
        return throttle;
    }

    public void setThrottle(Throttle throttle) {
        this.throttle = throttle;
    }

    public static class Async {
        private int corePoolSize = 2;

        private int maxPoolSize = 4;

        private int queueCapacity = 1000;

        private Duration keepAlive = Duration.ofSeconds(60);

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

        public Duration getKeepAlive() {
            return keepAlive;
        }

        public void setKeepAlive(Duration keepAlive) {
            this.keepAlive = keepAlive;
        }
    }

    /**
     * 同一 errorType + severity 在 window 内最多放行 threshold 条
     */
    public static class Throttle {
        private Duration window = Duration.ofMinutes(5);

        private int threshold = 1;

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }
    }
}

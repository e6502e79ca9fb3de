package com.questrail.brickhub.config;

import java.time.Duration;
import java.util.Objects;

/**
 * HubConfig
 * -----------------------------------------------------------------------------
 * Operational configuration of a hub engine.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>replyTimeout</b>: Maximum time a synchronous send waits for its
 *       reply. {@link Duration#ZERO} waits forever.</li>
 *   <li><b>syncSendPolicy</b>: Behaviour when synchronous sends overlap.</li>
 *   <li><b>deviceWaitAttempts</b>, <b>deviceWaitInterval</b>: How long a hub
 *       variant polls for its built-in peripherals at startup.</li>
 *   <li><b>portDataQueueCapacity</b>: Per-peripheral bound on queued value
 *       notifications; the oldest entry is dropped when full.</li>
 * </ul>
 */
public record HubConfig(
        Duration replyTimeout,
        SyncSendPolicy syncSendPolicy,
        int deviceWaitAttempts,
        Duration deviceWaitInterval,
        int portDataQueueCapacity
) {
    public HubConfig {
        Objects.requireNonNull(replyTimeout, "replyTimeout");
        Objects.requireNonNull(syncSendPolicy, "syncSendPolicy");
        Objects.requireNonNull(deviceWaitInterval, "deviceWaitInterval");

        if (replyTimeout.isNegative()) {
            throw new IllegalArgumentException("replyTimeout must be non-negative");
        }
        if (deviceWaitAttempts < 0) {
            throw new IllegalArgumentException("deviceWaitAttempts must be non-negative");
        }
        if (deviceWaitInterval.isNegative()) {
            throw new IllegalArgumentException("deviceWaitInterval must be non-negative");
        }
        if (portDataQueueCapacity < 1) {
            throw new IllegalArgumentException("portDataQueueCapacity must be positive");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>replyTimeout: 10s</li>
     *   <li>syncSendPolicy: REJECT</li>
     *   <li>deviceWaitAttempts: 60</li>
     *   <li>deviceWaitInterval: 100ms</li>
     *   <li>portDataQueueCapacity: 64</li>
     * </ul>
     */
    public static HubConfig defaults() {
        return builder().build();
    }

    /**
     * @return {@code true} if synchronous sends wait without limit
     */
    public boolean waitsForever() {
        return replyTimeout.isZero();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration replyTimeout = Duration.ofSeconds(10);
        private SyncSendPolicy syncSendPolicy = SyncSendPolicy.REJECT;
        private int deviceWaitAttempts = 60;
        private Duration deviceWaitInterval = Duration.ofMillis(100);
        private int portDataQueueCapacity = 64;

        public Builder withReplyTimeout(Duration replyTimeout) {
            this.replyTimeout = replyTimeout;
            return this;
        }

        public Builder withSyncSendPolicy(SyncSendPolicy policy) {
            this.syncSendPolicy = policy;
            return this;
        }

        public Builder withDeviceWait(int attempts, Duration interval) {
            this.deviceWaitAttempts = attempts;
            this.deviceWaitInterval = interval;
            return this;
        }

        public Builder withPortDataQueueCapacity(int capacity) {
            this.portDataQueueCapacity = capacity;
            return this;
        }

        public HubConfig build() {
            return new HubConfig(replyTimeout, syncSendPolicy, deviceWaitAttempts,
                    deviceWaitInterval, portDataQueueCapacity);
        }
    }
}

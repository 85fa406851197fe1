package io.deskrelay.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for deskrelay.
 *
 * @see DeskRelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "deskrelay")
public class DeskRelayProperties {

    /**
     * Database table name for the ticket event log.
     */
    private String tableName = "ticket_events";

    private final Hub hub = new Hub();
    private final Session session = new Session();
    private final CatchUp catchUp = new CatchUp();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public Hub getHub() {
        return hub;
    }

    public Session getSession() {
        return session;
    }

    public CatchUp getCatchUp() {
        return catchUp;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Hub {
        private int dispatchQueueCapacity = 256;
        private long drainTimeoutMs = 5000;

        public int getDispatchQueueCapacity() {
            return dispatchQueueCapacity;
        }

        public void setDispatchQueueCapacity(int dispatchQueueCapacity) {
            this.dispatchQueueCapacity = dispatchQueueCapacity;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Session {
        private Duration readTimeout = Duration.ofSeconds(60);
        private Duration writeTimeout = Duration.ofSeconds(10);
        /**
         * Keepalive probe interval. Defaults to nine tenths of the read timeout.
         */
        private Duration keepaliveInterval;
        private int maxFrameBytes = 1024;
        private int outboundQueueCapacity = 256;
        private long shutdownTimeoutMs = 5000;

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public Duration getWriteTimeout() {
            return writeTimeout;
        }

        public void setWriteTimeout(Duration writeTimeout) {
            this.writeTimeout = writeTimeout;
        }

        public Duration getKeepaliveInterval() {
            return keepaliveInterval;
        }

        public void setKeepaliveInterval(Duration keepaliveInterval) {
            this.keepaliveInterval = keepaliveInterval;
        }

        public int getMaxFrameBytes() {
            return maxFrameBytes;
        }

        public void setMaxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
        }

        public int getOutboundQueueCapacity() {
            return outboundQueueCapacity;
        }

        public void setOutboundQueueCapacity(int outboundQueueCapacity) {
            this.outboundQueueCapacity = outboundQueueCapacity;
        }

        public long getShutdownTimeoutMs() {
            return shutdownTimeoutMs;
        }

        public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
            this.shutdownTimeoutMs = shutdownTimeoutMs;
        }
    }

    public static class CatchUp {
        private int defaultLimit = 50;
        private int maxLimit = 200;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "deskrelay";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}

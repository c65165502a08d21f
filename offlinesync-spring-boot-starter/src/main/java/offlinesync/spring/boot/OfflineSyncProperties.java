package offlinesync.spring.boot;

import offlinesync.jdbc.TableNames;
import offlinesync.queue.QueueManager;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the offline message queue.
 *
 * @see OfflineSyncAutoConfiguration
 */
@ConfigurationProperties(prefix = "offlinesync")
public class OfflineSyncProperties {

    /**
     * Database table name for queued messages.
     */
    private String tableName = TableNames.DEFAULT_TABLE;

    /**
     * Delivery attempts per message before it is marked failed.
     */
    private int maxRetries = QueueManager.DEFAULT_MAX_RETRIES;

    /**
     * Upper bound for a single delivery attempt. Zero disables the limit.
     */
    private Duration deliveryTimeout = Duration.ofSeconds(30);

    /**
     * Whether to drain leftover messages at startup when the device is online.
     */
    private boolean syncOnStart = true;

    /**
     * Interval of periodic sync triggers while online. Zero disables them.
     */
    private Duration resyncInterval = Duration.ZERO;

    /**
     * How long shutdown waits for a running sync to finish.
     */
    private Duration drainTimeout = Duration.ofSeconds(5);

    private final Connectivity connectivity = new Connectivity();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getDeliveryTimeout() {
        return deliveryTimeout;
    }

    public void setDeliveryTimeout(Duration deliveryTimeout) {
        this.deliveryTimeout = deliveryTimeout;
    }

    public boolean isSyncOnStart() {
        return syncOnStart;
    }

    public void setSyncOnStart(boolean syncOnStart) {
        this.syncOnStart = syncOnStart;
    }

    public Duration getResyncInterval() {
        return resyncInterval;
    }

    public void setResyncInterval(Duration resyncInterval) {
        this.resyncInterval = resyncInterval;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public Connectivity getConnectivity() {
        return connectivity;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Connectivity detection. Without a heartbeat host the state is set by the
     * application through {@link offlinesync.connectivity.ManualConnectivityProbe}.
     */
    public static class Connectivity {
        /**
         * Host probed by TCP connect to decide reachability.
         */
        private String heartbeatHost;
        private int heartbeatPort = 443;
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private Duration connectTimeout = Duration.ofSeconds(3);
        private boolean initiallyOnline = false;

        public String getHeartbeatHost() {
            return heartbeatHost;
        }

        public void setHeartbeatHost(String heartbeatHost) {
            this.heartbeatHost = heartbeatHost;
        }

        public int getHeartbeatPort() {
            return heartbeatPort;
        }

        public void setHeartbeatPort(int heartbeatPort) {
            this.heartbeatPort = heartbeatPort;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public boolean isInitiallyOnline() {
            return initiallyOnline;
        }

        public void setInitiallyOnline(boolean initiallyOnline) {
            this.initiallyOnline = initiallyOnline;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "offlinesync";

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

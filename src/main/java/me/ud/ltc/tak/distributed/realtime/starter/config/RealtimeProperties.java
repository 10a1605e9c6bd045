package me.ud.ltc.tak.distributed.realtime.starter.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Realtime event delivery configuration properties class
 *
 * @author takltc
 */
@Data
@ConfigurationProperties(prefix = "takltc.realtime")
public class RealtimeProperties {

    /**
     * Whether to enable realtime delivery
     */
    private boolean enabled = true;

    /**
     * Push connection configuration
     */
    private Connection connection = new Connection();

    /**
     * Redis configuration (for cluster support)
     */
    private Redis redis = new Redis();

    /**
     * Recent event history configuration
     */
    private EventStore eventStore = new EventStore();

    /**
     * Cross-process relay configuration
     */
    private Relay relay = new Relay();

    /**
     * Notification rate limiting configuration
     */
    private RateLimit rateLimit = new RateLimit();

    /**
     * Polling fallback configuration
     */
    private Polling polling = new Polling();

    /**
     * Backing store load balancing configuration
     */
    private LoadBalancer loadBalancer = new LoadBalancer();

    /**
     * HTTP endpoint configuration
     */
    private Web web = new Web();

    @Data
    public static class Connection {
        /**
         * SSE emitter timeout (milliseconds), 0 means no server side timeout
         */
        private long timeout = 0L;

        /**
         * Heartbeat interval (milliseconds)
         */
        private int heartbeat = 30000;

        /**
         * Number of heartbeat periods without a successful write before a connection is closed
         */
        private int maxIdleHeartbeats = 3;

        /**
         * Maximum duration of a single write before the connection is treated as a slow consumer (milliseconds)
         */
        private int writeTimeout = 10000;

        /**
         * Maximum number of connections on this instance
         */
        private int maxConnections = 1000;

        /**
         * Maximum number of connections per user on this instance
         */
        private int maxConnectionsPerUser = 3;

        /**
         * Capacity of each connection's send queue
         */
        private int sendQueueCapacity = 256;

        /**
         * Number of threads writing to connections
         */
        private int senderThreads = 8;

        /**
         * Whether to notify connections and wait for executors on shutdown
         */
        private boolean gracefulShutdown = true;

        /**
         * Graceful shutdown timeout (milliseconds)
         */
        private int gracefulShutdownTimeout = 5000;
    }

    @Data
    public static class Redis {
        /**
         * Whether to enable Redis support; when disabled everything runs in memory on a single node
         */
        private boolean enabled = true;

        /**
         * Redis key prefix
         */
        private String prefix = "realtime:";
    }

    @Data
    public static class EventStore {
        /**
         * Maximum number of events kept in the history
         */
        private int maxEvents = 100;

        /**
         * Age after which the in-memory history drops an event (milliseconds), 0 keeps events until evicted
         */
        private long maxAge = 3600000L;

        /**
         * History key TTL (seconds), 0 disables expiry
         */
        private int historyTtl = 0;

        /**
         * Whether to keep a local in-memory copy of the history used when Redis is unreachable
         */
        private boolean localFallbackEnabled = true;
    }

    @Data
    public static class Relay {
        /**
         * Whether to relay events to other instances
         */
        private boolean enabled = true;

        /**
         * Broadcast channel name
         */
        private String channel = "realtime:events";

        /**
         * Instance registration TTL (seconds)
         */
        private int instanceTtl = 300;
    }

    @Data
    public static class RateLimit {
        /**
         * Whether to enable rate limiting
         */
        private boolean enabled = true;

        /**
         * Fixed window length (seconds)
         */
        private int windowSeconds = 60;

        /**
         * Maximum events per user per window
         */
        private int maxPerUser = 10;

        /**
         * Maximum events per event type per window
         */
        private int maxPerType = 30;

        /**
         * Maximum polling requests per user per window, 0 disables the check
         */
        private int pollingRequests = 60;

        /**
         * Maximum stream connection attempts per user per window, 0 disables the check
         */
        private int connectionsPerUser = 5;

        /**
         * Maximum stream connection attempts per client address per window, 0 disables the check
         */
        private int connectionsPerIp = 10;
    }

    @Data
    public static class Polling {
        /**
         * Recommended client polling interval (milliseconds)
         */
        private int recommendedInterval = 10000;

        /**
         * Number of events returned when the request names no limit
         */
        private int defaultLimit = 20;

        /**
         * Upper bound of the requested limit
         */
        private int maxLimit = 50;

        /**
         * Events older than this are skipped unless the request includes expired events (milliseconds)
         */
        private long maxAge = 1800000L;
    }

    @Data
    public static class LoadBalancer {
        /**
         * Health check interval (milliseconds)
         */
        private int healthCheckInterval = 30000;

        /**
         * Consecutive errors before an instance is marked unhealthy
         */
        private int errorThreshold = 5;

        /**
         * Redis command timeout applied to configured instances (milliseconds)
         */
        private int operationTimeout = 3000;

        /**
         * Health probe timeout (milliseconds)
         */
        private int probeTimeout = 2000;

        /**
         * Backing store instances; when empty the application's Redis connection is used
         */
        private List<Instance> instances = new ArrayList<>();
    }

    @Data
    public static class Instance {
        /**
         * Instance ID, defaults to redis-{index}
         */
        private String id;

        private String host = "localhost";

        private int port = 6379;

        private String password;

        private int database = 0;

        /**
         * Relative share of traffic
         */
        private int weight = 1;

        /**
         * Whether the instance takes traffic
         */
        private boolean active = true;
    }

    @Data
    public static class Web {
        /**
         * Whether to expose the HTTP endpoints
         */
        private boolean enabled = true;
    }
}

package com.ivamare.eventsourcing;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the event sourcing core.
 *
 * <p>Example configuration:
 * <pre>
 * eventsourcing:
 *   enabled: true
 *   store:
 *     type: jdbc
 *   snapshot:
 *     frequency: 100
 *     max-age-days: 30
 *     maintenance-enabled: true
 *   projection:
 *     batch-size: 100
 *     auto-start: true
 *   replay:
 *     batch-size: 100
 *   command:
 *     retry-enabled: true
 *     rate-limit-enabled: true
 *     rate-limit:
 *       limit: 100
 *       window: 1m
 *   query:
 *     cache-ttl: 60s
 * </pre>
 */
@ConfigurationProperties(prefix = "eventsourcing")
public class EventSourcingProperties {

    /**
     * Enable/disable event sourcing auto-configuration.
     */
    private boolean enabled = true;

    private StoreProperties store = new StoreProperties();

    private SnapshotProperties snapshot = new SnapshotProperties();

    private ProjectionProperties projection = new ProjectionProperties();

    private ReplayProperties replay = new ReplayProperties();

    private CommandProperties command = new CommandProperties();

    private QueryProperties query = new QueryProperties();

    private SubscriptionProperties subscription = new SubscriptionProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public StoreProperties getStore() {
        return store;
    }

    public void setStore(StoreProperties store) {
        this.store = store;
    }

    public SnapshotProperties getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(SnapshotProperties snapshot) {
        this.snapshot = snapshot;
    }

    public ProjectionProperties getProjection() {
        return projection;
    }

    public void setProjection(ProjectionProperties projection) {
        this.projection = projection;
    }

    public ReplayProperties getReplay() {
        return replay;
    }

    public void setReplay(ReplayProperties replay) {
        this.replay = replay;
    }

    public CommandProperties getCommand() {
        return command;
    }

    public void setCommand(CommandProperties command) {
        this.command = command;
    }

    public QueryProperties getQuery() {
        return query;
    }

    public void setQuery(QueryProperties query) {
        this.query = query;
    }

    public SubscriptionProperties getSubscription() {
        return subscription;
    }

    public void setSubscription(SubscriptionProperties subscription) {
        this.subscription = subscription;
    }

    /**
     * Event store backend selection.
     */
    public static class StoreProperties {

        /**
         * Store type: "jdbc" (requires a JdbcTemplate) or "memory".
         */
        private String type = "jdbc";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    /**
     * Snapshot policy and maintenance configuration.
     */
    public static class SnapshotProperties {

        /**
         * Number of events replayed since the last snapshot that triggers a new one.
         */
        private int frequency = 100;

        /**
         * Snapshots older than this are refreshed by maintenance.
         */
        private int maxAgeDays = 30;

        /**
         * Enable the scheduled snapshot maintenance job.
         */
        private boolean maintenanceEnabled = false;

        /**
         * Cron expression for the maintenance job.
         */
        private String maintenanceCron = "0 0 3 * * *";

        public int getFrequency() {
            return frequency;
        }

        public void setFrequency(int frequency) {
            this.frequency = frequency;
        }

        public int getMaxAgeDays() {
            return maxAgeDays;
        }

        public void setMaxAgeDays(int maxAgeDays) {
            this.maxAgeDays = maxAgeDays;
        }

        public boolean isMaintenanceEnabled() {
            return maintenanceEnabled;
        }

        public void setMaintenanceEnabled(boolean maintenanceEnabled) {
            this.maintenanceEnabled = maintenanceEnabled;
        }

        public String getMaintenanceCron() {
            return maintenanceCron;
        }

        public void setMaintenanceCron(String maintenanceCron) {
            this.maintenanceCron = maintenanceCron;
        }
    }

    /**
     * Projection runner configuration.
     */
    public static class ProjectionProperties {

        /**
         * Events fetched per poll.
         */
        private int batchSize = 100;

        /**
         * Events fetched per page while rebuilding.
         */
        private int rebuildBatchSize = 1000;

        /**
         * Sleep after an empty poll, in milliseconds.
         */
        private long idleBackoffMs = 100;

        /**
         * Sleep after a handler failure, in milliseconds.
         */
        private long errorBackoffMs = 5000;

        /**
         * Start projection loops on application ready.
         */
        private boolean autoStart = false;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getRebuildBatchSize() {
            return rebuildBatchSize;
        }

        public void setRebuildBatchSize(int rebuildBatchSize) {
            this.rebuildBatchSize = rebuildBatchSize;
        }

        public long getIdleBackoffMs() {
            return idleBackoffMs;
        }

        public void setIdleBackoffMs(long idleBackoffMs) {
            this.idleBackoffMs = idleBackoffMs;
        }

        public long getErrorBackoffMs() {
            return errorBackoffMs;
        }

        public void setErrorBackoffMs(long errorBackoffMs) {
            this.errorBackoffMs = errorBackoffMs;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }
    }

    /**
     * Replay engine configuration.
     */
    public static class ReplayProperties {

        /**
         * Default number of events per replay batch.
         */
        private int batchSize = 100;

        /**
         * Pause between batches, in milliseconds.
         */
        private long pauseBetweenBatchesMs = 10;

        /**
         * Upper bound for the paced delay between two events, in milliseconds.
         */
        private long maxEventDelayMs = 10_000;

        /**
         * Poll interval while a session is paused, in milliseconds.
         */
        private long pausePollMs = 100;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getPauseBetweenBatchesMs() {
            return pauseBetweenBatchesMs;
        }

        public void setPauseBetweenBatchesMs(long pauseBetweenBatchesMs) {
            this.pauseBetweenBatchesMs = pauseBetweenBatchesMs;
        }

        public long getMaxEventDelayMs() {
            return maxEventDelayMs;
        }

        public void setMaxEventDelayMs(long maxEventDelayMs) {
            this.maxEventDelayMs = maxEventDelayMs;
        }

        public long getPausePollMs() {
            return pausePollMs;
        }

        public void setPausePollMs(long pausePollMs) {
            this.pausePollMs = pausePollMs;
        }
    }

    /**
     * Command bus middleware configuration.
     */
    public static class CommandProperties {

        private boolean loggingEnabled = true;

        private boolean validationEnabled = true;

        /**
         * Wrap command handling in a database transaction. Requires a transaction manager.
         */
        private boolean transactionalEnabled = false;

        private boolean retryEnabled = false;

        private boolean rateLimitEnabled = false;

        private RetryProperties retry = new RetryProperties();

        private RateLimitProperties rateLimit = new RateLimitProperties();

        public boolean isLoggingEnabled() {
            return loggingEnabled;
        }

        public void setLoggingEnabled(boolean loggingEnabled) {
            this.loggingEnabled = loggingEnabled;
        }

        public boolean isValidationEnabled() {
            return validationEnabled;
        }

        public void setValidationEnabled(boolean validationEnabled) {
            this.validationEnabled = validationEnabled;
        }

        public boolean isTransactionalEnabled() {
            return transactionalEnabled;
        }

        public void setTransactionalEnabled(boolean transactionalEnabled) {
            this.transactionalEnabled = transactionalEnabled;
        }

        public boolean isRetryEnabled() {
            return retryEnabled;
        }

        public void setRetryEnabled(boolean retryEnabled) {
            this.retryEnabled = retryEnabled;
        }

        public boolean isRateLimitEnabled() {
            return rateLimitEnabled;
        }

        public void setRateLimitEnabled(boolean rateLimitEnabled) {
            this.rateLimitEnabled = rateLimitEnabled;
        }

        public RetryProperties getRetry() {
            return retry;
        }

        public void setRetry(RetryProperties retry) {
            this.retry = retry;
        }

        public RateLimitProperties getRateLimit() {
            return rateLimit;
        }

        public void setRateLimit(RateLimitProperties rateLimit) {
            this.rateLimit = rateLimit;
        }
    }

    /**
     * Retry middleware configuration.
     */
    public static class RetryProperties {

        /**
         * Total attempts including the first one.
         */
        private int maxAttempts = 3;

        /**
         * Base delay, multiplied by the attempt number.
         */
        private Duration delay = Duration.ofSeconds(1);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getDelay() {
            return delay;
        }

        public void setDelay(Duration delay) {
            this.delay = delay;
        }
    }

    /**
     * Per-actor rate limit configuration.
     */
    public static class RateLimitProperties {

        /**
         * Maximum requests per window.
         */
        private long limit = 100;

        private Duration window = Duration.ofMinutes(1);

        public long getLimit() {
            return limit;
        }

        public void setLimit(long limit) {
            this.limit = limit;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }

    /**
     * Query bus cache and middleware configuration.
     */
    public static class QueryProperties {

        /**
         * Time-to-live for cached query results.
         */
        private Duration cacheTtl = Duration.ofSeconds(60);

        /**
         * Queries slower than this are logged as slow.
         */
        private Duration slowQueryThreshold = Duration.ofSeconds(1);

        private int defaultPageSize = 20;

        /**
         * Hard upper bound applied to requested page sizes.
         */
        private int maxPageSize = 100;

        private boolean performanceTrackingEnabled = true;

        private boolean paginationEnabled = true;

        private boolean authorizationEnabled = false;

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }

        public Duration getSlowQueryThreshold() {
            return slowQueryThreshold;
        }

        public void setSlowQueryThreshold(Duration slowQueryThreshold) {
            this.slowQueryThreshold = slowQueryThreshold;
        }

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public boolean isPerformanceTrackingEnabled() {
            return performanceTrackingEnabled;
        }

        public void setPerformanceTrackingEnabled(boolean performanceTrackingEnabled) {
            this.performanceTrackingEnabled = performanceTrackingEnabled;
        }

        public boolean isPaginationEnabled() {
            return paginationEnabled;
        }

        public void setPaginationEnabled(boolean paginationEnabled) {
            this.paginationEnabled = paginationEnabled;
        }

        public boolean isAuthorizationEnabled() {
            return authorizationEnabled;
        }

        public void setAuthorizationEnabled(boolean authorizationEnabled) {
            this.authorizationEnabled = authorizationEnabled;
        }
    }

    /**
     * Polling subscription configuration.
     */
    public static class SubscriptionProperties {

        private int batchSize = 100;

        private long pollIntervalMs = 500;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }
    }
}

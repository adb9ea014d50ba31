package io.campaign.spring.boot;

import io.campaign.jdbc.TableNames;
import io.campaign.notify.DefaultNotifierRegistry;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the campaign dispatch pipeline.
 *
 * @see CampaignAutoConfiguration
 */
@ConfigurationProperties(prefix = "campaign")
public class CampaignProperties {

    /**
     * Database table holding queued jobs.
     */
    private String jobTable = TableNames.DEFAULT_JOB_TABLE;

    /**
     * Claim identity of this node. A random id is generated when empty.
     */
    private String ownerId = "";

    private final Dispatcher dispatcher = new Dispatcher();
    private final Retry retry = new Retry();
    private final Poller poller = new Poller();
    private final Send send = new Send();
    private final Notifier notifier = new Notifier();
    private final Metrics metrics = new Metrics();

    public String getJobTable() {
        return jobTable;
    }

    public void setJobTable(String jobTable) {
        this.jobTable = jobTable;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Retry getRetry() {
        return retry;
    }

    public Poller getPoller() {
        return poller;
    }

    public Send getSend() {
        return send;
    }

    public Notifier getNotifier() {
        return notifier;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Dispatcher {
        private int workerCount = 4;
        private int hotQueueCapacity = 1000;
        private int coldQueueCapacity = 1000;
        private int maxAttempts = 5;

        /**
         * Wall-clock budget of one job run. Also the age after which a claim lapses.
         */
        private Duration jobTimeout = Duration.ofMinutes(5);
        private Duration drainTimeout = Duration.ofSeconds(5);

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getHotQueueCapacity() {
            return hotQueueCapacity;
        }

        public void setHotQueueCapacity(int hotQueueCapacity) {
            this.hotQueueCapacity = hotQueueCapacity;
        }

        public int getColdQueueCapacity() {
            return coldQueueCapacity;
        }

        public void setColdQueueCapacity(int coldQueueCapacity) {
            this.coldQueueCapacity = coldQueueCapacity;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getJobTimeout() {
            return jobTimeout;
        }

        public void setJobTimeout(Duration jobTimeout) {
            this.jobTimeout = jobTimeout;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Retry {
        private Duration baseDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofMinutes(1);

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Poller {
        private Duration interval = Duration.ofSeconds(5);
        private int batchSize = 50;

        /**
         * Grace period during which freshly submitted jobs are left to the hot path.
         */
        private Duration skipRecent = Duration.ZERO;

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getSkipRecent() {
            return skipRecent;
        }

        public void setSkipRecent(Duration skipRecent) {
            this.skipRecent = skipRecent;
        }
    }

    public static class Send {
        /**
         * Notifier calls in flight per dispatch job.
         */
        private int concurrency = 10;
        private Duration timeout = Duration.ofSeconds(30);

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Notifier {
        private String defaultChannel = DefaultNotifierRegistry.EMAIL_CHANNEL;

        public String getDefaultChannel() {
            return defaultChannel;
        }

        public void setDefaultChannel(String defaultChannel) {
            this.defaultChannel = defaultChannel;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "campaign";

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

package chatlog.spring.boot;

import chatlog.jdbc.TableNames;
import chatlog.jdbc.store.AbstractJdbcMessageStore;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the chat log.
 *
 * @see ChatLogAutoConfiguration
 */
@ConfigurationProperties(prefix = "chatlog")
public class ChatLogProperties {

    /**
     * Table holding live messages.
     */
    private String liveTable = TableNames.DEFAULT_LIVE_TABLE;

    /**
     * Table holding archived messages.
     */
    private String archiveTable = TableNames.DEFAULT_ARCHIVE_TABLE;

    /**
     * JDBC statement timeout; 0 disables it.
     */
    private int queryTimeoutSeconds = AbstractJdbcMessageStore.DEFAULT_QUERY_TIMEOUT_SECONDS;

    /**
     * Create the tables from the bundled schema script on startup.
     */
    private boolean initializeSchema;

    /**
     * Consecutive messages of one sender closer than this are merged.
     */
    private Duration mergeWindow = Duration.ofSeconds(60);

    /**
     * Sender recorded for messages that carry none.
     */
    private String defaultSender = "operator";

    /**
     * Recipient recorded for messages that carry none.
     */
    private String defaultRecipient = "team";

    private final Recent recent = new Recent();
    private final Compaction compaction = new Compaction();
    private final Archive archive = new Archive();
    private final Thoughts thoughts = new Thoughts();
    private final Retry retry = new Retry();
    private final Metrics metrics = new Metrics();

    public String getLiveTable() {
        return liveTable;
    }

    public void setLiveTable(String liveTable) {
        this.liveTable = liveTable;
    }

    public String getArchiveTable() {
        return archiveTable;
    }

    public void setArchiveTable(String archiveTable) {
        this.archiveTable = archiveTable;
    }

    public int getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Duration getMergeWindow() {
        return mergeWindow;
    }

    public void setMergeWindow(Duration mergeWindow) {
        this.mergeWindow = mergeWindow;
    }

    public String getDefaultSender() {
        return defaultSender;
    }

    public void setDefaultSender(String defaultSender) {
        this.defaultSender = defaultSender;
    }

    public String getDefaultRecipient() {
        return defaultRecipient;
    }

    public void setDefaultRecipient(String defaultRecipient) {
        this.defaultRecipient = defaultRecipient;
    }

    public Recent getRecent() {
        return recent;
    }

    public Compaction getCompaction() {
        return compaction;
    }

    public Archive getArchive() {
        return archive;
    }

    public Thoughts getThoughts() {
        return thoughts;
    }

    public Retry getRetry() {
        return retry;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Recent {
        private int limit = 100;
        private int scanLimit = 300;

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public int getScanLimit() {
            return scanLimit;
        }

        public void setScanLimit(int scanLimit) {
            this.scanLimit = scanLimit;
        }
    }

    public static class Compaction {
        private int keepLive = 100;
        private int maxPerRun = 200;
        private int batchSize = 250;
        private boolean scheduled;
        private long intervalSeconds = 300;

        public int getKeepLive() {
            return keepLive;
        }

        public void setKeepLive(int keepLive) {
            this.keepLive = keepLive;
        }

        public int getMaxPerRun() {
            return maxPerRun;
        }

        public void setMaxPerRun(int maxPerRun) {
            this.maxPerRun = maxPerRun;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public boolean isScheduled() {
            return scheduled;
        }

        public void setScheduled(boolean scheduled) {
            this.scheduled = scheduled;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Archive {
        private int defaultPageSize = 50;
        private int maxPageSize = 200;

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
    }

    public static class Thoughts {
        private String thinker = "assistant";

        public String getThinker() {
            return thinker;
        }

        public void setThinker(String thinker) {
            this.thinker = thinker;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 200;
        private long maxDelayMs = 5000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "chatlog";

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

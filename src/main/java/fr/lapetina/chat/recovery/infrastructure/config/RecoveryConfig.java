package fr.lapetina.chat.recovery.infrastructure.config;

/**
 * Root configuration object for the error recovery subsystem.
 * Designed to be populated from YAML.
 */
public class RecoveryConfig {

    private RetryConfig retry = new RetryConfig();
    private HistoryConfig history = new HistoryConfig();
    private LogStoreConfig logStore = new LogStoreConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public HistoryConfig getHistory() { return history; }
    public void setHistory(HistoryConfig history) { this.history = history; }

    public LogStoreConfig getLogStore() { return logStore; }
    public void setLogStore(LogStoreConfig logStore) { this.logStore = logStore; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Automatic retry configuration.
     */
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long baseDelayMs = 2000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
    }

    /**
     * In-memory error history configuration.
     */
    public static class HistoryConfig {
        private int capacity = 100;

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }
    }

    /**
     * Persistent log store configuration.
     */
    public static class LogStoreConfig {
        private String directory = "logs";
        private String exportDirectory = "logs/exports";
        private long maxFileSizeBytes = 10L * 1024 * 1024;
        private int maxFiles = 5;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public String getExportDirectory() { return exportDirectory; }
        public void setExportDirectory(String exportDirectory) { this.exportDirectory = exportDirectory; }

        public long getMaxFileSizeBytes() { return maxFileSizeBytes; }
        public void setMaxFileSizeBytes(long maxFileSizeBytes) { this.maxFileSizeBytes = maxFileSizeBytes; }

        public int getMaxFiles() { return maxFiles; }
        public void setMaxFiles(int maxFiles) { this.maxFiles = maxFiles; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "chat_recovery";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}

package fr.lapetina.chat.recovery.infrastructure.logstore;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventTranslatorOneArg;
import com.lmax.disruptor.EventTranslatorThreeArg;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.chat.recovery.domain.model.ErrorSeverity;
import fr.lapetina.chat.recovery.infrastructure.config.RecoveryConfig;
import fr.lapetina.chat.recovery.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Persistent, rotating, day-partitioned store of sanitized log lines.
 *
 * Writes go through an LMAX Disruptor ring buffer with a single consumer
 * ({@link LogWriteHandler}), so callers never touch the file system and file mutations
 * are strictly ordered. Reads ({@link #getRecent}, {@link #export}) access the files directly.
 *
 * PRODUCER TYPE: MULTI. The coordinator actor, retry workers and any application thread may log.
 *
 * BACKPRESSURE: {@link #append} never blocks. When the ring buffer is full the entry is
 * dropped and counted. Control events (flush, clear) wait for a free slot.
 *
 * Nothing in this class throws on I/O failure; failures are logged and swallowed.
 */
public final class LogStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LogStore.class);

    private static final EventTranslatorThreeArg<LogEvent, Instant, ErrorSeverity, String> APPEND_TRANSLATOR =
            (event, sequence, timestamp, severity, message) -> event.initAppend(timestamp, severity, message);

    private final Disruptor<LogEvent> disruptor;
    private final RingBuffer<LogEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Path directory;
    private final Path exportDirectory;
    private final Clock clock;
    private final MetricsRegistry metricsRegistry;

    private LogStore(Builder builder) {
        this.directory = builder.directory;
        this.exportDirectory = builder.exportDirectory != null
                ? builder.exportDirectory
                : builder.directory.resolve("exports");
        this.clock = builder.clock;
        this.metricsRegistry = builder.metricsRegistry;

        this.disruptor = new Disruptor<>(
                new LogEventFactory(),
                builder.ringBufferSize,
                new LogWriterThreadFactory("log-store-writer"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        disruptor.handleEventsWith(new LogWriteHandler(
                directory, builder.maxFileSizeBytes, builder.maxFiles, metricsRegistry));
        disruptor.setDefaultExceptionHandler(new LogWriterExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("LogStore created: directory={}, maxFileSizeBytes={}, maxFiles={}, ringBufferSize={}",
                directory, builder.maxFileSizeBytes, builder.maxFiles, builder.ringBufferSize);
    }

    /**
     * Starts the writer thread.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("LogStore started");
        }
    }

    /**
     * Queues one line for writing. Never blocks and never throws.
     *
     * @return false if the entry was dropped (store not running or ring buffer full)
     */
    public boolean append(String message, ErrorSeverity severity) {
        if (!running.get()) {
            log.debug("LogStore not running, dropping entry");
            return false;
        }
        boolean published = ringBuffer.tryPublishEvent(
                APPEND_TRANSLATOR, Instant.now(clock), severity, message);
        metricsRegistry.setLogRingRemaining((int) ringBuffer.remainingCapacity());
        if (!published) {
            metricsRegistry.incrementLogEntryCount(MetricsRegistry.LOG_DROPPED);
            log.warn("Log store ring buffer full, entry dropped: severity={}", severity);
        }
        return published;
    }

    /**
     * Waits until every entry published before this call is on disk.
     *
     * @return true if the writer caught up within the timeout
     */
    public boolean flush(Duration timeout) {
        return awaitControl(LogEvent.Type.FLUSH, timeout);
    }

    /**
     * Deletes every log file, ordered after the writes already queued. Without a running
     * writer the files are deleted on the calling thread.
     *
     * @return future completed once the files are gone
     */
    public CompletableFuture<Void> clear() {
        if (!running.get()) {
            try {
                int deleted = LogFiles.deleteAll(directory);
                log.info("LogStore not running, cleared {} log files in {}", deleted, directory);
            } catch (IOException e) {
                log.warn("Failed to clear log files: directory={}, error={}", directory, e.toString());
            }
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> done = publishControl(LogEvent.Type.CLEAR);
        log.info("Log clear requested");
        return done;
    }

    private boolean awaitControl(LogEvent.Type type, Duration timeout) {
        try {
            publishControl(type).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (java.util.concurrent.TimeoutException e) {
            log.warn("LogStore {} timed out after {}", type, timeout);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.warn("LogStore {} failed", type, e.getCause());
            return false;
        }
    }

    private CompletableFuture<Void> publishControl(LogEvent.Type type) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        if (!running.get()) {
            done.complete(null);
            return done;
        }
        EventTranslatorOneArg<LogEvent, CompletableFuture<Void>> translator =
                (event, sequence, future) -> event.initControl(type, future);
        ringBuffer.publishEvent(translator, done);
        return done;
    }

    /**
     * Returns at most {@code limit} lines, newest file first and newest line first within a file.
     * Unreadable or malformed files count as empty; a missing directory gives an empty list.
     */
    public List<String> getRecent(int limit) {
        List<String> recent = new ArrayList<>();
        if (limit <= 0) {
            return recent;
        }
        List<LogFiles.LogFile> files;
        try {
            files = LogFiles.list(directory);
        } catch (IOException e) {
            log.warn("Failed to list log files: directory={}, error={}", directory, e.toString());
            return recent;
        }
        files.sort(LogFiles.BY_CREATION.reversed());

        for (LogFiles.LogFile file : files) {
            if (recent.size() >= limit) {
                break;
            }
            List<String> lines = readLines(file.path());
            Collections.reverse(lines);
            for (String line : lines) {
                if (recent.size() >= limit) {
                    break;
                }
                if (!line.isEmpty()) {
                    recent.add(line);
                }
            }
        }
        return recent;
    }

    /**
     * Concatenates every log file in name order, each under a {@code === name ===} header.
     */
    public String exportAsString() {
        StringBuilder content = new StringBuilder();
        List<LogFiles.LogFile> files;
        try {
            files = LogFiles.list(directory);
        } catch (IOException e) {
            log.warn("Failed to list log files for export: directory={}, error={}", directory, e.toString());
            return "";
        }
        files.sort(Comparator.comparing(f -> f.path().getFileName().toString()));
        for (LogFiles.LogFile file : files) {
            try {
                String text = Files.readString(file.path(), StandardCharsets.UTF_8);
                content.append("=== ").append(file.path().getFileName()).append(" ===\n")
                        .append(text)
                        .append("\n\n");
            } catch (IOException e) {
                log.warn("Skipping unreadable log file in export: file={}, error={}",
                        file.path().getFileName(), e.toString());
            }
        }
        return content.toString();
    }

    /**
     * Writes {@link #exportAsString()} to {@code exported-logs-<epochMillis>.txt} in the export directory.
     *
     * @return the written file, or empty on I/O failure
     */
    public Optional<Path> export() {
        Path target = exportDirectory.resolve("exported-logs-" + clock.millis() + ".txt");
        try {
            Files.createDirectories(exportDirectory);
            Files.writeString(target, exportAsString(), StandardCharsets.UTF_8);
            log.info("Logs exported to {}", target);
            return Optional.of(target);
        } catch (IOException e) {
            log.error("Failed to export logs: target={}, error={}", target, e.toString());
            return Optional.empty();
        }
    }

    private List<String> readLines(Path file) {
        try {
            return new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            // Includes MalformedInputException on non UTF-8 content
            log.warn("Treating unreadable log file as empty: file={}, error={}", file.getFileName(), e.toString());
            return new ArrayList<>();
        }
    }

    public Path getDirectory() {
        return directory;
    }

    public Path getExportDirectory() {
        return exportDirectory;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Drains pending entries and stops the writer thread.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down LogStore...");
            try {
                disruptor.shutdown(10, TimeUnit.SECONDS);
                log.info("LogStore shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("LogStore shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Daemon thread factory for the writer.
     */
    private static class LogWriterThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        LogWriterThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Keeps the writer alive after a handler failure and releases any waiting caller.
     */
    private static class LogWriterExceptionHandler implements ExceptionHandler<LogEvent> {

        private static final Logger log = LoggerFactory.getLogger(LogWriterExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, LogEvent event) {
            log.error("Exception in log writer: sequence={}, event={}", sequence, event, ex);
            if (event.getCompletion() != null && !event.getCompletion().isDone()) {
                event.getCompletion().complete(null);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during LogStore start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during LogStore shutdown", ex);
        }
    }

    /**
     * Builder for LogStore.
     */
    public static final class Builder {
        private Path directory = Paths.get("logs");
        private Path exportDirectory;
        private long maxFileSizeBytes = 10L * 1024 * 1024;
        private int maxFiles = 5;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private Clock clock = Clock.systemUTC();
        private MetricsRegistry metricsRegistry;

        public Builder directory(Path directory) {
            this.directory = directory;
            return this;
        }

        public Builder exportDirectory(Path exportDirectory) {
            this.exportDirectory = exportDirectory;
            return this;
        }

        public Builder maxFileSizeBytes(long maxFileSizeBytes) {
            if (maxFileSizeBytes <= 0) {
                throw new IllegalArgumentException("Max file size must be positive");
            }
            this.maxFileSizeBytes = maxFileSizeBytes;
            return this;
        }

        public Builder maxFiles(int maxFiles) {
            if (maxFiles <= 0) {
                throw new IllegalArgumentException("Max files must be positive");
            }
            this.maxFiles = maxFiles;
            return this;
        }

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(RecoveryConfig.LogStoreConfig config) {
            this.directory = Paths.get(config.getDirectory());
            this.exportDirectory = Paths.get(config.getExportDirectory());
            this.maxFileSizeBytes = config.getMaxFileSizeBytes();
            this.maxFiles = config.getMaxFiles();
            this.ringBufferSize = config.getRingBufferSize();
            this.waitStrategy = config.getWaitStrategy();
            return this;
        }

        public LogStore build() {
            if (directory == null) {
                throw new IllegalStateException("Log directory is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new LogStore(this);
        }
    }
}

package fr.lapetina.chat.recovery.infrastructure.logstore;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.chat.recovery.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Single consumer of the log store ring buffer: the only thread that touches log files.
 *
 * Responsibilities:
 * - Appends formatted lines to the UTC day file
 * - Rotates old files once the current file exceeds the size ceiling
 * - Deletes all log files on CLEAR
 * - Completes FLUSH futures in publication order
 *
 * I/O failures are logged and swallowed; the next event is processed normally.
 */
public final class LogWriteHandler implements EventHandler<LogEvent> {

    private static final Logger log = LoggerFactory.getLogger(LogWriteHandler.class);

    private final Path directory;
    private final long maxFileSizeBytes;
    private final int maxFiles;
    private final MetricsRegistry metricsRegistry;

    public LogWriteHandler(Path directory, long maxFileSizeBytes, int maxFiles, MetricsRegistry metricsRegistry) {
        this.directory = directory;
        this.maxFileSizeBytes = maxFileSizeBytes;
        this.maxFiles = maxFiles;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(LogEvent event, long sequence, boolean endOfBatch) {
        try {
            switch (event.getType()) {
                case APPEND -> append(event);
                case CLEAR -> clearFiles();
                case FLUSH -> { }
            }
        } finally {
            if (event.getCompletion() != null) {
                event.getCompletion().complete(null);
            }
            event.clear();
        }
    }

    private void append(LogEvent event) {
        Path file = directory.resolve(LogFiles.fileName(event.getTimestamp()));
        String line = LogFiles.formatLine(event.getTimestamp(), event.getSeverity(), event.getMessage());
        try {
            Files.createDirectories(directory);
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            metricsRegistry.incrementLogEntryCount(MetricsRegistry.LOG_WRITTEN);
        } catch (IOException e) {
            metricsRegistry.incrementLogEntryCount(MetricsRegistry.LOG_FAILED);
            log.warn("Failed to write log entry: file={}, error={}", file, e.toString());
            return;
        }
        rotateIfNeeded(file);
    }

    /**
     * Once the current file is over the ceiling, deletes the oldest files until
     * at most {@code maxFiles} remain.
     */
    void rotateIfNeeded(Path currentFile) {
        try {
            if (Files.size(currentFile) <= maxFileSizeBytes) {
                return;
            }
            List<LogFiles.LogFile> files = LogFiles.list(directory);
            if (files.size() <= maxFiles) {
                return;
            }
            files.sort(LogFiles.BY_CREATION);
            int excess = files.size() - maxFiles;
            for (LogFiles.LogFile file : files) {
                if (excess == 0) {
                    break;
                }
                // The file being written is never a victim
                if (file.path().getFileName().equals(currentFile.getFileName())) {
                    continue;
                }
                Files.deleteIfExists(file.path());
                excess--;
                log.info("Rotated log file: {}", file.path().getFileName());
            }
        } catch (IOException e) {
            log.warn("Log rotation failed: directory={}, error={}", directory, e.toString());
        }
    }

    private void clearFiles() {
        try {
            int deleted = LogFiles.deleteAll(directory);
            log.info("Cleared {} log files in {}", deleted, directory);
        } catch (IOException e) {
            log.warn("Failed to clear log files: directory={}, error={}", directory, e.toString());
        }
    }
}

package fr.lapetina.chat.recovery.infrastructure.logstore;

import fr.lapetina.chat.recovery.domain.model.ErrorSeverity;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * File naming, line format and listing rules shared by the writer and the readers.
 */
final class LogFiles {

    static final String PREFIX = "error-";
    static final String SUFFIX = ".log";
    static final String GLOB = PREFIX + "*" + SUFFIX;

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    /** Oldest first, name breaks ties. */
    static final Comparator<LogFile> BY_CREATION = Comparator
            .comparing(LogFile::created)
            .thenComparing(f -> f.path().getFileName().toString());

    private LogFiles() {
    }

    static String fileName(Instant timestamp) {
        return PREFIX + DAY.format(timestamp) + SUFFIX;
    }

    static String formatLine(Instant timestamp, ErrorSeverity severity, String message) {
        String body = message == null ? "" : message.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
        return "[" + TIMESTAMP.format(timestamp) + "] [" + severity.name() + "] " + body + "\n";
    }

    /**
     * Lists the log files of a directory; a missing directory gives an empty list.
     */
    static List<LogFile> list(Path directory) throws IOException {
        List<LogFile> files = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, GLOB)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(new LogFile(path, creationTime(path)));
                }
            }
        }
        return files;
    }

    /**
     * Deletes every log file of a directory.
     *
     * @return the number of files deleted
     */
    static int deleteAll(Path directory) throws IOException {
        int deleted = 0;
        for (LogFile file : list(directory)) {
            if (Files.deleteIfExists(file.path())) {
                deleted++;
            }
        }
        return deleted;
    }

    private static FileTime creationTime(Path path) {
        try {
            return Files.readAttributes(path, BasicFileAttributes.class).creationTime();
        } catch (IOException e) {
            // Vanished between listing and stat
            return FileTime.fromMillis(0);
        }
    }

    record LogFile(Path path, FileTime created) {
    }
}

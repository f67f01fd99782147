package fr.lapetina.chat.recovery.infrastructure.logging;

import java.io.File;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

/**
 * Snapshot of the host the application runs on, attached to critical log entries
 * and diagnostic reports.
 */
public record SystemInfo(
        String device,
        String osName,
        String osVersion,
        String javaVersion,
        String appVersion,
        int processorCount,
        long maxMemoryBytes,
        long usedMemoryBytes,
        long diskTotalBytes,
        long diskAvailableBytes,
        Instant timestamp
) {

    public static SystemInfo collect(Clock clock) {
        Runtime runtime = Runtime.getRuntime();
        File root = new File(System.getProperty("user.home", "."));
        String appVersion = SystemInfo.class.getPackage().getImplementationVersion();

        return new SystemInfo(
                System.getProperty("os.arch", "Unknown"),
                System.getProperty("os.name", "Unknown"),
                System.getProperty("os.version", "Unknown"),
                System.getProperty("java.version", "Unknown"),
                appVersion != null ? appVersion : "Unknown",
                runtime.availableProcessors(),
                runtime.maxMemory(),
                runtime.totalMemory() - runtime.freeMemory(),
                root.getTotalSpace(),
                root.getUsableSpace(),
                Instant.now(clock)
        );
    }

    public static SystemInfo collect() {
        return collect(Clock.systemUTC());
    }

    public String os() {
        return osName + " " + osVersion;
    }

    /**
     * Single-line description, suitable for one log line.
     */
    public String description() {
        return "Device: " + device
                + "; OS: " + os()
                + "; Java: " + javaVersion
                + "; App: " + appVersion
                + "; CPU Cores: " + processorCount
                + "; Memory: " + formatBytes(usedMemoryBytes) + "/" + formatBytes(maxMemoryBytes)
                + "; Disk: " + formatBytes(diskAvailableBytes) + "/" + formatBytes(diskTotalBytes);
    }

    static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        int unit = (63 - Long.numberOfLeadingZeros(bytes)) / 10;
        double value = (double) bytes / (1L << (unit * 10));
        return String.format(Locale.ROOT, "%.1f %siB", value, "KMGTPE".charAt(unit - 1));
    }
}

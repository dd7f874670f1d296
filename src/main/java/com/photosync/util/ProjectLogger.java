package com.photosync.util;

import com.photosync.repository.SyncDatabaseManager;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * File logger writing to the .photosync folder of a sync root.
 * Writes are synchronized, the log is rotated once it grows past 5 MB and
 * recurring errors are aggregated into a summary written on {@link #flush()}.
 */
public class ProjectLogger implements SyncLogger {

    private static final Object LOCK = new Object();
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String LOG_FILE_NAME = "sync.log";
    private static final String OLD_LOG_FILE_NAME = "sync.log.old";
    private static final long MAX_LOG_SIZE_BYTES = 5 * 1024 * 1024; // 5 MB

    private final Path logDir;
    private final boolean echoToConsole;

    // ErrorSignature -> Count
    private final Map<String, AtomicInteger> aggregatedErrors = new ConcurrentHashMap<>();

    private volatile boolean dirInitialized;

    public ProjectLogger(Path syncRoot) {
        this(syncRoot, false);
    }

    /**
     * @param syncRoot      The sync root (containing the .photosync folder).
     * @param echoToConsole Whether every line is also printed to stdout.
     */
    public ProjectLogger(Path syncRoot, boolean echoToConsole) {
        this.logDir = syncRoot.resolve(SyncDatabaseManager.DB_FOLDER);
        this.echoToConsole = echoToConsole;
    }

    public Path getLogFile() {
        return logDir.resolve(LOG_FILE_NAME);
    }

    @Override
    public void info(String context, String message) {
        writeLog("INFO", context, message, null);
    }

    @Override
    public void warn(String context, String message) {
        writeLog("WARN", context, message, null);
    }

    @Override
    public void error(String context, String message, Throwable error) {
        writeLog("ERROR", context, message, error);
    }

    @Override
    public void recurringError(String context, String message, Throwable error) {
        String signature = generateErrorSignature(context, message, error);
        AtomicInteger counter = aggregatedErrors.computeIfAbsent(signature, k -> new AtomicInteger(0));

        if (counter.getAndIncrement() == 0) {
            writeLog("ERROR", context, message, error);
        }
    }

    @Override
    public void flush() {
        for (String signature : aggregatedErrors.keySet()) {
            AtomicInteger count = aggregatedErrors.remove(signature);
            if (count != null && count.get() > 1) {
                // The first one was already logged
                int additional = count.get() - 1;
                writeLog("SUMMARY", "ErrorAggregation",
                        String.format("The following error occurred %d additional times: %s", additional, signature), null);
            }
        }
    }

    private static String generateErrorSignature(String context, String message, Throwable error) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(context).append("] ").append(message);
        if (error != null) {
            sb.append(" | ").append(error.getClass().getName());
            if (error.getMessage() != null) {
                sb.append(": ").append(error.getMessage());
            }
        }
        return sb.toString();
    }

    private void writeLog(String level, String context, String message, Throwable error) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(LocalDateTime.now().format(DATE_FORMAT)).append("] ");
        sb.append("[").append(level).append("] ");
        sb.append("[").append(context).append("] ");
        sb.append(message);

        if (error != null) {
            sb.append(System.lineSeparator());
            StringWriter sw = new StringWriter();
            error.printStackTrace(new PrintWriter(sw));
            sb.append(sw);
        }
        sb.append(System.lineSeparator());

        if (echoToConsole) {
            System.out.print(sb);
        }

        synchronized (LOCK) {
            try {
                if (!dirInitialized) {
                    Files.createDirectories(logDir);
                    dirInitialized = true;
                }

                Path logFile = logDir.resolve(LOG_FILE_NAME);
                if (Files.exists(logFile) && Files.size(logFile) > MAX_LOG_SIZE_BYTES) {
                    Files.move(logFile, logDir.resolve(OLD_LOG_FILE_NAME), StandardCopyOption.REPLACE_EXISTING);
                }

                Files.writeString(
                    logFile,
                    sb.toString(),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND,
                    StandardOpenOption.WRITE
                );
            } catch (IOException e) {
                // Fallback to console if file writing fails
                System.err.println("CRITICAL: Unable to write to sync log.");
                e.printStackTrace();
                if (error != null) error.printStackTrace();
            }
        }
    }
}

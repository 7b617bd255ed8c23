package com.tumorboard;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Simple logging utility that writes to the console and, optionally, a file.
 * Log lines go to stderr so that reports printed on stdout stay clean.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;
    private final boolean debugEnabled;

    private static AppLogger instance;

    private AppLogger(Path logFile, boolean consoleEnabled, boolean debugEnabled) throws IOException {
        this.consoleOutput = System.err;
        this.consoleEnabled = consoleEnabled;
        this.debugEnabled = debugEnabled;

        if (logFile != null) {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            // Append mode
            FileOutputStream fos = new FileOutputStream(logFile.toFile(), true);
            this.fileOutput = new PrintStream(fos, true, "UTF-8");

            String separator = "=".repeat(60);
            fileOutput.println();
            fileOutput.println(separator);
            fileOutput.println("TumorBoard started at " + LocalDateTime.now().format(TIME_FORMAT));
            fileOutput.println(separator);
        } else {
            this.fileOutput = null;
        }
    }

    public static synchronized void initialize(Path logFile, boolean consoleEnabled, boolean debugEnabled)
        throws IOException {
        if (instance != null) {
            instance.close();
        }
        instance = new AppLogger(logFile, consoleEnabled, debugEnabled);
    }

    /**
     * Returns the configured logger, or a console-only INFO logger when none was initialized.
     */
    public static synchronized AppLogger get() {
        if (instance == null) {
            try {
                instance = new AppLogger(null, true, false);
            } catch (IOException e) {
                // No file is opened without a path
                throw new IllegalStateException(e);
            }
        }
        return instance;
    }

    public void debug(String message) {
        if (debugEnabled) {
            log("DEBUG", message);
        }
    }

    public void info(String message) {
        log("INFO", message);
    }

    public void warn(String message) {
        log("WARN", message);
    }

    public void error(String message) {
        log("ERROR", message);
    }

    public void error(String message, Throwable t) {
        log("ERROR", message);
        synchronized (this) {
            if (fileOutput != null) {
                t.printStackTrace(fileOutput);
            }
            if (consoleEnabled && debugEnabled) {
                t.printStackTrace(consoleOutput);
            }
        }
    }

    private synchronized void log(String level, String message) {
        String timestamp = LocalDateTime.now().format(TIME_FORMAT);
        String line = String.format("[%s] [%s] %s", timestamp, level, message);

        if (fileOutput != null) {
            fileOutput.println(line);
        }

        if (consoleEnabled) {
            consoleOutput.println(line);
        }
    }

    public void close() {
        if (fileOutput != null) {
            fileOutput.close();
        }
    }
}

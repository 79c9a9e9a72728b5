package com.storyroom;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Process-wide logger writing to the console and an append-only log file.
 * {@link #get()} returns null until {@link #initialize} ran, so library code
 * must cope without it.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static AppLogger instance;

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;

    private AppLogger(Path logFile, boolean consoleEnabled) throws IOException {
        this.consoleOutput = System.out;
        this.consoleEnabled = consoleEnabled;
        this.fileOutput = logFile != null
            ? new PrintStream(new FileOutputStream(logFile.toFile(), true), true, StandardCharsets.UTF_8)
            : null;

        if (fileOutput != null) {
            String separator = "=".repeat(60);
            fileOutput.println();
            fileOutput.println(separator);
            fileOutput.println("Story Room session started at " + LocalDateTime.now().format(TIME_FORMAT));
            fileOutput.println(separator);
        }
    }

    /**
     * @param logFile file to append to, or null for console-only logging
     */
    public static synchronized void initialize(Path logFile, boolean consoleEnabled) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, consoleEnabled);
        }
    }

    public static AppLogger get() {
        return instance;
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
        if (fileOutput != null) {
            t.printStackTrace(fileOutput);
        }
        if (consoleEnabled) {
            t.printStackTrace(consoleOutput);
        }
    }

    private synchronized void log(String level, String message) {
        String line = String.format("[%s] [%s] %s", LocalDateTime.now().format(TIME_FORMAT), level, message);
        if (fileOutput != null) {
            fileOutput.println(line);
        }
        if (consoleEnabled) {
            consoleOutput.println(line);
        }
    }

    /**
     * Untimestamped output for banners; always reaches the console.
     */
    public void console(String message) {
        consoleOutput.println(message);
        if (fileOutput != null) {
            fileOutput.println(message);
        }
    }

    public void close() {
        if (fileOutput != null) {
            fileOutput.close();
        }
    }
}

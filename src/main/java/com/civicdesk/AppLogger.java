package com.civicdesk;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Process-wide logger for Civic Desk. Lines go to the log file and, in dev mode, the console.
 * Until {@link #initialize} runs, {@link #get()} returns null and callers skip logging.
 */
public class AppLogger {

    public enum Level {
        DEBUG, INFO, WARN, ERROR
    }

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static AppLogger instance;

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;
    private final Level minimumLevel;

    AppLogger(Path logFile, PrintStream consoleOutput, boolean consoleEnabled, Level minimumLevel)
            throws IOException {
        this.consoleOutput = consoleOutput;
        this.consoleEnabled = consoleEnabled;
        this.minimumLevel = minimumLevel == null ? Level.INFO : minimumLevel;
        this.fileOutput = new PrintStream(new FileOutputStream(logFile.toFile(), true), true,
            StandardCharsets.UTF_8);

        String separator = "=".repeat(60);
        fileOutput.println();
        fileOutput.println(separator);
        fileOutput.println("Civic Desk session " + LocalDateTime.now().format(TIME_FORMAT)
            + " (level " + this.minimumLevel + ")");
        fileOutput.println(separator);
    }

    /**
     * Dev mode echoes to the console and records DEBUG lines; otherwise only INFO and above reach the file.
     */
    public static synchronized void initialize(Path logFile, boolean devMode) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, System.out, devMode, devMode ? Level.DEBUG : Level.INFO);
        }
    }

    public static synchronized AppLogger get() {
        return instance;
    }

    public boolean isEnabled(Level level) {
        return level.compareTo(minimumLevel) >= 0;
    }

    public Level getMinimumLevel() {
        return minimumLevel;
    }

    public void debug(String message) {
        write(Level.DEBUG, message, null);
    }

    public void info(String message) {
        write(Level.INFO, message, null);
    }

    public void warn(String message) {
        write(Level.WARN, message, null);
    }

    public void error(String message) {
        write(Level.ERROR, message, null);
    }

    public void error(String message, Throwable t) {
        write(Level.ERROR, message, t);
    }

    private synchronized void write(Level level, String message, Throwable t) {
        if (!isEnabled(level)) {
            return;
        }
        String line = "[" + LocalDateTime.now().format(TIME_FORMAT) + "] [" + level + "] " + message;
        fileOutput.println(line);
        if (t != null) {
            t.printStackTrace(fileOutput);
        }
        if (consoleEnabled) {
            consoleOutput.println(line);
            if (t != null) {
                t.printStackTrace(consoleOutput);
            }
        }
    }

    /**
     * Unlevelled output for the startup banner. Always reaches the file.
     */
    public synchronized void console(String message) {
        if (consoleEnabled) {
            consoleOutput.println(message);
        }
        fileOutput.println(message);
    }

    public synchronized void close() {
        fileOutput.close();
    }
}

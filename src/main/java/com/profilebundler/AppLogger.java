package com.profilebundler;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Simple logging utility that writes to the console and, optionally, a log file.
 * Engine classes fetch it with {@link #get()} and stay silent when it was never initialized.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean verbose;

    private static AppLogger instance;

    private AppLogger(Path logFile, PrintStream consoleOutput, boolean verbose) throws IOException {
        this.consoleOutput = consoleOutput;
        this.verbose = verbose;

        if (logFile != null) {
            if (logFile.getParent() != null) {
                Files.createDirectories(logFile.getParent());
            }
            // Append so consecutive runs share one log
            FileOutputStream fos = new FileOutputStream(logFile.toFile(), true);
            this.fileOutput = new PrintStream(fos, true, "UTF-8");

            String separator = "=".repeat(60);
            fileOutput.println();
            fileOutput.println(separator);
            fileOutput.println("Profile Bundler run started at " + LocalDateTime.now().format(TIME_FORMAT));
            fileOutput.println(separator);
        } else {
            this.fileOutput = null;
        }
    }

    public static synchronized void initialize(Path logFile, boolean verbose) throws IOException {
        initialize(logFile, System.out, verbose);
    }

    public static synchronized void initialize(Path logFile, PrintStream console, boolean verbose) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, console, verbose);
        }
    }

    public static AppLogger get() {
        return instance;
    }

    /**
     * Closes and forgets the current instance so a later {@link #initialize} takes effect.
     */
    public static synchronized void reset() {
        if (instance != null) {
            instance.close();
            instance = null;
        }
    }

    public void debug(String message) {
        log("DEBUG", message, verbose);
    }

    public void info(String message) {
        log("INFO", message, true);
    }

    public void warn(String message) {
        log("WARN", message, true);
    }

    public void error(String message) {
        log("ERROR", message, true);
    }

    public void error(String message, Throwable t) {
        log("ERROR", message, true);
        if (fileOutput != null) {
            t.printStackTrace(fileOutput);
        }
        if (verbose && consoleOutput != null) {
            t.printStackTrace(consoleOutput);
        }
    }

    private void log(String level, String message, boolean toConsole) {
        String timestamp = LocalDateTime.now().format(TIME_FORMAT);
        String line = String.format("[%s] [%s] %s", timestamp, level, message);

        if (fileOutput != null) {
            fileOutput.println(line);
        }

        if (toConsole && consoleOutput != null) {
            consoleOutput.println(line);
        }
    }

    /**
     * Print to console (and file) without a timestamp, for summaries and diffs.
     */
    public void console(String message) {
        if (consoleOutput != null) {
            consoleOutput.println(message);
        }
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

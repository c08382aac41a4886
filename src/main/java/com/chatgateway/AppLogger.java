package com.chatgateway;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Gateway log sink: one line per event, mirrored to the log file and (optionally) the console.
 * Components prefix their messages with a bracketed tag, e.g. {@code [AdmissionQueue]}.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;
    private final boolean debugEnabled;

    private static volatile AppLogger instance;

    private AppLogger(Path logFile, boolean consoleEnabled, boolean debugEnabled) throws IOException {
        this.consoleOutput = System.out;
        this.consoleEnabled = consoleEnabled;
        this.debugEnabled = debugEnabled;

        FileOutputStream fos = new FileOutputStream(logFile.toFile(), true);
        this.fileOutput = new PrintStream(fos, true, StandardCharsets.UTF_8);

        String separator = "=".repeat(60);
        fileOutput.println();
        fileOutput.println(separator);
        fileOutput.println("Chat Gateway started at " + LocalDateTime.now().format(TIME_FORMAT));
        fileOutput.println(separator);
    }

    public static synchronized void initialize(Path logFile, boolean consoleEnabled, boolean debugEnabled)
        throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, consoleEnabled, debugEnabled);
        }
    }

    /**
     * May return null when the logger was never initialized (unit tests, embedded use).
     */
    public static AppLogger get() {
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
        t.printStackTrace(fileOutput);
        if (consoleEnabled) {
            t.printStackTrace(consoleOutput);
        }
    }

    private void log(String level, String message) {
        String timestamp = LocalDateTime.now().format(TIME_FORMAT);
        String thread = Thread.currentThread().getName();
        String line = String.format("[%s] [%s] [%s] %s", timestamp, level, thread, message);

        fileOutput.println(line);
        if (consoleEnabled) {
            consoleOutput.println(line);
        }
    }

    /**
     * Console banner output, also copied to the file.
     */
    public void console(String message) {
        if (consoleEnabled) {
            consoleOutput.println(message);
        }
        fileOutput.println(message);
    }

    public void close() {
        fileOutput.close();
    }
}

package com.whereq.evtfilter.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Records job failures without aborting the run.
 * Every report goes to the console logger and is appended as one line to the run's
 * error log, so concurrent workers never interleave partial entries.
 */
@Slf4j
@Service
public class ErrorReporter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss,SSS");

    /**
     * Report an error
     *
     * @param logFile error log destination, or null for console only
     * @param message diagnostic text; line breaks are flattened
     */
    public void report(Path logFile, String message) {
        log.error(message);
        if (logFile == null) {
            return;
        }

        String line = TIMESTAMP.format(LocalDateTime.now()) + " ERROR " + flatten(message) + System.lineSeparator();
        byte[] bytes = line.getBytes(StandardCharsets.UTF_8);

        synchronized (this) {
            try {
                Path parent = logFile.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.write(logFile, bytes, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                log.warn("Could not append to error log {}: {}", logFile, e.getMessage());
            }
        }
    }

    static String flatten(String message) {
        if (message == null) {
            return "";
        }
        return message.strip().replaceAll("\\R+", " | ");
    }
}

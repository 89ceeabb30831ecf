package com.whereq.evtfilter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Parameters of one extraction run, as given on the command line.
 * Null fields fall back to the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionRequest {

    /**
     * Root folder searched recursively for .evt/.evtx files
     */
    private Path directory;

    /**
     * Destination CSV file
     */
    private Path output;

    private LocalDateTime start;

    private LocalDateTime end;

    /**
     * Comma-separated EventIDs to include
     */
    private String includeIds;

    private Path includeIdsFile;

    /**
     * Comma-separated EventIDs to exclude
     */
    private String excludeIds;

    private Path excludeIdsFile;

    private Integer workers;

    private Character placeholder;

    /**
     * Log Parser executable
     */
    private String decoderPath;

    /**
     * Error log; defaults to {@code <output>.log}
     */
    private Path logFile;

    private Boolean sortBySource;

    public Path resolveLogFile() {
        return logFile != null ? logFile : Path.of(output.toString() + ".log");
    }
}

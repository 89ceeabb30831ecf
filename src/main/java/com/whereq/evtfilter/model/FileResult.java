package com.whereq.evtfilter.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of one extraction job. Only {@link JobOutcome#ROWS} carries records.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FileResult {
    /**
     * Original event-log file the records came from
     */
    Path sourceFile;

    JobOutcome outcome;

    List<EventRecord> records;

    /**
     * Error message if failed
     */
    String errorMessage;

    public static FileResult withRecords(Path sourceFile, List<EventRecord> records) {
        if (records.isEmpty()) {
            return empty(sourceFile);
        }
        return new FileResult(sourceFile, JobOutcome.ROWS, List.copyOf(records), null);
    }

    public static FileResult empty(Path sourceFile) {
        return new FileResult(sourceFile, JobOutcome.EMPTY, List.of(), null);
    }

    public static FileResult failed(Path sourceFile, String errorMessage) {
        return new FileResult(sourceFile, JobOutcome.FAILED, List.of(), errorMessage);
    }

    public boolean hasRecords() {
        return outcome.hasRecords();
    }
}

package com.whereq.evtfilter.model;

import lombok.Value;

import java.nio.file.Path;

/**
 * Outcome of a completed run
 */
@Value
public class ExtractionSummary {
    int filesScanned;

    int filesWithEvents;

    long rowsWritten;

    /**
     * Written file, or null when nothing matched
     */
    Path output;

    public boolean hasOutput() {
        return output != null;
    }
}

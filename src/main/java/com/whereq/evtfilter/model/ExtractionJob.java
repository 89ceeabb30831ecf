package com.whereq.evtfilter.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Set;

/**
 * One unit of work: a single event-log file plus the run-wide filter parameters.
 * Created once per discovered file before dispatch.
 */
@Value
@Builder
public class ExtractionJob {
    /**
     * Original (pre-staged) event-log file
     */
    Path sourceFile;

    /**
     * Log Parser executable
     */
    String decoderPath;

    /**
     * Inclusive lower bound on TimeGenerated
     */
    LocalDateTime start;

    /**
     * Inclusive upper bound on TimeGenerated
     */
    LocalDateTime end;

    /**
     * EventIDs to keep; null means no inclusion filter
     */
    Set<Integer> includeIds;

    /**
     * EventIDs to drop; null means no exclusion filter
     */
    Set<Integer> excludeIds;

    @Builder.Default
    char delimiter = ',';

    @Builder.Default
    char placeholder = '§';

    /**
     * Append-only error log shared by all workers
     */
    Path errorLog;
}

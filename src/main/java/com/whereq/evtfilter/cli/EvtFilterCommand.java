package com.whereq.evtfilter.cli;

import com.whereq.evtfilter.exception.RunCancelledException;
import com.whereq.evtfilter.exception.StartupException;
import com.whereq.evtfilter.model.ExtractionRequest;
import com.whereq.evtfilter.model.ExtractionSummary;
import com.whereq.evtfilter.service.ExtractionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.concurrent.Callable;

/**
 * Command line surface: aggregate .evt/.evtx logs into a single CSV.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Command(name = "evtfilter", mixinStandardHelpOptions = true, version = "1.0",
        description = "Aggregate .evt/.evtx logs into a single CSV (time-window + EventID filters).")
public class EvtFilterCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_STARTUP = 1;
    public static final int EXIT_CANCELLED = 130;

    static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ExtractionService extractionService;

    @Option(names = "--dir", required = true, description = "Root folder with .evt/.evtx files (searched recursively).")
    Path directory;

    @Option(names = "--output", required = true, description = "Destination CSV file.")
    Path output;

    @Option(names = "--start-date", required = true, description = "Start datetime 'YYYY-MM-DD HH:MM:SS'")
    String startDate;

    @Option(names = "--end-date", required = true, description = "End datetime 'YYYY-MM-DD HH:MM:SS'")
    String endDate;

    @Option(names = "--event-ids", description = "Comma-separated EventID list to include.")
    String eventIds;

    @Option(names = "--event-ids-file", description = "File with EventID values to include, one per line.")
    Path eventIdsFile;

    @Option(names = "--exclude-event-ids", description = "Comma-separated EventID list to exclude.")
    String excludeEventIds;

    @Option(names = "--exclude-event-ids-file", description = "File with EventID values to exclude, one per line.")
    Path excludeEventIdsFile;

    @Option(names = "--workers", description = "Parallel workers (default: CPU cores - 1).")
    Integer workers;

    @Option(names = "--placeholder-char", description = "Char that replaces commas inside string fields (default '§').")
    Character placeholderChar;

    @Option(names = "--logparser", description = "Path to LogParser.exe.")
    String logparser;

    @Option(names = "--log-file", description = "Write errors here (default <output>.log)")
    Path logFile;

    @Option(names = "--sort-by-source", description = "Order output rows by source file instead of completion order.")
    Boolean sortBySource;

    @Override
    public Integer call() {
        try {
            ExtractionRequest request = ExtractionRequest.builder()
                    .directory(directory)
                    .output(output)
                    .start(parseDate("--start-date", startDate))
                    .end(parseDate("--end-date", endDate))
                    .includeIds(eventIds)
                    .includeIdsFile(eventIdsFile)
                    .excludeIds(excludeEventIds)
                    .excludeIdsFile(excludeEventIdsFile)
                    .workers(workers)
                    .placeholder(placeholderChar)
                    .decoderPath(logparser)
                    .logFile(logFile)
                    .sortBySource(sortBySource)
                    .build();

            ExtractionSummary summary = extractionService.run(request);
            log.debug("Run summary: {}", summary);
            return EXIT_OK;
        } catch (StartupException e) {
            log.error(e.getMessage());
            return EXIT_STARTUP;
        } catch (RunCancelledException e) {
            log.warn(e.getMessage());
            return EXIT_CANCELLED;
        } catch (Exception e) {
            log.error("Run failed: {}", e.getMessage(), e);
            return EXIT_STARTUP;
        }
    }

    static LocalDateTime parseDate(String option, String value) {
        try {
            return LocalDateTime.parse(value.strip(), DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new StartupException("Invalid " + option + " '" + value + "', expected YYYY-MM-DD HH:MM:SS", e);
        }
    }
}

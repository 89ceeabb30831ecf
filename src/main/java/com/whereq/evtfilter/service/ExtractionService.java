package com.whereq.evtfilter.service;

import com.whereq.evtfilter.config.EvtFilterProperties;
import com.whereq.evtfilter.discovery.EventLogDiscovery;
import com.whereq.evtfilter.exception.StartupException;
import com.whereq.evtfilter.executor.DecoderInvoker;
import com.whereq.evtfilter.filter.EventIdFilterLoader;
import com.whereq.evtfilter.model.EventTable;
import com.whereq.evtfilter.model.ExtractionJob;
import com.whereq.evtfilter.model.ExtractionRequest;
import com.whereq.evtfilter.model.ExtractionSummary;
import com.whereq.evtfilter.model.FileResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs a full extraction: discovery, dispatch, aggregation, write.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExtractionService {

    private final EvtFilterProperties properties;

    private final EventLogDiscovery discovery;

    private final EventIdFilterLoader filterLoader;

    private final DecoderInvoker decoderInvoker;

    private final JobDispatcher dispatcher;

    private final ResultAggregator aggregator;

    private final RunCancellation cancellation;

    /**
     * Execute a run.
     *
     * @param request run parameters
     * @return summary; {@link ExtractionSummary#getOutput()} is null when nothing matched
     * @throws StartupException if the arguments are invalid or no event logs exist
     */
    public ExtractionSummary run(ExtractionRequest request) throws IOException {
        try {
            return execute(request);
        } finally {
            cancellation.markFinished();
        }
    }

    private ExtractionSummary execute(ExtractionRequest request) throws IOException {
        validate(request);
        Path errorLog = request.resolveLogFile();

        Optional<Set<Integer>> include = filterLoader.load(request.getIncludeIds(), request.getIncludeIdsFile());
        Optional<Set<Integer>> exclude = filterLoader.load(request.getExcludeIds(), request.getExcludeIdsFile());

        List<Path> files = discovery.discover(request.getDirectory(), errorLog);
        if (files.isEmpty()) {
            throw new StartupException("No .evt/.evtx files under " + request.getDirectory());
        }
        log.info("Scanning {} files …", files.size());

        String decoder = decoderInvoker.resolveExecutable(
                request.getDecoderPath() != null ? request.getDecoderPath() : properties.getDecoder().getPath());
        char delimiter = properties.getOutput().getDelimiter();
        char placeholder = request.getPlaceholder() != null
                ? request.getPlaceholder()
                : properties.getOutput().getPlaceholder();
        if (placeholder == delimiter) {
            throw new StartupException("Placeholder character must differ from the delimiter '" + delimiter + "'");
        }

        List<ExtractionJob> jobs = new ArrayList<>(files.size());
        for (Path file : files) {
            jobs.add(ExtractionJob.builder()
                    .sourceFile(file)
                    .decoderPath(decoder)
                    .start(request.getStart())
                    .end(request.getEnd())
                    .includeIds(include.orElse(null))
                    .excludeIds(exclude.orElse(null))
                    .delimiter(delimiter)
                    .placeholder(placeholder)
                    .errorLog(errorLog)
                    .build());
        }

        List<FileResult> results = dispatcher.dispatch(jobs, properties.resolveWorkers(request.getWorkers()));

        boolean sort = request.getSortBySource() != null
                ? request.getSortBySource()
                : properties.getOutput().isSortBySource();
        Optional<EventTable> table = aggregator.merge(results, sort);
        if (table.isEmpty()) {
            log.warn("No matching events found.");
            return new ExtractionSummary(files.size(), 0, 0, null);
        }

        aggregator.write(table.get(), request.getOutput(), delimiter);
        return new ExtractionSummary(files.size(), results.size(), table.get().size(), request.getOutput());
    }

    private void validate(ExtractionRequest request) {
        if (request.getDirectory() == null) {
            throw new StartupException("Input directory is required");
        }
        if (request.getOutput() == null) {
            throw new StartupException("Output file is required");
        }
        if (request.getStart() == null || request.getEnd() == null) {
            throw new StartupException("Start and end of the time window are required");
        }
        if (request.getStart().isAfter(request.getEnd())) {
            throw new StartupException("Start " + request.getStart() + " is after end " + request.getEnd());
        }
    }
}

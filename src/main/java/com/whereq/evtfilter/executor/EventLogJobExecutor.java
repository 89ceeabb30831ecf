package com.whereq.evtfilter.executor;

import com.whereq.evtfilter.model.DecoderRun;
import com.whereq.evtfilter.model.EventRecord;
import com.whereq.evtfilter.model.ExtractionJob;
import com.whereq.evtfilter.model.FileResult;
import com.whereq.evtfilter.model.ParsedRows;
import com.whereq.evtfilter.model.StagedFile;
import com.whereq.evtfilter.reader.DecoderOutputReader;
import com.whereq.evtfilter.service.ErrorReporter;
import com.whereq.evtfilter.service.RecordFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Extracts one event log: stage, run Log Parser, read the XML, filter.
 * Failures are reported and returned as FAILED results; the staging directory is
 * removed on every path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventLogJobExecutor implements JobExecutor {

    static final String OUTPUT_FILE = "lp.xml";

    private final StagingArea stagingArea;

    private final DecoderInvoker decoderInvoker;

    private final DecoderOutputReader outputReader;

    private final RecordFilter recordFilter;

    private final ErrorReporter errorReporter;

    @Override
    public FileResult executeJob(ExtractionJob job) throws InterruptedException {
        Path source = job.getSourceFile();
        log.debug("Processing {}", source);

        try (StagedFile staged = stagingArea.stage(source)) {
            Path xml = staged.resolve(OUTPUT_FILE);

            DecoderRun run = decoderInvoker.invoke(job.getDecoderPath(), staged.getPath(), xml);
            if (!run.succeeded()) {
                String message = "LogParser failed (" + run.getExitCode() + ") on " + source
                        + ":\nSTDERR: " + run.getStderr() + "\nSTDOUT: " + run.getStdout();
                errorReporter.report(job.getErrorLog(), message);
                return FileResult.failed(source, message);
            }

            if (!Files.isRegularFile(xml) || Files.size(xml) == 0) {
                log.info("{}: log contained 0 events", source);
                return FileResult.empty(source);
            }

            Optional<ParsedRows> rows = outputReader.read(xml);
            if (rows.isEmpty() || rows.get().isEmpty()) {
                log.info("{}: no events in selected time-window", source);
                return FileResult.empty(source);
            }

            List<EventRecord> records = recordFilter.apply(rows.get(), job);
            if (records.isEmpty()) {
                log.info("{}: no events in selected time-window", source);
                return FileResult.empty(source);
            }

            log.debug("{}: {} of {} events kept", source, records.size(), rows.get().size());
            return FileResult.withRecords(source, records);

        } catch (InterruptedException e) {
            log.info("{}: abandoned on cancellation", source);
            throw e;
        } catch (Exception e) {
            String message = "Exception processing " + source + ": " + e;
            errorReporter.report(job.getErrorLog(), message);
            return FileResult.failed(source, message);
        }
    }
}

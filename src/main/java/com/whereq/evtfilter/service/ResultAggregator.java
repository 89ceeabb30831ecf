package com.whereq.evtfilter.service;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.whereq.evtfilter.exception.RunCancelledException;
import com.whereq.evtfilter.model.EventRecord;
import com.whereq.evtfilter.model.EventTable;
import com.whereq.evtfilter.model.FileResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Merges per-file results into one table and writes it as delimited text.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResultAggregator {

    static final String PART_SUFFIX = ".part";

    private final RunCancellation cancellation;

    // quote only values holding the delimiter, a quote or a line break
    private final CsvMapper csvMapper = new CsvMapper().enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);

    /**
     * Concatenate all records under the union schema.
     *
     * @param results per-file results, in completion order
     * @param sortBySource stably sort rows by source file
     * @return the merged table, or empty when no result carries records
     */
    public Optional<EventTable> merge(List<FileResult> results, boolean sortBySource) {
        List<FileResult> contributing = new ArrayList<>();
        for (FileResult result : results) {
            if (result.hasRecords()) {
                contributing.add(result);
            }
        }
        if (contributing.isEmpty()) {
            return Optional.empty();
        }

        if (sortBySource) {
            contributing.sort(Comparator.comparing(result -> result.getSourceFile().toString()));
        }

        List<EventRecord> rows = new ArrayList<>();
        List<List<String>> schemas = new ArrayList<>();
        for (FileResult result : contributing) {
            rows.addAll(result.getRecords());
            Set<String> fileColumns = new LinkedHashSet<>();
            for (EventRecord record : result.getRecords()) {
                fileColumns.addAll(record.columns());
            }
            schemas.add(List.copyOf(fileColumns));
        }

        return Optional.of(new EventTable(unionSchema(schemas), rows));
    }

    /**
     * Union of column lists in first-seen order with SourceFile moved last.
     */
    public static List<String> unionSchema(List<List<String>> schemas) {
        Set<String> union = new LinkedHashSet<>();
        for (List<String> schema : schemas) {
            union.addAll(schema);
        }
        union.remove(EventTable.SOURCE_FILE);

        List<String> columns = new ArrayList<>(union);
        columns.add(EventTable.SOURCE_FILE);
        return columns;
    }

    /**
     * Write the table to {@code output}. The file appears only once fully written.
     *
     * @throws RunCancelledException if the run is cancelled while writing
     */
    public void write(EventTable table, Path output, char delimiter) throws IOException {
        if (cancellation.isCancelled()) {
            throw new RunCancelledException("Run cancelled before output was written");
        }

        CsvSchema.Builder builder = CsvSchema.builder()
                .setUseHeader(true)
                .setColumnSeparator(delimiter);
        for (String column : table.getColumns()) {
            builder.addColumn(column);
        }
        CsvSchema schema = builder.build();

        Path absolute = output.toAbsolutePath();
        if (absolute.getParent() != null) {
            Files.createDirectories(absolute.getParent());
        }
        Path part = absolute.resolveSibling(absolute.getFileName() + PART_SUFFIX);

        boolean moved = false;
        try {
            try (Writer writer = Files.newBufferedWriter(part, StandardCharsets.UTF_8);
                 SequenceWriter rows = csvMapper.writer(schema).writeValues(writer)) {
                for (EventRecord record : table.getRows()) {
                    if (cancellation.isCancelled()) {
                        throw new RunCancelledException("Run cancelled while writing " + output);
                    }
                    rows.write(toRow(record, table.getColumns()));
                }
            }
            moveIntoPlace(part, absolute);
            moved = true;
        } finally {
            if (!moved) {
                Files.deleteIfExists(part);
            }
        }

        log.info("Done. {} rows → {}", table.size(), output);
    }

    private Map<String, String> toRow(EventRecord record, List<String> columns) {
        Map<String, String> row = new LinkedHashMap<>();
        for (String column : columns) {
            Object value = record.get(column);
            row.put(column, value != null ? value.toString() : "");
        }
        return row;
    }

    private void moveIntoPlace(Path part, Path output) throws IOException {
        try {
            Files.move(part, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(part, output, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}

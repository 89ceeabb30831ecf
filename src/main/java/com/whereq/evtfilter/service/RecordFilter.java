package com.whereq.evtfilter.service;

import com.whereq.evtfilter.model.EventRecord;
import com.whereq.evtfilter.model.EventTable;
import com.whereq.evtfilter.model.ExtractionJob;
import com.whereq.evtfilter.model.ParsedRows;
import com.whereq.evtfilter.reader.LenientDecoding;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies the time window and EventID filters to decoded rows and turns every
 * surviving value into delimiter-safe text.
 *
 * @author WhereQ Inc.
 */
@Component
public class RecordFilter {

    public static final String TIME_GENERATED = "TimeGenerated";
    public static final String EVENT_ID = "EventID";

    static final DateTimeFormatter OUTPUT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final DateTimeFormatter INPUT_TIMESTAMP = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd")
            .optionalStart().appendLiteral(' ').optionalEnd()
            .optionalStart().appendLiteral('T').optionalEnd()
            .appendPattern("HH:mm:ss")
            .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true).optionalEnd()
            .toFormatter();

    /**
     * Filter and normalize one file's rows.
     *
     * @param rows decoded rows
     * @param job filter parameters and source file
     * @return surviving records, normalized, with SourceFile appended
     */
    public List<EventRecord> apply(ParsedRows rows, ExtractionJob job) {
        boolean hasTime = rows.hasColumn(TIME_GENERATED);
        boolean hasEventId = rows.hasColumn(EVENT_ID);
        String source = job.getSourceFile().toString();

        List<EventRecord> result = new ArrayList<>();
        for (EventRecord record : rows.getRecords()) {
            LocalDateTime generated = null;
            if (hasTime) {
                generated = parseTimestamp(record.get(TIME_GENERATED));
                if (!inWindow(generated, job.getStart(), job.getEnd())) {
                    continue;
                }
            }
            if (hasEventId && !passesEventId(record.get(EVENT_ID), job.getIncludeIds(), job.getExcludeIds())) {
                continue;
            }

            EventRecord normalized = new EventRecord();
            for (Map.Entry<String, Object> entry : record.asMap().entrySet()) {
                Object value = TIME_GENERATED.equals(entry.getKey()) && hasTime ? generated : entry.getValue();
                normalized.put(entry.getKey(), normalize(value, job.getDelimiter(), job.getPlaceholder()));
            }
            normalized.put(EventTable.SOURCE_FILE, source);
            result.add(normalized);
        }
        return result;
    }

    /**
     * Coerce a TimeGenerated value; anything unparsable becomes null.
     */
    static LocalDateTime parseTimestamp(Object value) {
        if (value instanceof LocalDateTime timestamp) {
            return timestamp;
        }
        if (value == null) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.toString().strip(), INPUT_TIMESTAMP);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static boolean inWindow(LocalDateTime value, LocalDateTime start, LocalDateTime end) {
        return value != null && !value.isBefore(start) && !value.isAfter(end);
    }

    static boolean passesEventId(Object value, Set<Integer> include, Set<Integer> exclude) {
        Integer id = toEventId(value);
        if (include != null && (id == null || !include.contains(id))) {
            return false;
        }
        return exclude == null || id == null || !exclude.contains(id);
    }

    private static Integer toEventId(Object value) {
        if (value instanceof Number number) {
            long id = number.longValue();
            return id >= Integer.MIN_VALUE && id <= Integer.MAX_VALUE ? (int) id : null;
        }
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.toString().strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Render one value as text with the delimiter replaced by the placeholder.
     */
    static String normalize(Object value, char delimiter, char placeholder) {
        String text;
        if (value == null) {
            text = "";
        } else if (value instanceof byte[] bytes) {
            text = LenientDecoding.decode(bytes, StandardCharsets.UTF_16LE);
        } else if (value instanceof LocalDateTime timestamp) {
            text = OUTPUT_TIMESTAMP.format(timestamp);
        } else {
            text = value.toString();
        }
        return text.replace(delimiter, placeholder);
    }
}

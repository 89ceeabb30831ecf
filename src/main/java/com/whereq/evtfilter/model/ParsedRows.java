package com.whereq.evtfilter.model;

import lombok.Value;

import java.util.List;

/**
 * Rows read from one Log Parser XML document, before filtering.
 */
@Value
public class ParsedRows {
    /**
     * Column names in first-seen order
     */
    List<String> columns;

    List<EventRecord> records;

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}

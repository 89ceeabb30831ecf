package com.whereq.evtfilter.model;

import lombok.Value;

import java.util.List;

/**
 * All surviving records of a run under one merged schema.
 */
@Value
public class EventTable {
    public static final String SOURCE_FILE = "SourceFile";

    /**
     * Union of per-file columns in first-seen order, SourceFile last
     */
    List<String> columns;

    List<EventRecord> rows;

    public int size() {
        return rows.size();
    }
}

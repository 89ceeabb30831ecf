package com.whereq.evtfilter.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A single event row: column name to value, in column order.
 * Values are {@link java.time.LocalDateTime}, {@link Long}, {@link String} or raw
 * {@code byte[]} until normalized, and {@link String} afterwards.
 */
@ToString
@EqualsAndHashCode
public class EventRecord {

    private final LinkedHashMap<String, Object> values;

    public EventRecord() {
        this.values = new LinkedHashMap<>();
    }

    public EventRecord(Map<String, Object> values) {
        this.values = new LinkedHashMap<>(values);
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public EventRecord put(String column, Object value) {
        values.put(column, value);
        return this;
    }

    public Set<String> columns() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }
}

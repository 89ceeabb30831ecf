package com.whereq.evtfilter.model;

/**
 * Final state of one extraction job
 */
public enum JobOutcome {
    /**
     * At least one record survived filtering
     */
    ROWS,

    /**
     * Decoder produced nothing, or no record survived filtering
     */
    EMPTY,

    /**
     * Decoder exited non-zero or a step threw
     */
    FAILED;

    public boolean hasRecords() {
        return this == ROWS;
    }
}

package com.whereq.evtfilter.executor;

import com.whereq.evtfilter.model.ExtractionJob;
import com.whereq.evtfilter.model.FileResult;

/**
 * Interface for per-file extraction strategies
 */
public interface JobExecutor {
    /**
     * Execute a job synchronously (blocking).
     * Implementations report their own failures and return a FAILED result.
     *
     * @param job the extraction job
     * @return job result
     * @throws InterruptedException if the worker is interrupted while waiting on the decoder
     */
    FileResult executeJob(ExtractionJob job) throws InterruptedException;
}

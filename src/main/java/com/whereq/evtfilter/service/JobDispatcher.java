package com.whereq.evtfilter.service;

import com.whereq.evtfilter.exception.RunCancelledException;
import com.whereq.evtfilter.executor.JobExecutor;
import com.whereq.evtfilter.model.ExtractionJob;
import com.whereq.evtfilter.model.FileResult;
import com.whereq.evtfilter.model.JobOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one extraction job per file on a bounded worker pool.
 *
 * <p>Each job blocks its worker for staging, the Log Parser process and XML decoding,
 * so the pool size caps the number of concurrent decoder processes. A job that throws
 * is reported and counted as failed; the remaining jobs keep running.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobDispatcher {

    private final JobExecutor jobExecutor;

    private final ErrorReporter errorReporter;

    private final RunCancellation cancellation;

    private final MeterRegistry meterRegistry;

    private Counter successCounter;
    private Counter emptyCounter;
    private Counter failureCounter;
    private Timer executionTimer;

    @PostConstruct
    public void initialize() {
        // Register metrics
        successCounter = Counter.builder("evtfilter.jobs.succeeded")
            .description("Number of files that produced matching events")
            .register(meterRegistry);

        emptyCounter = Counter.builder("evtfilter.jobs.empty")
            .description("Number of files with no matching events")
            .register(meterRegistry);

        failureCounter = Counter.builder("evtfilter.jobs.failed")
            .description("Number of files that failed to extract")
            .register(meterRegistry);

        executionTimer = Timer.builder("evtfilter.jobs.execution.time")
            .description("Per-file extraction time")
            .register(meterRegistry);
    }

    /**
     * Execute all jobs and collect the results that carry records.
     *
     * @param jobs one job per event log
     * @param workers maximum number of jobs running at once
     * @return non-empty results in completion order
     * @throws RunCancelledException if the run was cancelled before all jobs finished
     */
    public List<FileResult> dispatch(List<ExtractionJob> jobs, int workers) {
        int poolSize = Math.max(1, workers);
        log.info("Dispatching {} jobs on {} workers", jobs.size(), poolSize);

        Map<JobOutcome, AtomicInteger> tally = new EnumMap<>(JobOutcome.class);
        for (JobOutcome outcome : JobOutcome.values()) {
            tally.put(outcome, new AtomicInteger());
        }

        Scheduler scheduler = Schedulers.newBoundedElastic(poolSize, Integer.MAX_VALUE, "evtfilter-worker");
        try {
            List<FileResult> results = Flux.fromIterable(jobs)
                .flatMap(job -> executeJob(job).subscribeOn(scheduler), poolSize)
                .takeUntilOther(cancellation.asMono())
                .doOnNext(result -> {
                    tally.get(result.getOutcome()).incrementAndGet();
                    record(result);
                })
                .filter(FileResult::hasRecords)
                .collectList()
                .block();

            if (cancellation.isCancelled()) {
                throw new RunCancelledException("Run cancelled before all jobs completed");
            }

            log.info("Jobs finished: {} with events, {} empty, {} failed",
                tally.get(JobOutcome.ROWS), tally.get(JobOutcome.EMPTY), tally.get(JobOutcome.FAILED));
            return results != null ? results : List.of();
        } finally {
            scheduler.dispose();
        }
    }

    /**
     * Execute a single job, containing any failure
     */
    private Mono<FileResult> executeJob(ExtractionJob job) {
        return Mono.fromCallable(() -> {
            long startTime = System.nanoTime();
            try {
                return jobExecutor.executeJob(job);
            } finally {
                executionTimer.record(Duration.ofNanos(System.nanoTime() - startTime));
            }
        })
        .onErrorResume(e -> {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                return Mono.empty();
            }
            String message = "Worker crashed on " + job.getSourceFile() + ": " + e;
            errorReporter.report(job.getErrorLog(), message);
            return Mono.just(FileResult.failed(job.getSourceFile(), message));
        });
    }

    private void record(FileResult result) {
        Counter counter = switch (result.getOutcome()) {
            case ROWS -> successCounter;
            case EMPTY -> emptyCounter;
            case FAILED -> failureCounter;
        };
        counter.increment();
    }
}

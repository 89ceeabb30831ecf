package com.whereq.evtfilter.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal for the current run.
 * Fired explicitly or when the application context shuts down (Ctrl-C runs the
 * JVM shutdown hook, which closes the context).
 */
@Slf4j
@Component
public class RunCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private final AtomicBoolean finished = new AtomicBoolean(false);

    private final Sinks.Empty<Void> signal = Sinks.empty();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("Cancellation requested, abandoning in-flight jobs");
            signal.tryEmitEmpty();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Completes when the run is cancelled
     */
    public Mono<Void> asMono() {
        return signal.asMono();
    }

    /**
     * Mark the run complete so a later context shutdown is not treated as an abort
     */
    public void markFinished() {
        finished.set(true);
    }

    @PreDestroy
    public void onShutdown() {
        if (!finished.get()) {
            cancel();
        }
    }
}

package com.batchpredict.worker.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Pipeline counters. Uses a lazy, thread-safe holder: the registry is created via CAS on first use
 * and reused for the life of the process.
 */
public final class PredictionMetrics {

    private static final AtomicReference<MeterRegistry> REGISTRY = new AtomicReference<>();

    private PredictionMetrics() {
    }

    public static MeterRegistry getRegistry() {
        MeterRegistry existing = REGISTRY.get();
        if (existing != null) {
            return existing;
        }
        MeterRegistry created = new SimpleMeterRegistry();
        if (REGISTRY.compareAndSet(null, created)) {
            return created;
        }
        return REGISTRY.get();
    }

    public static void queryCompleted(int statusCode, int records) {
        MeterRegistry registry = getRegistry();
        registry.counter("bp.query.runs", "status", String.valueOf(statusCode)).increment();
        registry.counter("bp.query.records").increment(records);
    }

    /** @param outcome accepted, no_records, or the failure type */
    public static void dispatchCompleted(String outcome) {
        getRegistry().counter("bp.dispatch.outcomes", "outcome", outcome).increment();
    }

    /** @param outcome the reported job status, or the failure type when results could not be processed */
    public static void completionHandled(String outcome) {
        getRegistry().counter("bp.completion.outcomes", "outcome", outcome).increment();
    }

    public static void resumptionRejected() {
        getRegistry().counter("bp.resumption.rejected").increment();
    }

    public static void rowsWritten(int total, int updated) {
        MeterRegistry registry = getRegistry();
        registry.counter("bp.write.rows", "result", "updated").increment(updated);
        registry.counter("bp.write.rows", "result", "skipped").increment(Math.max(0, total - updated));
    }
}

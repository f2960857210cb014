package com.iksanov.surveyshield.node.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics for delayed submission: queueing, flush cycles and leader transfers.
 * Aggregate counts only, no per-survey or per-response labels.
 */
public class SubmissionMetrics {

    private final PrometheusMeterRegistry registry;
    private final Counter responsesQueued;
    private final Counter responsesPersisted;
    private final Counter flushCycles;
    private final Counter emptyFlushCycles;
    private final Counter persistenceFailures;
    private final Counter anonymizationFailures;
    private final Counter transfersSucceeded;
    private final Counter transfersFailed;
    private final Counter transfersReceived;
    private final Timer flushDuration;
    private final AtomicInteger pending = new AtomicInteger(0);
    private final AtomicInteger currentPercentage = new AtomicInteger(0);

    public SubmissionMetrics() {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public SubmissionMetrics(PrometheusMeterRegistry registry) {
        this.registry = registry;

        this.responsesQueued = Counter.builder("dss.responses.queued.total")
                .description("Responses accepted into the leader's pending queue")
                .register(registry);

        this.responsesPersisted = Counter.builder("dss.responses.persisted.total")
                .description("Responses durably persisted by flush cycles or administrative flushes")
                .register(registry);

        this.flushCycles = Counter.builder("dss.flush.cycles.total")
                .description("Scheduler flush cycles executed")
                .register(registry);

        this.emptyFlushCycles = Counter.builder("dss.flush.cycles.empty.total")
                .description("Flush cycles in which no survey was above its threshold")
                .register(registry);

        this.persistenceFailures = Counter.builder("dss.persistence.failures.total")
                .description("Flushes whose persistence failed and were returned to the queue")
                .register(registry);

        this.anonymizationFailures = Counter.builder("dss.anonymization.failures.total")
                .description("Free-text anonymization attempts that failed")
                .register(registry);

        this.transfersSucceeded = Counter.builder("dss.transfers.succeeded.total")
                .description("Batches successfully forwarded to the leader")
                .register(registry);

        this.transfersFailed = Counter.builder("dss.transfers.failed.total")
                .description("Batches that could not be forwarded and were retained locally")
                .register(registry);

        this.transfersReceived = Counter.builder("dss.transfers.received.total")
                .description("Batches received from followers")
                .register(registry);

        this.flushDuration = Timer.builder("dss.flush.duration")
                .description("Time spent anonymizing and persisting a flushed selection")
                .register(registry);

        Gauge.builder("dss.pending", pending, AtomicInteger::get)
                .description("Responses currently held in memory")
                .register(registry);

        Gauge.builder("dss.percentage.current", currentPercentage, AtomicInteger::get)
                .description("Current flush percentage")
                .register(registry);
    }

    public void recordQueued(int count) {
        responsesQueued.increment(count);
    }

    public void recordPersisted(int count) {
        responsesPersisted.increment(count);
    }

    public void recordFlushCycle(boolean empty) {
        flushCycles.increment();
        if (empty) emptyFlushCycles.increment();
    }

    public void recordPersistenceFailure() {
        persistenceFailures.increment();
    }

    public void recordAnonymizationFailure() {
        anonymizationFailures.increment();
    }

    public void recordTransfer(boolean success) {
        if (success) transfersSucceeded.increment();
        else transfersFailed.increment();
    }

    public void recordTransferReceived() {
        transfersReceived.increment();
    }

    public void updatePending(int value) {
        pending.set(value);
    }

    public void updatePercentage(int value) {
        currentPercentage.set(value);
    }

    public Timer.Sample startFlushTimer() {
        return Timer.start(registry);
    }

    public void stopFlushTimer(Timer.Sample sample) {
        sample.stop(flushDuration);
    }

    public String scrape() {
        return registry.scrape();
    }

    public PrometheusMeterRegistry getRegistry() {
        return registry;
    }
}

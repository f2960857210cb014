package com.iksanov.surveyshield.node.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics for the lease-based leader election.
 */
public class ElectionMetrics {

    private final PrometheusMeterRegistry registry;
    private final Counter checks;
    private final Counter checkFailures;
    private final Counter promotions;
    private final Counter demotions;
    private final AtomicInteger leader = new AtomicInteger(0);

    public ElectionMetrics() {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public ElectionMetrics(PrometheusMeterRegistry registry) {
        this.registry = registry;

        this.checks = Counter.builder("election.checks.total")
                .description("Total number of leadership checks against the lease store")
                .register(registry);

        this.checkFailures = Counter.builder("election.check.failures.total")
                .description("Leadership checks that failed because the lease store was unreachable")
                .register(registry);

        this.promotions = Counter.builder("election.promotions.total")
                .description("Number of times this instance became leader")
                .register(registry);

        this.demotions = Counter.builder("election.demotions.total")
                .description("Number of times this instance lost leadership")
                .register(registry);

        Gauge.builder("election.leader", leader, AtomicInteger::get)
                .description("1 if this instance currently holds leadership, 0 otherwise")
                .register(registry);
    }

    public void recordCheck() {
        checks.increment();
    }

    public void recordCheckFailure() {
        checkFailures.increment();
    }

    public void recordLeadership(boolean isLeader) {
        leader.set(isLeader ? 1 : 0);
        if (isLeader) promotions.increment();
        else demotions.increment();
    }

    public String scrape() {
        return registry.scrape();
    }

    public PrometheusMeterRegistry getRegistry() {
        return registry;
    }
}

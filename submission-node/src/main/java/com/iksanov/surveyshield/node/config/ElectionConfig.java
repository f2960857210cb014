package com.iksanov.surveyshield.node.config;

import com.iksanov.surveyshield.common.exception.ConfigurationException;

import java.time.Duration;
import java.util.Map;

public record ElectionConfig(
        boolean scaleOut,
        Duration leaseTimeout,
        Duration checkInterval,
        Duration initialBackoff
) {
    public ElectionConfig {
        if (leaseTimeout == null || checkInterval == null || initialBackoff == null)
            throw new IllegalArgumentException("Election timings cannot be null");
        if (checkInterval.isZero() || checkInterval.isNegative()) throw new IllegalArgumentException("checkInterval must be > 0");
        if (initialBackoff.isZero() || initialBackoff.isNegative()) throw new IllegalArgumentException("initialBackoff must be > 0");
        if (checkInterval.compareTo(leaseTimeout) >= 0)
            throw new IllegalArgumentException("checkInterval must be shorter than leaseTimeout");
    }

    public static ElectionConfig singleInstance() {
        return new ElectionConfig(false, Duration.ofMinutes(2), Duration.ofSeconds(30), Duration.ofSeconds(1));
    }

    public static ElectionConfig fromEnv() {
        return from(System.getenv());
    }

    public static ElectionConfig from(Map<String, String> env) {
        EnvVars vars = new EnvVars(env);
        try {
            return new ElectionConfig(
                    vars.getBool("SHIELD_SCALE_OUT", false),
                    Duration.ofMillis(vars.getLong("ELECTION_LEASE_TIMEOUT_MS", 120_000)),
                    Duration.ofMillis(vars.getLong("ELECTION_CHECK_INTERVAL_MS", 30_000)),
                    Duration.ofMillis(vars.getLong("ELECTION_INITIAL_BACKOFF_MS", 1_000))
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid election configuration: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return String.format("ElectionConfig[scaleOut=%s, lease=%dms, check=%dms, backoff=%dms]",
                scaleOut, leaseTimeout.toMillis(), checkInterval.toMillis(), initialBackoff.toMillis());
    }
}

package com.iksanov.surveyshield.node.config;

import com.iksanov.surveyshield.common.exception.ConfigurationException;

import java.time.Duration;
import java.util.Map;

/**
 * Tuning of the delayed submission scheduler.
 *
 * @param minPercentage            lower bound of the flush percentage, also the reset value
 * @param maxPercentage            upper bound of the flush percentage
 * @param percentageIncrement      step applied after every non-empty flush that is not reset
 * @param resetChancePercentage    probability (0-100) that a non-empty flush resets the percentage
 * @param minimumSurveySubmissions per-question floor; a survey never flushes while its pending count is at or below
 *                                 {@code questionCount * minimumSurveySubmissions}
 * @param coldDelayMin             start of the window used when arming from idle
 * @param coldDelayMax             end of the window used when arming from idle
 * @param warmDelayMin             start of the window used when re-arming after a flush
 * @param warmDelayMax             end of the window used when re-arming after a flush
 * @param forceFlushEnabled        enables the debug-only force flush of every pending response
 */
public record DssConfig(
        int minPercentage,
        int maxPercentage,
        int percentageIncrement,
        int resetChancePercentage,
        int minimumSurveySubmissions,
        Duration coldDelayMin,
        Duration coldDelayMax,
        Duration warmDelayMin,
        Duration warmDelayMax,
        boolean forceFlushEnabled
) {
    public DssConfig {
        if (minPercentage < 1 || maxPercentage > 100 || minPercentage > maxPercentage)
            throw new IllegalArgumentException(String.format("Invalid percentage bounds: min=%d max=%d", minPercentage, maxPercentage));
        if (percentageIncrement < 0) throw new IllegalArgumentException("percentageIncrement must be >= 0");
        if (resetChancePercentage < 0 || resetChancePercentage > 100)
            throw new IllegalArgumentException("resetChancePercentage must be between 0 and 100");
        if (minimumSurveySubmissions < 0) throw new IllegalArgumentException("minimumSurveySubmissions must be >= 0");
        validateWindow("cold", coldDelayMin, coldDelayMax);
        validateWindow("warm", warmDelayMin, warmDelayMax);
    }

    public static DssConfig defaults() {
        return new DssConfig(30, 70, 2, 5, 3,
                Duration.ofMinutes(15), Duration.ofMinutes(59),
                Duration.ofSeconds(30), Duration.ofSeconds(90),
                false);
    }

    public static DssConfig fromEnv() {
        return from(System.getenv());
    }

    public static DssConfig from(Map<String, String> env) {
        EnvVars vars = new EnvVars(env);
        try {
            return new DssConfig(
                    vars.getInt("DSS_MIN_PERCENTAGE", 30),
                    vars.getInt("DSS_MAX_PERCENTAGE", 70),
                    vars.getInt("DSS_PERCENTAGE_INCREMENT", 2),
                    vars.getInt("DSS_RESET_CHANCE_PERCENTAGE", 5),
                    vars.getInt("DSS_MINIMUM_SURVEY_SUBMISSIONS", 3),
                    Duration.ofMinutes(vars.getLong("DSS_COLD_DELAY_MIN_MINUTES", 15)),
                    Duration.ofMinutes(vars.getLong("DSS_COLD_DELAY_MAX_MINUTES", 59)),
                    Duration.ofSeconds(vars.getLong("DSS_WARM_DELAY_MIN_SECONDS", 30)),
                    Duration.ofSeconds(vars.getLong("DSS_WARM_DELAY_MAX_SECONDS", 90)),
                    vars.getBool("DSS_FORCE_FLUSH_ENABLED", false)
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid delayed submission configuration: " + e.getMessage(), e);
        }
    }

    private static void validateWindow(String name, Duration min, Duration max) {
        if (min == null || max == null) throw new IllegalArgumentException(name + " delay window cannot be null");
        if (min.isNegative() || min.isZero()) throw new IllegalArgumentException(name + " delay window must start above zero");
        if (max.compareTo(min) <= 0) throw new IllegalArgumentException(name + " delay window max must be > min");
    }

    @Override
    public String toString() {
        return String.format("DssConfig[percentage=%d-%d%% (+%d, reset %d%%), minSubmissions=%d, cold=%s-%s, warm=%s-%s, forceFlush=%s]",
                minPercentage, maxPercentage, percentageIncrement, resetChancePercentage, minimumSurveySubmissions,
                coldDelayMin, coldDelayMax, warmDelayMin, warmDelayMax, forceFlushEnabled);
    }
}

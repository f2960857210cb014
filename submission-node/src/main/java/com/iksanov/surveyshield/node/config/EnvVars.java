package com.iksanov.surveyshield.node.config;

import com.iksanov.surveyshield.common.exception.ConfigurationException;

import java.util.Map;
import java.util.Objects;

/**
 * Typed lookups over an environment map. Unparsable values fail instead of falling back to defaults.
 */
final class EnvVars {

    private final Map<String, String> env;

    EnvVars(Map<String, String> env) {
        this.env = Objects.requireNonNull(env, "env");
    }

    String get(String key, String defaultValue) {
        String value = env.get(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    String require(String key) {
        String value = env.get(key);
        if (value == null || value.isBlank()) throw new ConfigurationException(key + " is not configured");
        return value.trim();
    }

    int getInt(String key, int defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer", e);
        }
    }

    long getLong(String key, long defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be a number", e);
        }
    }

    boolean getBool(String key, boolean defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) return defaultValue;
        String v = value.trim();
        if ("true".equalsIgnoreCase(v)) return true;
        if ("false".equalsIgnoreCase(v)) return false;
        throw new ConfigurationException(key + " must be true or false");
    }
}

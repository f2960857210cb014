package com.iksanov.surveyshield.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

public final class SecretUtils {

    private SecretUtils() {
    }

    /**
     * Constant-time comparison of a presented secret with the expected one.
     * Returns false when either side is null or empty.
     */
    public static boolean matches(String presented, String expected) {
        if (presented == null || expected == null || presented.isEmpty() || expected.isEmpty()) return false;
        return MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }

    public static String extractBearerToken(String authorizationHeader) {
        if (authorizationHeader == null) return null;
        String value = authorizationHeader.trim();
        if (value.regionMatches(true, 0, "Bearer ", 0, 7)) return value.substring(7).trim();
        return null;
    }
}

package com.iksanov.surveyshield.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SecretUtilsTest {

    @Test
    @DisplayName("matches() accepts only the identical secret")
    void matchesIdenticalSecret() {
        assertTrue(SecretUtils.matches("s3cret", "s3cret"));
        assertFalse(SecretUtils.matches("s3cret", "s3cret "));
        assertFalse(SecretUtils.matches("S3cret", "s3cret"));
    }

    @Test
    @DisplayName("matches() never accepts missing secrets, even when both are missing")
    void missingSecretsNeverMatch() {
        assertFalse(SecretUtils.matches(null, null));
        assertFalse(SecretUtils.matches("", ""));
        assertFalse(SecretUtils.matches("x", null));
        assertFalse(SecretUtils.matches(null, "x"));
    }

    @Test
    @DisplayName("extractBearerToken() handles case and whitespace")
    void extractsBearerToken() {
        assertEquals("abc", SecretUtils.extractBearerToken("Bearer abc"));
        assertEquals("abc", SecretUtils.extractBearerToken("  bearer   abc "));
        assertNull(SecretUtils.extractBearerToken("Basic abc"));
        assertNull(SecretUtils.extractBearerToken(null));
    }
}

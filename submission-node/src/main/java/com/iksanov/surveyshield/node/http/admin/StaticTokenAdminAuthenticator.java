package com.iksanov.surveyshield.node.http.admin;

import com.iksanov.surveyshield.common.util.SecretUtils;

import java.util.Objects;

/**
 * Accepts {@code Authorization: Bearer <token>} when the token equals the configured admin token.
 */
public class StaticTokenAdminAuthenticator implements AdminAuthenticator {

    private final String adminToken;

    public StaticTokenAdminAuthenticator(String adminToken) {
        this.adminToken = Objects.requireNonNull(adminToken, "adminToken");
        if (adminToken.isBlank()) throw new IllegalArgumentException("adminToken cannot be blank");
    }

    @Override
    public boolean isAdmin(String authorizationHeader) {
        return SecretUtils.matches(SecretUtils.extractBearerToken(authorizationHeader), adminToken);
    }
}

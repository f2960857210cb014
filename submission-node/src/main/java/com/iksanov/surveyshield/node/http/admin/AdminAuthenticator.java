package com.iksanov.surveyshield.node.http.admin;

/**
 * Decides whether a request carries administrator credentials.
 */
@FunctionalInterface
public interface AdminAuthenticator {

    boolean isAdmin(String authorizationHeader);
}

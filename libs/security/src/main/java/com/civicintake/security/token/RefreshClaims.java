package com.civicintake.security.token;

/**
 * The verified content of a refresh credential.
 */
public record RefreshClaims(String id, String email) {
}

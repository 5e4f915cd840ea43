package com.civicintake.security.guard;

/**
 * What the guard needs to know about an incoming call. Transport-neutral; the HTTP layer builds
 * one per request.
 *
 * @param authorizationHeader raw {@code Authorization} header value, null when absent
 * @param endpoint            request path, used for auditing
 * @param method              request method, used for auditing
 * @param clientAddress       remote address, may be null
 */
public record GuardRequest(String authorizationHeader, String endpoint, String method, String clientAddress) {

    public static GuardRequest of(String authorizationHeader, String endpoint, String method) {
        return new GuardRequest(authorizationHeader, endpoint, method, null);
    }
}

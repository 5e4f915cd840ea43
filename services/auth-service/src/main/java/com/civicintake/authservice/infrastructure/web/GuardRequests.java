package com.civicintake.authservice.infrastructure.web;

import com.civicintake.authservice.api.ApiResponse;
import com.civicintake.security.guard.GuardOutcome;
import com.civicintake.security.guard.GuardRequest;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;

/**
 * Bridges servlet requests into the guard and guard outcomes back into responses.
 */
public final class GuardRequests {

    private GuardRequests() {
        // utility class
    }

    public static GuardRequest from(HttpServletRequest request) {
        return new GuardRequest(
                request.getHeader(HttpHeaders.AUTHORIZATION),
                request.getRequestURI(),
                request.getMethod(),
                request.getRemoteAddr());
    }

    /**
     * The operation's response when allowed, otherwise the rejection in the envelope with its
     * status.
     */
    public static ResponseEntity<ApiResponse> respond(GuardOutcome<ResponseEntity<ApiResponse>> outcome) {
        return outcome.fold(
                GuardOutcome.Allowed::value,
                rejection -> ResponseEntity.status(rejection.status()).body(ApiResponse.rejected(rejection)));
    }
}

package com.civicintake.authservice.infrastructure.web;

import com.civicintake.observability.CorrelationContext;
import com.civicintake.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation ID for every HTTP request.
 *
 * <p>A client-supplied {@code X-Correlation-ID} is kept, otherwise a UUID is generated. Each
 * request also gets its own request ID. Both go into {@link CorrelationContextHolder}, and from
 * there into the MDC and audit metadata; the correlation ID is echoed on the response.
 *
 * <p>Runs first so every later filter and handler logs with the correlation ID.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final int MAX_CORRELATION_ID_LENGTH = 128;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null
                || correlationId.isBlank()
                || correlationId.length() > MAX_CORRELATION_ID_LENGTH) {
            correlationId = UUID.randomUUID().toString();
        }

        CorrelationContextHolder.set(
                CorrelationContext.anonymous(correlationId, UUID.randomUUID().toString()));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContextHolder.clear();
        }
    }
}

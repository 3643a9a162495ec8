package com.chartgate.gateway.infrastructure.web;

import com.chartgate.observability.CorrelationContext;
import com.chartgate.observability.CorrelationContextHolder;
import com.chartgate.observability.CredentialRedactor;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation id for every HTTP request and gives each request its own
 * request id.
 *
 * <p>The context is set before any handler runs, so the gate can later add the resolved tenant to
 * it, and both ids are echoed back in response headers. Runs first in the filter chain.
 *
 * <p>At DEBUG each request is logged with its headers, credential-bearing ones redacted.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdFilter.class);

    private static final int MAX_CORRELATION_ID_LENGTH = 128;

    private final CredentialRedactor redactor = new CredentialRedactor();

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
        String requestId = UUID.randomUUID().toString();

        CorrelationContextHolder.set(CorrelationContext.of(correlationId, requestId));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        if (log.isDebugEnabled()) {
            log.debug("{} {} headers={}",
                    request.getMethod(), request.getRequestURI(), loggedHeaders(request));
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            // pooled threads: never leak a caller into the next request
            CorrelationContextHolder.clear();
        }
    }

    /** Request headers as they appear in the request log. */
    Map<String, String> loggedHeaders(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, request.getHeader(name));
        }
        return redactor.redact(headers);
    }
}

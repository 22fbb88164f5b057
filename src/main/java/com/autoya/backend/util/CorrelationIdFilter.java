package com.autoya.backend.util;

import java.io.IOException;
import java.util.UUID;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import io.opentelemetry.api.trace.Span;

import lombok.extern.slf4j.Slf4j;

/**
 * Tags every request with a correlation id.
 *
 * A caller-supplied {@value #HEADER} is reused when it parses as a UUID,
 * otherwise a fresh one is issued. The id is echoed in the response header,
 * written to the logging MDC under {@value #MDC_KEY} for the duration of the
 * request and copied into every error body by {@link ErrorResponseFactory}.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Correlation-ID";

    static final String MDC_KEY = "correlationId";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String correlationId = resolve(request.getHeader(HEADER));
        response.setHeader(HEADER, correlationId);
        Span.current().setAttribute("autoya.correlation_id", correlationId);

        MDC.put(MDC_KEY, correlationId);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    /**
     * @return the correlation id of the request being served on this thread,
     *         or null outside a request
     */
    public static String getCurrentCorrelationId() {
        return MDC.get(MDC_KEY);
    }

    static String resolve(String supplied) {
        if (supplied == null || supplied.isBlank()) {
            return UUID.randomUUID().toString();
        }
        try {
            return UUID.fromString(supplied.trim()).toString();
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed {} header: {}", HEADER, supplied);
            return UUID.randomUUID().toString();
        }
    }
}

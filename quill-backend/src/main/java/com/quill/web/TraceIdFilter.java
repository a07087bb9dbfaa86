package com.quill.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every request with a trace id: stored in the MDC under {@code trace_id}, echoed in
 * {@code X-Request-Id} and returned in error bodies.
 *
 * <p>A caller id from {@code X-Request-Id} (or {@code X-Trace-Id}) is reused only when it is a
 * short token of letters, digits, {@code .}, {@code _} or {@code -}; anything else is replaced so
 * that log lines and response headers never carry client-controlled text.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String TRACE_ID_HEADER = "X-Request-Id";
    public static final String ALT_TRACE_ID_HEADER = "X-Trace-Id";
    public static final String MDC_TRACE_ID = "trace_id";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String traceId = resolveTraceId(request);
        MDC.put(MDC_TRACE_ID, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE_ID);
        }
    }

    static String resolveTraceId(HttpServletRequest request) {
        String candidate = request.getHeader(TRACE_ID_HEADER);
        if (candidate == null) {
            candidate = request.getHeader(ALT_TRACE_ID_HEADER);
        }
        if (candidate != null && ACCEPTED_ID.matcher(candidate).matches()) {
            return candidate;
        }
        return newTraceId();
    }

    static String newTraceId() {
        return "q-" + UUID.randomUUID().toString().replace("-", "");
    }
}

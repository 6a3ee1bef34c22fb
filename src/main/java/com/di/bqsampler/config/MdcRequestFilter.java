package com.di.bqsampler.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts {@code requestId} and {@code requestPath} into the MDC for every HTTP request and
 * clears them in {@code finally}. The push controller adds {@code messageId} and
 * {@code commandType}; logback-spring.xml prints all four.
 *
 * <p>Requests arriving through Google front ends reuse the trace id of
 * {@code X-Cloud-Trace-Context} ({@code TRACE_ID/SPAN_ID;o=1}) so log lines can be joined
 * with the Pub/Sub delivery.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcRequestFilter extends OncePerRequestFilter {

    static final String REQUEST_ID = "requestId";
    static final String REQUEST_PATH = "requestPath";
    static final String TRACE_HEADER = "X-Cloud-Trace-Context";

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = requestId(request.getHeader(TRACE_HEADER));
        String path = request.getRequestURI();
        MDC.put(REQUEST_ID, requestId);
        MDC.put(REQUEST_PATH, path != null ? path : "");
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID);
            MDC.remove(REQUEST_PATH);
        }
    }

    static String requestId(String traceHeader) {
        if (traceHeader != null) {
            int end = traceHeader.indexOf('/');
            String traceId = (end >= 0 ? traceHeader.substring(0, end) : traceHeader).trim();
            if (!traceId.isEmpty()) {
                return "trace-" + traceId;
            }
        }
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}

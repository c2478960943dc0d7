package com.querygate.web;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Propagates {@code X-Request-Id} into the logging context so every gateway log line of one call
 * can be correlated with the response. Calls to {@code /v1/operations/{operation}} also carry the
 * operation name.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter implements Filter {

    public static final String TRACE_ID_HEADER = "X-Request-Id";
    public static final String MDC_TRACE_ID = "trace_id";
    public static final String MDC_OPERATION = "operation";

    // Caller-supplied ids end up in log lines and response headers.
    private static final Pattern SAFE_TRACE_ID = Pattern.compile("[A-Za-z0-9._\\-]{1,64}");
    private static final Pattern OPERATION_PATH = Pattern.compile(".*/v1/operations/([A-Za-z0-9_]{1,64})/?");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (request instanceof HttpServletRequest httpServletRequest) {
            String traceId = httpServletRequest.getHeader(TRACE_ID_HEADER);
            if (traceId == null || !SAFE_TRACE_ID.matcher(traceId).matches()) {
                traceId = UUID.randomUUID().toString();
            }

            MDC.put(MDC_TRACE_ID, traceId);

            if (response instanceof HttpServletResponse httpServletResponse) {
                httpServletResponse.setHeader(TRACE_ID_HEADER, traceId);
            }

            String uri = httpServletRequest.getRequestURI();
            Matcher operation = uri == null ? null : OPERATION_PATH.matcher(uri);
            if (operation != null && operation.matches()) {
                MDC.put(MDC_OPERATION, operation.group(1));
            }
        }

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(MDC_OPERATION);
        }
    }
}

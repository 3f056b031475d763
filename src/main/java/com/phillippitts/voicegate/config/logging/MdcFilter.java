package com.phillippitts.voicegate.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Puts the same MDC keys the orchestrator uses ({@code requestId}, {@code tenantId}, {@code operation})
 * into Log4j2's ThreadContext for the operational HTTP endpoints.
 *
 * <p>Caller-supplied ids are reduced to {@code [A-Za-z0-9._:-]} and capped at {@value #MAX_ID_LENGTH}
 * characters before they reach a log line. A missing or unusable request id is replaced with a UUID; the
 * effective id is echoed back in the {@code X-Request-ID} response header.
 *
 * <p>Only the keys set here are removed afterwards.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String TENANT_ID_HEADER = "X-Tenant-ID";
    static final int MAX_ID_LENGTH = 64;

    private static final Pattern UNSAFE_ID_CHARS = Pattern.compile("[^A-Za-z0-9._:-]");
    private static final List<String> KEYS = List.of("requestId", "tenantId", "operation");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        try {
            String requestId = cleanId(http.getHeader(REQUEST_ID_HEADER));
            if (requestId == null) {
                requestId = UUID.randomUUID().toString();
            }
            ThreadContext.put("requestId", requestId);
            if (response instanceof HttpServletResponse httpResponse) {
                httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
            }

            String tenantId = cleanId(http.getHeader(TENANT_ID_HEADER));
            if (tenantId != null) {
                ThreadContext.put("tenantId", tenantId);
            }
            ThreadContext.put("operation", http.getMethod() + " " + http.getRequestURI());

            chain.doFilter(request, response);
        } finally {
            ThreadContext.removeAll(KEYS);
        }
    }

    /**
     * @return sanitized id, or null when nothing usable is left
     */
    static String cleanId(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = UNSAFE_ID_CHARS.matcher(raw.strip()).replaceAll("");
        if (cleaned.length() > MAX_ID_LENGTH) {
            cleaned = cleaned.substring(0, MAX_ID_LENGTH);
        }
        return cleaned.isEmpty() ? null : cleaned;
    }
}

package com.phillippitts.trackembed.config.logging;

import com.phillippitts.trackembed.util.LogSanitizer;
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
import java.util.UUID;

/**
 * Puts request-scoped values into Log4j2's ThreadContext so every log line of a request, and
 * of any pipeline job it submits, can be correlated.
 *
 * <p>Keys: {@code requestId} (X-Request-ID header or a fresh UUID, echoed on the response),
 * {@code userId} (X-User-ID header), {@code method}, {@code uri}, and {@code jobId} when the
 * request addresses a single pipeline job. Header values are truncated and stripped of control
 * characters before they reach the log.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String USER_ID_HEADER = "X-User-ID";
    static final String JOB_PATH_PREFIX = "/api/pipeline/jobs/";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = populate(http);
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    /** @return the request id placed in the context */
    private static String populate(HttpServletRequest http) {
        String requestId = clean(http.getHeader(REQUEST_ID_HEADER));
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        ThreadContext.put("requestId", requestId);

        String userId = clean(http.getHeader(USER_ID_HEADER));
        if (userId != null) {
            ThreadContext.put("userId", userId);
        }

        String uri = http.getRequestURI();
        ThreadContext.put("method", http.getMethod());
        ThreadContext.put("uri", uri);

        String jobId = jobIdFrom(uri);
        if (jobId != null) {
            ThreadContext.put("jobId", jobId);
        }
        return requestId;
    }

    static String jobIdFrom(String uri) {
        if (uri == null || !uri.startsWith(JOB_PATH_PREFIX)) {
            return null;
        }
        String rest = uri.substring(JOB_PATH_PREFIX.length());
        int slash = rest.indexOf('/');
        String token = slash < 0 ? rest : rest.substring(0, slash);
        return clean(token);
    }

    private static String clean(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return LogSanitizer.forLog(raw.strip());
    }
}

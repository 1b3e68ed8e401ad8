package com.phillippitts.clipcast.config.logging;

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
 * Puts {@code requestId}, {@code method} and {@code uri} into the Log4j2 ThreadContext for every
 * REST call and echoes the request id back in {@code X-Request-ID}.
 *
 * <p>The context is always cleared afterwards so values never leak into pooled threads.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = headerOrGenerate(http);
                ThreadContext.put("requestId", requestId);
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String headerOrGenerate(HttpServletRequest req) {
        String v = req.getHeader(REQUEST_ID_HEADER);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}

package com.example.storelab.http;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags each request with an id (taken from {@code X-Request-Id} or generated), exposes it in the
 * MDC and the response header, and logs one line per completed request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestLoggingFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        String rid = req.getHeader(REQUEST_ID_HEADER);
        if (rid == null || rid.isBlank()) {
            rid = UUID.randomUUID().toString();
        }
        MDC.put("requestId", rid);
        res.setHeader(REQUEST_ID_HEADER, rid);

        long start = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } finally {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            int status = res.getStatus();
            if (status >= 500) {
                log.warn("{} {} - {} - {}ms", req.getMethod(), req.getRequestURI(), status, durationMs);
            } else {
                log.info("{} {} - {} - {}ms", req.getMethod(), req.getRequestURI(), status, durationMs);
            }
            MDC.remove("requestId");
        }
    }
}

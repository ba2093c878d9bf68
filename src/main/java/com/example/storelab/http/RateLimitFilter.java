package com.example.storelab.http;

import com.example.storelab.config.RateLimitProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Limits each client address to {@code app.rate-limit.max-requests} calls under {@code /api/}
 * per window. Every limited response carries the RateLimit-* headers; a request over budget
 * gets 429 and is not passed on.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    public static final String LIMIT_HEADER = "RateLimit-Limit";
    public static final String REMAINING_HEADER = "RateLimit-Remaining";
    public static final String RESET_HEADER = "RateLimit-Reset";

    static final String MESSAGE = "Too many requests from this IP, please try again later";

    private final RateLimitProperties properties;
    private final ObjectMapper objectMapper;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public RateLimitFilter(RateLimitProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !properties.isEnabled() || !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        Bucket bucket = buckets.computeIfAbsent(req.getRemoteAddr(), client -> newBucket());
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);

        long resetSeconds = TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForReset());
        res.setHeader(LIMIT_HEADER, String.valueOf(properties.getMaxRequests()));
        res.setHeader(REMAINING_HEADER, String.valueOf(probe.getRemainingTokens()));
        res.setHeader(RESET_HEADER, String.valueOf(resetSeconds));

        if (probe.isConsumed()) {
            chain.doFilter(req, res);
            return;
        }

        log.warn("Rate limit exceeded for {} on {} {}", req.getRemoteAddr(), req.getMethod(), req.getRequestURI());
        res.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        res.setHeader("Retry-After",
                String.valueOf(TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill()) + 1));
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(res.getOutputStream(), ErrorResponse.of("RATE_LIMITED", MESSAGE));
    }

    private Bucket newBucket() {
        return Bucket.builder()
                .addLimit(Bandwidth.builder()
                        .capacity(properties.getMaxRequests())
                        .refillIntervally(properties.getMaxRequests(), Duration.ofMillis(properties.getWindowMs()))
                        .build())
                .build();
    }
}

package com.example.storelab.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-client request budget for {@code /api/**}. Bound from application.yml (app.rate-limit.*)
 * and registered by {@link WebConfig}.
 */
@ConfigurationProperties(prefix = "app.rate-limit")
@Data
public class RateLimitProperties {

    private boolean enabled = true;
    private long windowMs = 900_000;  // 15 minutes
    private long maxRequests = 100;
}

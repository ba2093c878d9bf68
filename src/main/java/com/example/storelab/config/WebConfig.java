package com.example.storelab.config;

import com.example.storelab.http.RateLimitFilter;
import com.example.storelab.http.RequestLoggingFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Cross-origin access for browser clients. Any origin is allowed unless
 * {@code app.cors.allowed-origins} narrows it.
 */
@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class WebConfig implements WebMvcConfigurer {

    private final String[] allowedOrigins;

    public WebConfig(@Value("${app.cors.allowed-origins:*}") String[] allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(allowedOrigins)
                .allowedMethods("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS")
                .exposedHeaders(RequestLoggingFilter.REQUEST_ID_HEADER,
                        RateLimitFilter.LIMIT_HEADER,
                        RateLimitFilter.REMAINING_HEADER,
                        RateLimitFilter.RESET_HEADER);
    }
}

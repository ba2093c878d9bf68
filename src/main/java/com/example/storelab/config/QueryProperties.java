package com.example.storelab.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Limits applied by the list, search and low-stock queries.
 * Bound from application.yml (app.query.*); the defaults below apply when a key is missing.
 */
@Component
@ConfigurationProperties(prefix = "app.query")
@Data
public class QueryProperties {

    private int maxPageSize = 100;  // list requests asking for more are clamped
    private int searchLimit = 50;
    private int lowStockThreshold = 10;
}

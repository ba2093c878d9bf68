package com.example.storelab.http;

import com.example.storelab.models.ProductStats;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

public record ProductStatsResponse(
        @JsonProperty("category") String category,
        @JsonProperty("count") long count,
        @JsonProperty("avgPrice") BigDecimal avgPrice,
        @JsonProperty("totalQuantity") long totalQuantity
) {
    public static ProductStatsResponse from(ProductStats stats) {
        return new ProductStatsResponse(stats.category(), stats.count(), stats.avgPrice(), stats.totalQuantity());
    }
}

package com.example.storelab.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/**
 * HTTP payload for creating or partially updating a product. On update, null fields mean
 * "leave unchanged". Price accepts both JSON numbers and numeric strings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProductHttpRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("price") BigDecimal price,
        @JsonProperty("quantity") Integer quantity,
        @JsonProperty("category") String category,
        @JsonProperty("status") String status
) {}

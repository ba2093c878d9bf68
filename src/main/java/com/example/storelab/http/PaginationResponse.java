package com.example.storelab.http;

import com.example.storelab.query.PagedResult;
import com.fasterxml.jackson.annotation.JsonProperty;

public record PaginationResponse(
        @JsonProperty("total") long total,
        @JsonProperty("page") int page,
        @JsonProperty("limit") int limit,
        @JsonProperty("pages") long pages
) {
    public static PaginationResponse from(PagedResult<?> result) {
        return new PaginationResponse(result.total(), result.page(), result.limit(), result.pages());
    }
}

package com.example.storelab.requests;

import com.example.storelab.query.PageSpec;
import java.util.Map;
import java.util.Objects;

/**
 * Service-layer command for a paginated list: the requested page plus the raw query parameters,
 * from which each service keeps only the filters it allows.
 */
public record ListRecordsServiceRequest(
        PageSpec page,
        Map<String, String> parameters
) {

    public ListRecordsServiceRequest {
        Objects.requireNonNull(page, "page");
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public static ListRecordsServiceRequest of(int page, int limit, Map<String, String> parameters) {
        return new ListRecordsServiceRequest(PageSpec.of(page, limit), parameters);
    }
}

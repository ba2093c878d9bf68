package com.example.storelab.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns raw request parameters into equality criteria for the allowed fields only. Unknown keys
 * and blank values are ignored.
 */
public final class FilterWhitelist {

    private final List<String> fields;

    private FilterWhitelist(List<String> fields) {
        this.fields = List.copyOf(fields);
    }

    public static FilterWhitelist of(String... fields) {
        return new FilterWhitelist(List.of(fields));
    }

    public List<Criterion> apply(Map<String, String> parameters) {
        List<Criterion> criteria = new ArrayList<>();
        if (parameters == null) {
            return criteria;
        }
        for (String field : fields) {
            String value = parameters.get(field);
            if (value != null && !value.isBlank()) {
                criteria.add(Criterion.eq(field, value));
            }
        }
        return criteria;
    }
}

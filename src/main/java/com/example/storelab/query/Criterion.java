package com.example.storelab.query;

import java.util.Objects;

/**
 * One {field, operator, value} predicate. Field names are the domain names (for example
 * {@code createdAt}); each backend adapter maps them onto its own storage names.
 */
public record Criterion(String field, Operator operator, Object value) {

    public Criterion {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        if (field.isBlank()) {
            throw new IllegalArgumentException("field must be non-blank");
        }
        if (operator == Operator.CONTAINS_IGNORE_CASE && !(value instanceof String)) {
            throw new IllegalArgumentException("CONTAINS_IGNORE_CASE requires a string value");
        }
    }

    public static Criterion eq(String field, Object value) {
        return new Criterion(field, Operator.EQ, value);
    }

    public static Criterion gte(String field, Object value) {
        return new Criterion(field, Operator.GTE, value);
    }

    public static Criterion lte(String field, Object value) {
        return new Criterion(field, Operator.LTE, value);
    }

    public static Criterion containsIgnoreCase(String field, String text) {
        return new Criterion(field, Operator.CONTAINS_IGNORE_CASE, text);
    }
}

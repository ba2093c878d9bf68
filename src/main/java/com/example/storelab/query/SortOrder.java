package com.example.storelab.query;

import java.util.Objects;

public record SortOrder(String field, boolean ascending) {

    public SortOrder {
        Objects.requireNonNull(field, "field");
    }

    public static SortOrder asc(String field) {
        return new SortOrder(field, true);
    }

    public static SortOrder desc(String field) {
        return new SortOrder(field, false);
    }
}

package com.example.storelab.models;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

public enum ProductStatus implements StatusValue {
    AVAILABLE("available"),
    OUT_OF_STOCK("out_of_stock"),
    DISCONTINUED("discontinued");

    public static final ProductStatus DEFAULT = AVAILABLE;

    private final String value;

    ProductStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<ProductStatus> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(s -> s.value.equals(raw))
                .findFirst();
    }
}

package com.example.storelab.models;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

public enum UserStatus implements StatusValue {
    ACTIVE("active"),
    INACTIVE("inactive"),
    PENDING("pending");

    public static final UserStatus DEFAULT = ACTIVE;

    private final String value;

    UserStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<UserStatus> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(s -> s.value.equals(raw))
                .findFirst();
    }
}

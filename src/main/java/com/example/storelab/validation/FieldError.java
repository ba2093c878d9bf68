package com.example.storelab.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FieldError(
        @JsonProperty("field") String field,
        @JsonProperty("message") String message
) {

    /**
     * Same error re-keyed under a batch position, e.g. {@code [2].email}.
     */
    public FieldError atIndex(int index) {
        return new FieldError("[" + index + "]." + field, message);
    }
}

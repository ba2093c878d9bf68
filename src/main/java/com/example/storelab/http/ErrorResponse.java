package com.example.storelab.http;

import com.example.storelab.validation.FieldError;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("code") String code,
        @JsonProperty("message") String message,
        @JsonProperty("errors") List<FieldError> errors,
        @JsonProperty("field") String field,
        @JsonProperty("detail") String detail
) {
    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(false, code, message, null, null, null);
    }

    public ErrorResponse withDetail(String value) {
        return new ErrorResponse(success, code, message, errors, field, value);
    }
}

package com.example.storelab.service;

import com.example.storelab.validation.FieldError;
import java.util.List;
import lombok.Getter;

public class StoreLabException extends RuntimeException {

    public enum Code {
        VALIDATION_FAILED,
        SEARCH_QUERY_REQUIRED,
        USER_NOT_FOUND,
        PRODUCT_NOT_FOUND,
        DUPLICATE_FIELD,
        UNKNOWN
    }

    @Getter
    private final Code code;

    @Getter
    private final List<FieldError> errors;

    @Getter
    private final String field;

    private StoreLabException(Code code, String message, List<FieldError> errors, String field, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.field = field;
    }

    public static StoreLabException validationFailed(List<FieldError> errors) {
        return new StoreLabException(Code.VALIDATION_FAILED, "Validation Error", errors, null, null);
    }

    public static StoreLabException searchQueryRequired() {
        return new StoreLabException(Code.SEARCH_QUERY_REQUIRED, "Search query is required", null, null, null);
    }

    public static StoreLabException userNotFound(String id) {
        return new StoreLabException(Code.USER_NOT_FOUND, "User " + id + " not found", null, null, null);
    }

    public static StoreLabException productNotFound(String id) {
        return new StoreLabException(Code.PRODUCT_NOT_FOUND, "Product " + id + " not found", null, null, null);
    }

    public static StoreLabException duplicateField(String field, Throwable cause) {
        return new StoreLabException(Code.DUPLICATE_FIELD, "Duplicate entry", null, field, cause);
    }
}

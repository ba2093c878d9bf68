package com.example.storelab.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Runs the Bean Validation constraints declared on a model and returns one {@link FieldError}
 * per failed constraint, ordered by field then message so responses are stable.
 */
@Component
public class RecordValidator {

    private final Validator validator;

    public RecordValidator(Validator validator) {
        this.validator = validator;
    }

    public <T> List<FieldError> validate(T candidate) {
        return validator.validate(candidate).stream()
                .map(RecordValidator::toFieldError)
                .sorted(Comparator.comparing(FieldError::field).thenComparing(FieldError::message))
                .toList();
    }

    private static FieldError toFieldError(ConstraintViolation<?> violation) {
        return new FieldError(violation.getPropertyPath().toString(), violation.getMessage());
    }
}

package com.example.storelab.http;

import com.example.storelab.service.StoreLabException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to the error envelope. Only the local and development environments get
 * exception detail in 5xx bodies.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    private final boolean exposeDetail;

    public ApiExceptionHandler(@Value("${app.env:local}") String env) {
        this.exposeDetail = "local".equals(env) || "development".equals(env);
    }

    @ExceptionHandler(StoreLabException.class)
    public ResponseEntity<ErrorResponse> domainError(StoreLabException ex) {
        HttpStatus status;
        switch (ex.getCode()) {
            case VALIDATION_FAILED, SEARCH_QUERY_REQUIRED, DUPLICATE_FIELD -> status = HttpStatus.BAD_REQUEST;
            case USER_NOT_FOUND, PRODUCT_NOT_FOUND -> status = HttpStatus.NOT_FOUND;
            default -> status = HttpStatus.INTERNAL_SERVER_ERROR;
        }

        return ResponseEntity.status(status)
                .body(new ErrorResponse(
                        false,
                        ex.getCode().name(),
                        ex.getMessage(),
                        ex.getErrors().isEmpty() ? null : ex.getErrors(),
                        ex.getField(),
                        null));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badReq(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("BAD_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> malformed(Exception ex) {
        log.debug("Rejected malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("MALFORMED_REQUEST", "Malformed request"));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> integrity(DataIntegrityViolationException ex) {
        log.warn("Write rejected by the data store: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(
                withDetail(ErrorResponse.of("DATA_INTEGRITY", "Write rejected by the data store"), ex));
    }

    @ExceptionHandler({
            DataAccessResourceFailureException.class,
            TransientDataAccessResourceException.class,
            QueryTimeoutException.class
    })
    public ResponseEntity<ErrorResponse> exhausted(Exception ex) {
        log.warn("Data store unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                withDetail(ErrorResponse.of("RESOURCE_EXHAUSTED", "Data store is unavailable, try again later"), ex));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> noRoute(NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of("ROUTE_NOT_FOUND", "Route not found"));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> methodNotAllowed(HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(ErrorResponse.of("METHOD_NOT_ALLOWED", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> boom(Exception ex) {
        log.error("Unexpected error handling request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(withDetail(ErrorResponse.of("INTERNAL_ERROR", "Internal Server Error"), ex));
    }

    private ErrorResponse withDetail(ErrorResponse body, Exception ex) {
        return exposeDetail ? body.withDetail(ex.toString()) : body;
    }
}

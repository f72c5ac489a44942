package com.di.querybench.exception;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the error taxonomy ({@link ErrorCategory}) to HTTP statuses and a uniform error body.
 *
 * <p>Configuration and argument errors are the caller's fault (400). An incomplete dataset
 * conflicts with the requested benchmark (409). Load and query failures are store errors (500).
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IncompleteDatasetException.class)
    public ResponseEntity<ErrorResponse> handleIncompleteDataset(IncompleteDatasetException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("INCOMPLETE_DATASET", category, e);
        ErrorResponse body = buildErrorResponse(category, e, HttpStatus.CONFLICT);
        body.addDetail("variant", e.getResult().getVariant().getId());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler({DatasetLoadException.class, DataAccessException.class})
    public ResponseEntity<ErrorResponse> handleStoreException(RuntimeException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("STORE_EXCEPTION", category, e);
        ErrorResponse body = buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR);
        if (e instanceof DatasetLoadException load && load.getEntityLabel() != null) {
            body.addDetail("entity", load.getEntityLabel());
            body.addDetail("batchNumber", load.getBatchNumber());
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    /**
     * Request parameters rejected by their constraint annotations.
     */
    @ExceptionHandler({ConstraintViolationException.class, MethodArgumentNotValidException.class,
                       HandlerMethodValidationException.class})
    public ResponseEntity<ErrorResponse> handleConstraintViolation(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("CONSTRAINT_VIOLATION", category, e);
        ErrorResponse body = buildErrorResponse(category, e, HttpStatus.BAD_REQUEST);
        if (e instanceof ConstraintViolationException cve) {
            List<String> violations = cve.getConstraintViolations().stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.toList());
            body.addDetail("violations", violations);
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    /**
     * Configuration errors, dependency errors and invalid request arguments.
     */
    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(RuntimeException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        HttpStatus status = category == ErrorCategory.DEPENDENCY_ERROR
                ? HttpStatus.INTERNAL_SERVER_ERROR
                : HttpStatus.BAD_REQUEST;
        logError("VALIDATION_EXCEPTION", category, e);
        return ResponseEntity.status(status).body(buildErrorResponse(category, e, status));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("UNHANDLED_EXCEPTION", category, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception) {
        log.error("[{}] {} [{}] runId={}", eventType, exception.getClass().getSimpleName(),
                  category.getName(), MDC.get("runId"), exception);
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    /**
     * Structured error response for API endpoints.
     */
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String errorCategoryDescription;
        private Map<String, Object> details = new HashMap<>();

        public String getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(String timestamp) {
            this.timestamp = timestamp;
        }

        public int getStatus() {
            return status;
        }

        public void setStatus(int status) {
            this.status = status;
        }

        public String getError() {
            return error;
        }

        public void setError(String error) {
            this.error = error;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }

        public String getErrorCategory() {
            return errorCategory;
        }

        public void setErrorCategory(String errorCategory) {
            this.errorCategory = errorCategory;
        }

        public String getErrorCategoryName() {
            return errorCategoryName;
        }

        public void setErrorCategoryName(String errorCategoryName) {
            this.errorCategoryName = errorCategoryName;
        }

        public String getErrorCategoryDescription() {
            return errorCategoryDescription;
        }

        public void setErrorCategoryDescription(String errorCategoryDescription) {
            this.errorCategoryDescription = errorCategoryDescription;
        }

        public Map<String, Object> getDetails() {
            return details;
        }

        public void setDetails(Map<String, Object> details) {
            this.details = details;
        }

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}

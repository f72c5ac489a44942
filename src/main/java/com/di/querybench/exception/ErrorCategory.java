package com.di.querybench.exception;

import jakarta.validation.ValidationException;
import org.springframework.dao.DataAccessException;
import org.springframework.validation.BindException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error taxonomy of the loader and the benchmark.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 */
public enum ErrorCategory {

    CONFIGURATION_ERROR("Configuration error", "Load or benchmark configuration is invalid"),
    DEPENDENCY_ERROR("Dependency error", "An entity was generated before the entities it references"),
    STORE_ERROR("Store error", "A database write or query failed"),
    INCOMPLETE_DATASET("Incomplete dataset", "Stored row counts do not match the load configuration"),
    VALIDATION_ERROR("Validation error", "Invalid request argument"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. The specific subclasses precede the generic validation check. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof DatasetConfigurationException, CONFIGURATION_ERROR);
        MATCHERS.put(t -> t instanceof MissingReferenceException, DEPENDENCY_ERROR);
        MATCHERS.put(t -> t instanceof IncompleteDatasetException, INCOMPLETE_DATASET);
        MATCHERS.put(ErrorCategory::isStoreError, STORE_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return UNKNOWN;
    }

    private static boolean isStoreError(Throwable t) {
        return t instanceof DatasetLoadException
                || t instanceof DataAccessException
                || t instanceof SQLException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof ValidationException
                || t instanceof BindException
                || t instanceof HandlerMethodValidationException;
    }

    @Override
    public String toString() {
        return name();
    }
}

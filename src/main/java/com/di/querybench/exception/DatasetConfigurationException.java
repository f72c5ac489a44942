package com.di.querybench.exception;

/**
 * Invalid load configuration (cardinalities, batch size, schema variants). Raised before
 * anything is written to the store.
 */
public class DatasetConfigurationException extends IllegalArgumentException {

    public DatasetConfigurationException(String message) {
        super(message);
    }
}

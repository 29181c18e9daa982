package com.phonepe.memsight.core.errors;

/**
 * Validation failures in the parameters passed to the engine
 */
public class ParameterValidationError extends RuntimeException {
    public ParameterValidationError(final String message) {
        super(message);
    }
}

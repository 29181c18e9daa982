package com.phonepe.memsight.core.errors;

import lombok.Getter;

/**
 * Base for all unchecked failures carrying an {@link ErrorType}
 */
@Getter
public class MemsightException extends RuntimeException {
    private final transient MemsightError error;

    public MemsightException(MemsightError error) {
        super(error.getMessage());
        this.error = error;
    }

    public MemsightException(MemsightError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public ErrorType getErrorType() {
        return error.getErrorType();
    }

    public boolean isRetryable() {
        return error.getErrorType().isRetryable();
    }
}
